/*
 [File Info]
 path: src/test/java/tech/robd/jconveyor/tools/TestAwaitUtils.java
 description: Deterministic wait helpers for conveyor tests: awaitTrue, awaitLatch, awaitDone for job handles, and thread-state probes.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jconveyor.tools;

import tech.robd.jconveyor.Conveyor;
import tech.robd.jconveyor.JobHandle;
import tech.robd.jconveyor.JobSnapshot;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a boolean condition until true or timeout (fails the test on timeout).
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + msg);
            }
        }
        if (!cond.getAsBoolean()) fail(msg);
    }

    /**
     * Await a CountDownLatch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Wait until the job's current run is over and return its final snapshot.
     */
    public static JobSnapshot awaitDone(Conveyor conveyor, JobHandle handle, long timeoutMs) {
        try {
            assertTrue(conveyor.waitUntilDone(handle, Duration.ofMillis(timeoutMs)),
                    handle + " did not finish within " + timeoutMs + "ms: " + conveyor.status(handle));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for " + handle);
        }
        return conveyor.status(handle);
    }

    /**
     * Wait until {@code t} is parked (WAITING or TIMED_WAITING), i.e. blocked on a lock or condition.
     */
    public static void awaitParked(Thread t, long timeoutMs) {
        awaitTrue(() -> t.getState() == Thread.State.WAITING || t.getState() == Thread.State.TIMED_WAITING,
                timeoutMs, t.getName() + " never blocked, state=" + t.getState());
    }

    /**
     * @return whether any live thread's name starts with {@code prefix}
     */
    public static boolean anyThreadAlive(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.isAlive() && t.getName().startsWith(prefix));
    }
}
