/*
 [File Info]
 path: src/test/java/tech/robd/jconveyor/BackpressureTest.java
 description: Bounded-queue backpressure: producers stall at capacity and resume as workers drain.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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

package tech.robd.jconveyor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jconveyor.tools.TestAwaitUtils;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class BackpressureTest {

    @Test
    @Timeout(10)
    void boundedQueueNeverHoldsMoreThanCapacity() throws Exception {
        try (Conveyor conveyor = Conveyor.create(2, 2)) {
            AtomicInteger ran = new AtomicInteger();
            JobHandle h = conveyor.submitJob(ctx -> {
                for (int i = 0; i < 200; i++) {
                    ctx.submit(() -> {
                        Thread.sleep(1);
                        ran.incrementAndGet();
                    });
                }
            });
            conveyor.waitUntilDone(h);

            assertEquals(200, ran.get());
            ConveyorStats stats = conveyor.stats();
            assertEquals(2, stats.queueCapacity());
            assertTrue(stats.queueHighWaterMark() <= 2, "high-water mark " + stats.queueHighWaterMark());
            assertEquals(200, conveyor.status(h).tasksExecuted());
        }
    }

    @Test
    @Timeout(5)
        // Single worker held on a gate: the gate task plus two queued tasks are accepted, the fourth blocks.
    void producerStallsWhileQueueIsFull() throws Exception {
        try (Conveyor conveyor = Conveyor.create(1, 2)) {
            CountDownLatch gate = new CountDownLatch(1);
            AtomicInteger accepted = new AtomicInteger();
            AtomicInteger ran = new AtomicInteger();

            JobHandle h = conveyor.submitJob(ctx -> {
                ctx.submit(() -> {
                    gate.await();
                    ran.incrementAndGet();
                });
                accepted.incrementAndGet();
                for (int i = 0; i < 9; i++) {
                    ctx.submit(ran::incrementAndGet);
                    accepted.incrementAndGet();
                }
            });

            TestAwaitUtils.awaitTrue(() -> accepted.get() == 3, 2000, "producer never filled the queue");
            Thread.sleep(100);
            assertEquals(3, accepted.get(), "producer must block on a full queue");
            assertEquals(2, conveyor.stats().queuedTasks());
            assertFalse(conveyor.waitUntilAllTasksPushed(h, Duration.ofMillis(50)));
            assertEquals(JobState.PRODUCING, conveyor.status(h).state());

            gate.countDown();
            conveyor.waitUntilDone(h);

            assertEquals(10, accepted.get());
            assertEquals(10, ran.get());
            assertEquals(JobState.COMPLETED, conveyor.status(h).state());
            assertEquals(2, conveyor.stats().queueHighWaterMark());
        }
    }

    @Test
    @Timeout(10)
        // Two jobs sharing a full queue both make progress once workers free up.
    void competingProducersShareTheBound() throws Exception {
        try (Conveyor conveyor = Conveyor.create(2, 1)) {
            AtomicInteger a = new AtomicInteger();
            AtomicInteger b = new AtomicInteger();
            JobHandle ha = conveyor.submitJob(ctx -> {
                for (int i = 0; i < 100; i++) ctx.submit(a::incrementAndGet);
            });
            JobHandle hb = conveyor.submitJob(ctx -> {
                for (int i = 0; i < 100; i++) ctx.submit(b::incrementAndGet);
            });
            conveyor.waitUntilDone(ha);
            conveyor.waitUntilDone(hb);

            assertEquals(100, a.get());
            assertEquals(100, b.get());
            assertTrue(conveyor.stats().queueHighWaterMark() <= 1);
        }
    }
}
