/*
 [File Info]
 path: src/test/java/tech/robd/jconveyor/ConveyorBasicsTest.java
 description: End-to-end fan-out/gather: buffer fill, completion ordering, concurrent independent jobs, global FIFO order, all-pushed waits.
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class ConveyorBasicsTest {

    @Test
    @Timeout(5)
        // 1000 tasks each set one slot and bump a shared counter; after waitUntilDone every slot is set.
    void fanOutFillsEveryBufferSlot() throws Exception {
        int[] buffer = new int[1000];
        AtomicInteger counter = new AtomicInteger();
        AtomicInteger completions = new AtomicInteger();

        try (Conveyor conveyor = Conveyor.create(4, 0)) {
            JobHandle h = conveyor.submitJob(Job.of(
                    ctx -> {
                        for (int i = 0; i < buffer.length; i++) {
                            int slot = i;
                            ctx.submit(() -> {
                                buffer[slot] = 42;
                                counter.incrementAndGet();
                            });
                        }
                    },
                    ctx -> completions.incrementAndGet()));

            conveyor.waitUntilDone(h);

            assertTrue(Arrays.stream(buffer).allMatch(v -> v == 42));
            assertEquals(1000, counter.get());
            assertEquals(1, completions.get(), "completion runs exactly once per run");

            JobSnapshot s = conveyor.status(h);
            assertEquals(JobState.COMPLETED, s.state());
            assertEquals(0, s.outstanding());
            assertEquals(1000, s.tasksSubmitted());
            assertEquals(1000, s.tasksExecuted());
            assertEquals(0, s.tasksFailed());
            assertNull(s.failure());
            assertTrue(conveyor.isDone(h));
            assertEquals(0, conveyor.outstandingTasks(h));
        }
    }

    @Test
    @Timeout(5)
        // Completion sees every task's effect, and the job is not yet observable as done while it runs.
    void completionRunsAfterLastTaskAndBeforeDone() throws Exception {
        AtomicLong sum = new AtomicLong();
        AtomicLong seenInCompletion = new AtomicLong(-1);
        AtomicBoolean doneDuringCompletion = new AtomicBoolean(true);
        AtomicInteger stateDuringCompletion = new AtomicInteger(-1);

        try (Conveyor conveyor = Conveyor.create(3, 0)) {
            JobHandle h = conveyor.submitJob(Job.of(
                    ctx -> {
                        for (int i = 1; i <= 200; i++) {
                            int v = i;
                            ctx.submit(() -> {
                                Thread.sleep(v % 3);
                                sum.addAndGet(v);
                            });
                        }
                    },
                    ctx -> {
                        seenInCompletion.set(sum.get());
                        doneDuringCompletion.set(ctx.conveyor().isDone(ctx.handle()));
                        stateDuringCompletion.set(ctx.conveyor().status(ctx.handle()).state().ordinal());
                    }));

            conveyor.waitUntilDone(h);

            assertEquals(200L * 201 / 2, seenInCompletion.get());
            assertFalse(doneDuringCompletion.get());
            assertEquals(JobState.COMPLETING.ordinal(), stateDuringCompletion.get());
        }
    }

    @Test
    @Timeout(5)
        // Two jobs share the pool; each job's own count drains to zero without cross-talk.
    void concurrentJobsDrainIndependently() throws Exception {
        AtomicInteger aRuns = new AtomicInteger();
        AtomicInteger bRuns = new AtomicInteger();
        CountDownLatch bothProducing = new CountDownLatch(2);

        try (Conveyor conveyor = Conveyor.create(4, 0)) {
            Job a = ctx -> {
                bothProducing.countDown();
                bothProducing.await();
                for (int i = 0; i < 50; i++) ctx.submit(aRuns::incrementAndGet);
            };
            Job b = ctx -> {
                bothProducing.countDown();
                bothProducing.await();
                for (int i = 0; i < 50; i++) ctx.submit(bRuns::incrementAndGet);
            };
            JobHandle ha = conveyor.submitJob(a);
            JobHandle hb = conveyor.submitJob(b);

            JobSnapshot sa = TestAwaitUtils.awaitDone(conveyor, ha, 3000);
            JobSnapshot sb = TestAwaitUtils.awaitDone(conveyor, hb, 3000);

            assertEquals(JobState.COMPLETED, sa.state());
            assertEquals(JobState.COMPLETED, sb.state());
            assertEquals(50, sa.tasksExecuted());
            assertEquals(50, sb.tasksExecuted());
            assertEquals(0, sa.outstanding());
            assertEquals(0, sb.outstanding());
            assertEquals(50, aRuns.get());
            assertEquals(50, bRuns.get());
            assertEquals(100, conveyor.stats().tasksExecuted());
        }
    }

    @Test
    @Timeout(5)
        // Single worker: execution order equals submission order even when jobs interleave.
        // Race-avoidance: a gate task holds the worker until everything is queued.
    void singleWorkerExecutesInGlobalSubmissionOrder() throws Exception {
        CountDownLatch holdProduction = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        List<String> executed = Collections.synchronizedList(new ArrayList<>());
        List<String> expected = new ArrayList<>();

        try (Conveyor conveyor = Conveyor.create(1, 0)) {
            Job holder = ctx -> holdProduction.await();
            JobHandle a = conveyor.submitJob(holder);
            JobHandle b = conveyor.submitJob(ctx -> holdProduction.await());

            conveyor.submitTask(a, gate::await);
            for (int i = 0; i < 20; i++) {
                JobHandle owner = i % 3 == 0 ? b : a;
                String tag = (owner == a ? "a" : "b") + i;
                expected.add(tag);
                conveyor.submitTask(owner, () -> executed.add(tag));
            }

            gate.countDown();
            holdProduction.countDown();
            conveyor.waitUntilDone(a);
            conveyor.waitUntilDone(b);

            assertEquals(expected, executed);
        }
    }

    @Test
    @Timeout(5)
    void waitUntilAllTasksPushedTracksProductionOnly() throws Exception {
        CountDownLatch releaseProduction = new CountDownLatch(1);
        CountDownLatch releaseTask = new CountDownLatch(1);

        try (Conveyor conveyor = Conveyor.create(2, 0)) {
            JobHandle h = conveyor.submitJob(ctx -> {
                ctx.submit(releaseTask::await);
                releaseProduction.await();
            });

            assertFalse(conveyor.waitUntilAllTasksPushed(h, Duration.ofMillis(100)));

            releaseProduction.countDown();
            conveyor.waitUntilAllTasksPushed(h);
            assertFalse(conveyor.isDone(h), "the pushed task is still blocked");
            assertEquals(1, conveyor.outstandingTasks(h));
            assertFalse(conveyor.waitUntilDone(h, Duration.ofMillis(50)));

            releaseTask.countDown();
            assertEquals(JobState.COMPLETED, TestAwaitUtils.awaitDone(conveyor, h, 2000).state());
        }
    }

    @Test
    @Timeout(5)
        // Tasks can fan out further: a task submitting into its own job keeps the job open.
    void tasksMaySubmitMoreTasksForTheirJob() throws Exception {
        AtomicInteger leaves = new AtomicInteger();

        try (Conveyor conveyor = Conveyor.create(2, 0)) {
            JobHandle h = conveyor.submitJob(ctx -> {
                for (int i = 0; i < 10; i++) {
                    ctx.submit(() -> {
                        for (int j = 0; j < 10; j++) ctx.submit(leaves::incrementAndGet);
                    });
                }
            });

            JobSnapshot s = TestAwaitUtils.awaitDone(conveyor, h, 3000);
            assertEquals(JobState.COMPLETED, s.state());
            assertEquals(100, leaves.get());
            assertEquals(110, s.tasksExecuted());
        }
    }

    @Test
    @Timeout(5)
    void jobContextCarriesHandleRunAndConveyor() throws Exception {
        try (Conveyor conveyor = Conveyor.create(1, 0)) {
            List<Object> seen = Collections.synchronizedList(new ArrayList<>());
            JobHandle h = conveyor.submitJob(ctx -> {
                seen.add(ctx.handle());
                seen.add(ctx.run());
                seen.add(ctx.conveyor());
            });
            conveyor.waitUntilDone(h);
            assertEquals(List.of(h, 1, conveyor), seen);
        }
    }
}
