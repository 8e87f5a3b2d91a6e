/*
 [File Info]
 path: src/test/java/tech/robd/jconveyor/internal/TaskQueueTest.java
 description: TaskQueue semantics: global FIFO across jobs, backpressure at capacity, unbounded mode, shutdown broadcast and discard accounting, rejected acceptance.
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

package tech.robd.jconveyor.internal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jconveyor.ConveyorShutdownException;
import tech.robd.jconveyor.IllegalJobStateException;
import tech.robd.jconveyor.Job;
import tech.robd.jconveyor.JobContext;
import tech.robd.jconveyor.JobState;
import tech.robd.jconveyor.TaskAction;
import tech.robd.jconveyor.tools.TestAwaitUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class TaskQueueTest {

    private static final TaskAction NOOP = () -> { };

    private final JobRegistry registry = new JobRegistry();

    private JobRecord newRecord() {
        // a fresh instance per call; the registry tracks jobs by identity
        return registry.insert(new Job() {
            @Override
            public void produce(JobContext ctx) {
            }
        });
    }

    @Test
    void dequeuesInInsertionOrderAcrossJobs() throws Exception {
        TaskQueue q = new TaskQueue(0);
        JobRecord a = newRecord();
        JobRecord b = newRecord();

        List<TaskItem> pushed = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            pushed.add(new TaskItem(a, NOOP));
            pushed.add(new TaskItem(b, NOOP));
        }
        for (TaskItem item : pushed) q.enqueue(item);

        List<TaskItem> popped = new ArrayList<>();
        for (int i = 0; i < pushed.size(); i++) popped.add(q.dequeue());

        assertEquals(pushed, popped);
        assertEquals(5, a.outstanding(), "acceptance counts toward the owner");
        assertEquals(5, b.outstanding());
    }

    @Test
    void zeroCapacityIsUnbounded() throws Exception {
        TaskQueue q = new TaskQueue(0);
        JobRecord a = newRecord();
        for (int i = 0; i < 10_000; i++) q.enqueue(new TaskItem(a, NOOP));
        assertEquals(10_000, q.size());
        assertEquals(10_000, q.highWaterMark());
        assertEquals(0, q.capacity());
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TaskQueue(-1));
    }

    @Test
    @Timeout(3)
        // Backpressure: third enqueue on a capacity-2 queue parks until a dequeue frees a slot.
        // Race-avoidance: awaitParked confirms the producer is blocked before we assert the size.
    void enqueueBlocksAtCapacityUntilSpaceFrees() throws Exception {
        TaskQueue q = new TaskQueue(2);
        JobRecord a = newRecord();
        q.enqueue(new TaskItem(a, NOOP));
        q.enqueue(new TaskItem(a, NOOP));

        Thread producer = new Thread(() -> {
            try {
                q.enqueue(new TaskItem(a, NOOP));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "blocked-producer");
        producer.start();

        TestAwaitUtils.awaitParked(producer, 1000);
        assertEquals(2, q.size(), "queue never exceeds its capacity");
        assertEquals(2, a.outstanding(), "blocked task is not counted yet");

        assertNotNull(q.dequeue());
        producer.join(1000);
        assertFalse(producer.isAlive(), "producer should complete once a slot frees");
        assertEquals(2, q.size());
        assertEquals(3, a.outstanding());
        assertEquals(2, q.highWaterMark());
    }

    @Test
    @Timeout(3)
        // Shutdown is a broadcast: every parked consumer sees it, not just one.
    void shutdownReleasesEveryWaitingConsumer() throws Exception {
        TaskQueue q = new TaskQueue(0);
        List<Thread> consumers = new ArrayList<>();
        List<AtomicReference<Object>> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            AtomicReference<Object> seen = new AtomicReference<>("unset");
            results.add(seen);
            Thread t = new Thread(() -> {
                try {
                    seen.set(q.dequeue());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "consumer-" + i);
            consumers.add(t);
            t.start();
        }
        for (Thread t : consumers) TestAwaitUtils.awaitParked(t, 1000);

        q.shutdown();

        for (Thread t : consumers) {
            t.join(1000);
            assertFalse(t.isAlive());
        }
        for (AtomicReference<Object> seen : results) assertNull(seen.get());
        assertNull(q.dequeue(), "later consumers also observe shutdown");
        assertTrue(q.isShutdown());
    }

    @Test
    @Timeout(3)
    void shutdownDropsQueuedItemsAndSettlesTheirOwners() throws Exception {
        TaskQueue q = new TaskQueue(1);
        JobRecord a = newRecord();
        q.enqueue(new TaskItem(a, NOOP));

        AtomicReference<Throwable> producerFailure = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                q.enqueue(new TaskItem(a, NOOP));
            } catch (Throwable t) {
                producerFailure.set(t);
            }
        }, "full-queue-producer");
        producer.start();
        TestAwaitUtils.awaitParked(producer, 1000);

        List<TaskItem> dropped = q.shutdown();
        producer.join(1000);

        assertEquals(1, dropped.size());
        assertInstanceOf(ConveyorShutdownException.class, producerFailure.get());
        assertEquals(0, a.outstanding(), "dropped task no longer counts as outstanding");
        assertEquals(1, a.snapshot().tasksDiscarded());
        assertTrue(q.shutdown().isEmpty(), "second shutdown is a no-op");
        assertThrows(ConveyorShutdownException.class, () -> q.enqueue(new TaskItem(a, NOOP)));
    }

    @Test
    void taskForFinishedJobIsNotEnqueued() throws Exception {
        TaskQueue q = new TaskQueue(0);
        JobRecord a = newRecord();
        assertTrue(a.beginProducing());
        a.markAllPushed();
        assertTrue(a.awaitDrained());
        a.finish(JobState.COMPLETED, null);

        IllegalJobStateException ex = assertThrows(IllegalJobStateException.class,
                () -> q.enqueue(new TaskItem(a, NOOP)));
        assertEquals(JobState.COMPLETED, ex.state());
        assertEquals(0, q.size());
        assertEquals(0, a.outstanding());
    }
}
