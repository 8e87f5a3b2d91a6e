/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/TaskQueue.java
 description: Lock/condition bounded FIFO shared by all jobs. Blocks producers at capacity, blocks consumers when empty, broadcasts shutdown to every waiter.
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

import org.jspecify.annotations.Nullable;
import tech.robd.jconveyor.ConveyorShutdownException;
import tech.robd.jconveyor.diagnostics.Diagnostics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Global FIFO of pending tasks with optional backpressure.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>{@link #enqueue(TaskItem)} blocks while the queue holds {@code capacity} items
 *       ({@code capacity == 0} means unbounded).</li>
 *   <li>Acceptance and the owning job's outstanding-count increment happen together under
 *       the queue lock, so a job can never look drained while one of its tasks is being
 *       accepted.</li>
 *   <li>{@link #dequeue()} blocks while empty and returns items in insertion order across
 *       all jobs.</li>
 *   <li>{@link #shutdown()} is sticky: once set, every current and future {@code dequeue}
 *       returns {@code null}, and producers fail with {@link ConveyorShutdownException}.</li>
 * </ul>
 *
 * <p>Lock order: queue lock, then the owning job's lock. Nothing acquires them the other
 * way round.</p>
 */
public final class TaskQueue {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(TaskQueue.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<TaskItem> items = new ArrayDeque<>();
    private final int capacity;

    private boolean shutdown = false;
    private int highWaterMark = 0;
    // [/🧩 Section: state]

    /**
     * @param capacity maximum number of queued items, {@code 0} for no bound
     * @throws IllegalArgumentException if {@code capacity} is negative
     */
    public TaskQueue(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        this.capacity = capacity;
        DIAG.debug("queue init capacity={}", capacity == 0 ? "unbounded" : capacity);
    }

    // 🧩 Section: produce

    /**
     * Append {@code item}, waiting for space if the queue is full.
     *
     * @param item the task to append
     * @throws InterruptedException      if interrupted while waiting for space
     * @throws ConveyorShutdownException if the queue is (or becomes) shut down
     * @throws tech.robd.jconveyor.IllegalJobStateException if the owning job no longer accepts
     *                                   tasks; nothing is enqueued in that case
     */
    public void enqueue(TaskItem item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!shutdown && isFull()) {
                DIAG.debug("queue full ({}), producer {} waits", items.size(), Thread.currentThread().getName());
                notFull.await();
            }
            if (shutdown) {
                throw new ConveyorShutdownException("Task queue is shut down; task for "
                        + item.owner().handle() + " rejected");
            }
            try {
                item.owner().accept(item.run());
            } catch (RuntimeException rejected) {
                // the slot we were woken for is still free
                notFull.signal();
                throw rejected;
            }
            items.addLast(item);
            if (items.size() > highWaterMark) highWaterMark = items.size();
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    private boolean isFull() {
        return capacity > 0 && items.size() >= capacity;
    }
    // [/🧩 Section: produce]

    // 🧩 Section: consume

    /**
     * Remove and return the head item, waiting while the queue is empty.
     *
     * @return the next task, or {@code null} once the queue has been shut down
     * @throws InterruptedException if interrupted while waiting
     */
    public @Nullable TaskItem dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!shutdown && items.isEmpty()) {
                notEmpty.await();
            }
            if (shutdown) {
                return null;
            }
            TaskItem head = items.pollFirst();
            notFull.signal();
            return head;
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: consume]

    // 🧩 Section: lifecycle

    /**
     * Shut the queue down, drop everything still queued, and wake all waiting producers
     * and consumers. Each dropped item is settled on its owning job as discarded, so the
     * job's outstanding count still returns to zero.
     *
     * @return the dropped items in queue order; empty if already shut down
     */
    public List<TaskItem> shutdown() {
        lock.lock();
        try {
            if (shutdown) return List.of();
            shutdown = true;
            List<TaskItem> dropped = new ArrayList<>(items);
            items.clear();
            for (TaskItem item : dropped) {
                item.owner().taskDiscarded();
            }
            notEmpty.signalAll();
            notFull.signalAll();
            DIAG.debug("queue shutdown, dropped={}", dropped.size());
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return the largest number of items the queue has held at once
     */
    public int highWaterMark() {
        lock.lock();
        try {
            return highWaterMark;
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: info]
}
