/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/WorkerPool.java
 description: Fixed set of worker threads draining the TaskQueue; isolates task failures and always settles the owning job's count.
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

import tech.robd.jconveyor.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed pool of workers. Each worker loops:
 * <pre>
 *   item = queue.dequeue()        // blocks while empty
 *   if item == null: exit         // queue shut down
 *   run item.action               // failures are caught and recorded
 *   item.owner.taskFinished(..)   // always, even if the action threw
 * </pre>
 * An interrupt that reaches an idle worker is logged and ignored; only queue shutdown ends
 * the loop.
 */
public final class WorkerPool {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(WorkerPool.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final TaskQueue queue;
    private final List<Thread> workers;
    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    // [/🧩 Section: state]

    /**
     * Start {@code size} workers on {@code queue}.
     *
     * @param queue   the shared queue
     * @param size    number of workers, at least one
     * @param threads factory for the worker threads
     */
    public WorkerPool(TaskQueue queue, int size, ThreadFactory threads) {
        if (size < 1) throw new IllegalArgumentException("Worker count must be positive: " + size);
        this.queue = queue;
        List<Thread> started = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Thread t = threads.newThread(this::workLoop);
            started.add(t);
        }
        this.workers = Collections.unmodifiableList(started);
        workers.forEach(Thread::start);
        DIAG.debug("worker pool started size={}", size);
    }

    /**
     * Default pool size: one less than the available processors, at least one.
     */
    public static int defaultSize() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    // 🧩 Section: loop
    private void workLoop() {
        String name = Thread.currentThread().getName();
        DIAG.debug("{} start", name);
        while (true) {
            TaskItem item;
            try {
                item = queue.dequeue();
            } catch (InterruptedException ie) {
                // the pool stays at full size until the queue itself is shut down
                if (queue.isShutdown()) break;
                DIAG.warn(ie, "{} interrupted while idle, continuing", name);
                continue;
            }
            if (item == null) break;
            execute(item);
        }
        DIAG.debug("{} exit", name);
    }

    private void execute(TaskItem item) {
        Throwable failure = null;
        try {
            item.action().run();
        } catch (Throwable t) {
            failure = t;
            failed.incrementAndGet();
            DIAG.warn(t, "task of {} failed", item.owner().handle());
        } finally {
            executed.incrementAndGet();
            item.owner().taskFinished(failure);
            // an interrupt raised by the action must not leak into the next dequeue
            Thread.interrupted();
        }
    }
    // [/🧩 Section: loop]

    // 🧩 Section: lifecycle

    /**
     * Wait for every worker to exit. The queue must already be shut down. A worker calling
     * this is skipped rather than joined.
     */
    public void join() {
        boolean interrupted = false;
        for (Thread t : workers) {
            if (t == Thread.currentThread()) continue;
            while (t.isAlive()) {
                try {
                    t.join();
                } catch (InterruptedException ie) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
        DIAG.debug("worker pool joined");
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info
    public int size() {
        return workers.size();
    }

    public long tasksExecuted() {
        return executed.get();
    }

    public long tasksFailed() {
        return failed.get();
    }
    // [/🧩 Section: info]
}
