/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/JobRecord.java
 description: Per-job engine state: lifecycle state machine, outstanding task count, per-run counters, recorded failures, and the waits built on them.
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
import tech.robd.jconveyor.IllegalJobStateException;
import tech.robd.jconveyor.Job;
import tech.robd.jconveyor.JobHandle;
import tech.robd.jconveyor.JobSnapshot;
import tech.robd.jconveyor.JobState;
import tech.robd.jconveyor.diagnostics.Diagnostics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry for one job.
 *
 * <p>All mutable fields are guarded by a single {@link ReentrantLock}; every state change
 * and every outstanding-count change that can release a waiter signals one condition. The
 * outstanding count only moves through {@link #accept(int)} (up, called by the queue while it
 * holds its own lock) and {@link #taskFinished(Throwable)} / {@link #taskDiscarded()} (down),
 * and the driver decides "drained" under the same lock in {@link #awaitDrained()}.</p>
 */
public final class JobRecord {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(JobRecord.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final Job job;
    private final JobHandle handle;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private JobState state = JobState.CREATED;
    private int run = 1;
    private boolean abortRequested = false;
    private long outstanding = 0;

    private long tasksSubmitted = 0;
    private long tasksExecuted = 0;
    private long tasksFailed = 0;
    private long tasksDiscarded = 0;
    private @Nullable Throwable failure;
    private @Nullable Throwable firstTaskFailure;
    // [/🧩 Section: state]

    JobRecord(Job job, JobHandle handle) {
        this.job = job;
        this.handle = handle;
    }

    public Job job() {
        return job;
    }

    public JobHandle handle() {
        return handle;
    }

    // 🧩 Section: task-accounting

    /**
     * Count one more outstanding task. Called by {@link TaskQueue#enqueue(TaskItem)} while it
     * holds the queue lock, right before the item is appended.
     *
     * @param expectedRun run the task was submitted for, or {@link TaskItem#ANY_RUN}
     * @throws IllegalJobStateException if the job has drained or finished, or has moved on
     *                                  to a later run than {@code expectedRun}
     */
    void accept(int expectedRun) {
        lock.lock();
        try {
            if (expectedRun != TaskItem.ANY_RUN && expectedRun != run) {
                throw new IllegalJobStateException(handle, state,
                        "submit a task from run " + expectedRun + " to run " + run + " of");
            }
            if (!state.acceptsTasks()) {
                throw new IllegalJobStateException(handle, state, "submit a task to");
            }
            outstanding++;
            tasksSubmitted++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A worker finished one of this job's tasks.
     *
     * @param taskFailure what the action threw, or {@code null}
     */
    void taskFinished(@Nullable Throwable taskFailure) {
        lock.lock();
        try {
            outstanding--;
            tasksExecuted++;
            if (taskFailure != null) {
                tasksFailed++;
                if (firstTaskFailure == null) firstTaskFailure = taskFailure;
            }
            if (outstanding == 0) changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * One of this job's queued tasks was dropped by shutdown and will never run.
     */
    void taskDiscarded() {
        lock.lock();
        try {
            outstanding--;
            tasksDiscarded++;
            if (outstanding == 0) changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: task-accounting]

    // 🧩 Section: driver-transitions

    /**
     * CREATED → PRODUCING.
     *
     * @return {@code false} if shutdown aborted the job before its driver got going
     */
    boolean beginProducing() {
        lock.lock();
        try {
            if (abortRequested) return false;
            transition(JobState.PRODUCING);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * PRODUCING → ALL_PUSHED → DRAINING. Releases threads waiting for "all tasks pushed".
     */
    void markAllPushed() {
        lock.lock();
        try {
            transition(JobState.ALL_PUSHED);
            transition(JobState.DRAINING);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the outstanding count reaches zero, then move to COMPLETING in the same
     * critical section, after which no task can be accepted.
     *
     * @return {@code true} if drained, {@code false} if shutdown aborted the wait
     * @throws InterruptedException if the driver thread is interrupted
     */
    boolean awaitDrained() throws InterruptedException {
        lock.lock();
        try {
            while (outstanding > 0 && !abortRequested) {
                changed.await();
            }
            if (abortRequested) return false;
            transition(JobState.COMPLETING);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enter a terminal state and release every waiter.
     *
     * @param terminal      COMPLETED, FAILED or ABORTED
     * @param routineFailure failure of the production/completion routine, if any
     */
    void finish(JobState terminal, @Nullable Throwable routineFailure) {
        if (!terminal.isTerminal()) throw new IllegalArgumentException("Not a terminal state: " + terminal);
        lock.lock();
        try {
            if (routineFailure != null && failure == null) failure = routineFailure;
            transition(terminal);
        } finally {
            lock.unlock();
        }
    }

    private void transition(JobState next) {
        DIAG.debug("{} run={} {} -> {}", handle, run, state, next);
        state = next;
        changed.signalAll();
    }
    // [/🧩 Section: driver-transitions]

    // 🧩 Section: lifecycle

    /**
     * Ask the driver to stop waiting for tasks. Jobs already completing are left alone.
     *
     * @return {@code true} if the request was registered
     */
    boolean abort() {
        lock.lock();
        try {
            if (state.isTerminal() || state == JobState.COMPLETING) return false;
            abortRequested = true;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal → CREATED for another run. Counters and failures are reset; the run number
     * goes up by one.
     *
     * @return the new run number
     * @throws IllegalJobStateException if the job is not terminal or still has tasks counted
     */
    int prepareRestart() {
        lock.lock();
        try {
            if (!state.isTerminal() || outstanding != 0) {
                throw new IllegalJobStateException(handle, state, "restart");
            }
            run++;
            abortRequested = false;
            tasksSubmitted = 0;
            tasksExecuted = 0;
            tasksFailed = 0;
            tasksDiscarded = 0;
            failure = null;
            firstTaskFailure = null;
            transition(JobState.CREATED);
            return run;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalJobStateException unless the job is in a terminal state
     */
    void requireTerminal(String operation) {
        lock.lock();
        try {
            if (!state.isTerminal()) throw new IllegalJobStateException(handle, state, operation);
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: waits
    public void awaitDone() throws InterruptedException {
        lock.lock();
        try {
            while (!state.isTerminal()) changed.await();
        } finally {
            lock.unlock();
        }
    }

    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!state.isTerminal()) {
                if (nanos <= 0) return false;
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void awaitAllPushed() throws InterruptedException {
        lock.lock();
        try {
            while (!state.isAllPushed()) changed.await();
        } finally {
            lock.unlock();
        }
    }

    public boolean awaitAllPushed(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!state.isAllPushed()) {
                if (nanos <= 0) return false;
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: waits]

    // 🧩 Section: info
    public JobState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDone() {
        return state().isTerminal();
    }

    public int run() {
        lock.lock();
        try {
            return run;
        } finally {
            lock.unlock();
        }
    }

    public long outstanding() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        lock.lock();
        try {
            return new JobSnapshot(handle, state, run, outstanding, tasksSubmitted, tasksExecuted,
                    tasksFailed, tasksDiscarded, failure, firstTaskFailure);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "JobRecord[" + handle + " " + state() + "]";
    }
    // [/🧩 Section: info]
}
