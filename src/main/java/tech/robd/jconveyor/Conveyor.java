/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/Conveyor.java
 description: Engine facade: owns the task queue, worker pool, job registry and supervised driver threads; exposes job/task submission, waits, restart, removal, status and shutdown.
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

import org.jspecify.annotations.NonNull;
import tech.robd.jconveyor.diagnostics.Diagnostics;
import tech.robd.jconveyor.internal.ConveyorThreadFactory;
import tech.robd.jconveyor.internal.JobDriver;
import tech.robd.jconveyor.internal.JobRecord;
import tech.robd.jconveyor.internal.JobRegistry;
import tech.robd.jconveyor.internal.TaskItem;
import tech.robd.jconveyor.internal.TaskQueue;
import tech.robd.jconveyor.internal.WorkerPool;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A two-level execution engine: jobs fan out into tasks, a fixed pool of workers drains the
 * tasks from one shared FIFO, and each job gathers its results once its own tasks are done.
 *
 * <p>It allows you to:
 * <ul>
 *   <li>Register and start jobs with {@link #submitJob(Job)}; each run gets its own driver thread.</li>
 *   <li>Feed tasks with {@link #submitTask(JobHandle, TaskAction)} (usually through
 *       {@link JobContext#submit(TaskAction)}), blocking while a bounded queue is full.</li>
 *   <li>Wait with {@link #waitUntilAllTasksPushed(JobHandle)} and {@link #waitUntilDone(JobHandle)}.</li>
 *   <li>Rerun a finished job with {@link #restart(JobHandle)}, or take it back with {@link #remove(JobHandle)}.</li>
 *   <li>Tear everything down with {@link #shutdown()} / {@link #close()}.</li>
 * </ul>
 *
 * <p>Shutdown drops tasks still queued and aborts jobs that have not drained: their waiters are
 * released with the job in {@link JobState#ABORTED} and their completion routine does not run.</p>
 *
 * <pre>{@code
 * try (Conveyor conveyor = Conveyor.create(4, 0)) {
 *     int[] slots = new int[1000];
 *     JobHandle h = conveyor.submitJob(ctx -> {
 *         for (int i = 0; i < slots.length; i++) {
 *             int slot = i;
 *             ctx.submit(() -> slots[slot] = 7);
 *         }
 *     });
 *     conveyor.waitUntilDone(h);
 * }
 * }</pre>
 */
public final class Conveyor implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(Conveyor.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final ConveyorConfig config;
    private final TaskQueue queue;
    private final WorkerPool workers;
    private final JobRegistry registry = new JobRegistry();
    private final ThreadFactory driverThreads;
    private final Set<Thread> drivers = ConcurrentHashMap.newKeySet();
    private final AtomicLong discarded = new AtomicLong();

    // guards submitJob/restart against a concurrent shutdown
    private final Object lifecycle = new Object();
    private volatile boolean shutdown = false;
    // [/🧩 Section: state]

    private Conveyor(ConveyorConfig config) {
        this.config = config;
        this.queue = new TaskQueue(config.queueCapacity());
        this.workers = new WorkerPool(queue, config.effectiveWorkers(),
                new ConveyorThreadFactory(config.name(), "worker", config.daemonThreads()));
        this.driverThreads = new ConveyorThreadFactory(config.name(), "job", config.daemonThreads());
        DIAG.info("conveyor '{}' started workers={} capacity={}",
                config.name(), workers.size(), config.queueCapacity());
    }

    // 🧩 Section: factories

    /**
     * @return a conveyor configured from {@code jconveyor.*} system properties
     */
    public static Conveyor create() {
        return create(ConveyorConfig.fromSystemProperties());
    }

    /**
     * @param workers       worker count; {@code 0} picks {@code availableProcessors - 1}, minimum one
     * @param queueCapacity queue bound; {@code 0} for unbounded
     * @return a started conveyor
     * @throws IllegalArgumentException if {@code queueCapacity} is negative
     */
    public static Conveyor create(int workers, int queueCapacity) {
        return create(ConveyorConfig.builder().workers(workers).queueCapacity(queueCapacity).build());
    }

    /**
     * @param config construction parameters (non-null)
     * @return a started conveyor
     * @throws IllegalArgumentException if {@code config} is null
     */
    public static Conveyor create(ConveyorConfig config) {
        if (config == null) throw new IllegalArgumentException("Config cannot be null");
        return new Conveyor(config);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: jobs

    /**
     * Register {@code job} and start its driver thread.
     *
     * @param job the job to run (non-null)
     * @return the job's handle, valid until {@link #remove(JobHandle)}
     * @throws IllegalArgumentException   if {@code job} is null
     * @throws DuplicateJobException      if the same instance is already registered
     * @throws ConveyorShutdownException  if the conveyor has been shut down
     */
    public JobHandle submitJob(Job job) {
        if (job == null) throw new IllegalArgumentException("Job cannot be null");
        synchronized (lifecycle) {
            ensureRunning();
            JobRecord record = registry.insert(job);
            startDriver(record);
            return record.handle();
        }
    }

    /**
     * Run a finished job again under the same handle. Fields of the job object itself are
     * left as they are.
     *
     * @throws UnknownJobException       if the handle does not resolve
     * @throws IllegalJobStateException  if the job's current run has not finished
     * @throws ConveyorShutdownException if the conveyor has been shut down
     */
    public void restart(JobHandle handle) {
        requireHandle(handle);
        synchronized (lifecycle) {
            ensureRunning();
            JobRecord record = registry.prepareRestart(handle);
            startDriver(record);
        }
    }

    /**
     * Take a finished job out of the registry. The handle is dead afterwards.
     *
     * @return the job, or empty if the handle does not resolve
     * @throws IllegalJobStateException if the job's current run has not finished
     */
    public Optional<Job> remove(JobHandle handle) {
        requireHandle(handle);
        return registry.remove(handle).map(JobRecord::job);
    }

    private void startDriver(JobRecord record) {
        JobContext ctx = new RunContext(this, record.handle(), record.run());
        Thread driver = driverThreads.newThread(
                new JobDriver(record, ctx, () -> drivers.remove(Thread.currentThread())));
        drivers.add(driver);
        driver.start();
        DIAG.debug("{} run={} driver {} started", record.handle(), ctx.run(), driver.getName());
    }
    // [/🧩 Section: jobs]

    // 🧩 Section: tasks

    /**
     * Queue a task bound to {@code handle}'s job. Blocks while the queue is full.
     *
     * @param handle the owning job
     * @param action the task body
     * @throws InterruptedException      if interrupted while waiting for queue space
     * @throws UnknownJobException       if the handle does not resolve
     * @throws IllegalJobStateException  if the job has already drained
     * @throws ConveyorShutdownException if the conveyor has been shut down
     */
    public void submitTask(JobHandle handle, TaskAction action) throws InterruptedException {
        submitTask(handle, TaskItem.ANY_RUN, action);
    }

    /**
     * Run-checked submission used by {@link JobContext#submit(TaskAction)}: a context that
     * outlived its run cannot feed tasks into a later one.
     */
    private void submitTask(JobHandle handle, int run, TaskAction action) throws InterruptedException {
        requireHandle(handle);
        if (action == null) throw new IllegalArgumentException("Task action cannot be null");
        ensureRunning();
        JobRecord record = registry.require(handle);
        queue.enqueue(new TaskItem(record, run, action));
    }
    // [/🧩 Section: tasks]

    // 🧩 Section: waits

    /**
     * Block until the job's current run is over (completed, failed or aborted).
     */
    public void waitUntilDone(JobHandle handle) throws InterruptedException {
        record(handle).awaitDone();
    }

    /**
     * @return {@code true} if the run finished within {@code timeout}
     * @throws IllegalArgumentException if {@code timeout} is null
     */
    public boolean waitUntilDone(JobHandle handle, Duration timeout) throws InterruptedException {
        requireTimeout(timeout);
        return record(handle).awaitDone(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Block until the job's production routine has returned.
     */
    public void waitUntilAllTasksPushed(JobHandle handle) throws InterruptedException {
        record(handle).awaitAllPushed();
    }

    /**
     * @return {@code true} if production returned within {@code timeout}
     * @throws IllegalArgumentException if {@code timeout} is null
     */
    public boolean waitUntilAllTasksPushed(JobHandle handle, Duration timeout) throws InterruptedException {
        requireTimeout(timeout);
        return record(handle).awaitAllPushed(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void requireTimeout(Duration timeout) {
        if (timeout == null) throw new IllegalArgumentException("Timeout cannot be null");
    }
    // [/🧩 Section: waits]

    // 🧩 Section: status
    public boolean isDone(JobHandle handle) {
        return record(handle).isDone();
    }

    /**
     * @return tasks of the job accepted but not yet finished
     */
    public long outstandingTasks(JobHandle handle) {
        return record(handle).outstanding();
    }

    public JobSnapshot status(JobHandle handle) {
        return record(handle).snapshot();
    }

    public ConveyorStats stats() {
        return new ConveyorStats(
                workers.size(),
                queue.capacity(),
                queue.size(),
                queue.highWaterMark(),
                workers.tasksExecuted(),
                workers.tasksFailed(),
                discarded.get(),
                registry.size(),
                drivers.size()
        );
    }

    public ConveyorConfig config() {
        return config;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private JobRecord record(JobHandle handle) {
        requireHandle(handle);
        return registry.require(handle);
    }

    private static void requireHandle(JobHandle handle) {
        if (handle == null) throw new IllegalArgumentException("Job handle cannot be null");
    }

    private void ensureRunning() {
        if (shutdown) throw new ConveyorShutdownException("Conveyor '" + config.name() + "' is shut down");
    }
    // [/🧩 Section: status]

    // 🧩 Section: lifecycle

    /**
     * Tear the engine down. Only the first call does anything; it returns once every worker
     * has exited and every driver has finished or been interrupted.
     * <ol>
     *   <li>reject new jobs, tasks and restarts,</li>
     *   <li>abort every job that has not drained,</li>
     *   <li>drop queued tasks (each counted as discarded on its job) and wake blocked producers,</li>
     *   <li>join the workers,</li>
     *   <li>join the drivers, interrupting those still running after the shutdown timeout.</li>
     * </ol>
     */
    public void shutdown() {
        synchronized (lifecycle) {
            if (shutdown) return;
            shutdown = true;
        }
        DIAG.info("conveyor '{}' shutting down, jobs={}", config.name(), registry.size());

        // 🧩 Point: lifecycle/abort-jobs
        int aborted = registry.abortAll();

        // 🧩 Point: lifecycle/drop-queue
        int dropped = queue.shutdown().size();
        discarded.addAndGet(dropped);

        // 🧩 Point: lifecycle/join
        workers.join();
        joinDrivers();
        DIAG.info("conveyor '{}' stopped: aborted jobs={}, dropped tasks={}",
                config.name(), aborted, dropped);
    }

    @Override
    public void close() {
        shutdown();
    }

    private void joinDrivers() {
        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        Thread self = Thread.currentThread();
        try {
            for (Thread t : List.copyOf(drivers)) {
                if (t == self) continue;
                long left = deadline - System.nanoTime();
                if (left > 0) TimeUnit.NANOSECONDS.timedJoin(t, left);
            }
            for (Thread t : List.copyOf(drivers)) {
                if (t == self || !t.isAlive()) continue;
                DIAG.warn(null, "driver {} still running after {}, interrupting", t.getName(), config.shutdownTimeout());
                t.interrupt();
            }
            for (Thread t : List.copyOf(drivers)) {
                if (t == self) continue;
                TimeUnit.NANOSECONDS.timedJoin(t, config.shutdownTimeout().toNanos());
                if (t.isAlive()) DIAG.error(null, "driver {} did not stop", t.getName());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            drivers.forEach(t -> {
                if (t != self) t.interrupt();
            });
        }
    }
    // [/🧩 Section: lifecycle]

    /**
     * Context of one run, bound to its handle and run number.
     */
    private record RunContext(@NonNull Conveyor conveyor, @NonNull JobHandle handle, int run)
            implements JobContext {

        @Override
        public void submit(@NonNull TaskAction action) throws InterruptedException {
            conveyor.submitTask(handle, run, action);
        }
    }

    @Override
    public String toString() {
        return "Conveyor(" + config.name() + (shutdown ? ", shut down" : "") + ")";
    }
}
