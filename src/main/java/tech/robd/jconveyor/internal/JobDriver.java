/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/JobDriver.java
 description: Body of a job's driver thread: production, all-pushed flag, drain wait, completion, terminal state.
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
import tech.robd.jconveyor.JobContext;
import tech.robd.jconveyor.JobState;
import tech.robd.jconveyor.diagnostics.Diagnostics;

/**
 * Runs one run of a job on its own thread:
 * <ol>
 *   <li>{@code CREATED → PRODUCING}: call the production routine,</li>
 *   <li>{@code → ALL_PUSHED → DRAINING}: flag all tasks pushed, wait for the outstanding count
 *       to reach zero,</li>
 *   <li>{@code → COMPLETING}: call the completion routine once,</li>
 *   <li>{@code → COMPLETED | FAILED | ABORTED}: release waiters.</li>
 * </ol>
 * Routine failures never leave this thread; they are recorded on the {@link JobRecord}.
 * The {@code onExit} hook always runs last, so the conveyor can stop supervising the thread.
 */
public final class JobDriver implements Runnable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(JobDriver.class);
    // [/🧩 Section: diagnostics]

    private final JobRecord record;
    private final JobContext context;
    private final Runnable onExit;
    private boolean routineInterrupted = false;

    public JobDriver(JobRecord record, JobContext context, Runnable onExit) {
        this.record = record;
        this.context = context;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        try {
            drive();
        } finally {
            // a routine that threw InterruptedException gets its flag back only once the run is settled
            if (routineInterrupted) Thread.currentThread().interrupt();
            onExit.run();
        }
    }

    private void drive() {
        // 🧩 Point: driver/produce
        if (!record.beginProducing()) {
            DIAG.debug("{} aborted before production", record.handle());
            record.finish(JobState.ABORTED, null);
            return;
        }
        Throwable productionFailure = invoke(true);
        record.markAllPushed();

        // 🧩 Point: driver/drain
        boolean drained;
        try {
            drained = record.awaitDrained();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.warn(null, "{} driver interrupted with {} task(s) outstanding", record.handle(), record.outstanding());
            record.finish(JobState.ABORTED, productionFailure != null ? productionFailure : ie);
            return;
        }
        if (!drained) {
            record.finish(JobState.ABORTED, productionFailure);
            return;
        }
        if (productionFailure != null) {
            record.finish(JobState.FAILED, productionFailure);
            return;
        }

        // 🧩 Point: driver/complete
        Throwable completionFailure = invoke(false);
        record.finish(completionFailure == null ? JobState.COMPLETED : JobState.FAILED, completionFailure);
    }

    /**
     * Call the production or completion routine, returning what it threw.
     */
    private @Nullable Throwable invoke(boolean production) {
        String phase = production ? "production" : "completion";
        try {
            if (production) {
                record.job().produce(context);
            } else {
                record.job().complete(context);
            }
            return null;
        } catch (InterruptedException ie) {
            // an ordinary routine failure; only a shutdown request aborts the run
            routineInterrupted = true;
            DIAG.warn(ie, "{} {} interrupted", record.handle(), phase);
            return ie;
        } catch (Throwable t) {
            DIAG.warn(t, "{} {} routine failed", record.handle(), phase);
            return t;
        }
    }
}
