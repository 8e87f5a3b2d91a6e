/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/JobContext.java
 description: Explicit per-run context handed to job routines: the job's handle, run number, and owning conveyor.
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

/**
 * Context passed to {@link Job#produce(JobContext)} and {@link Job#complete(JobContext)}.
 * <p>
 * Jobs hold no hidden reference to the engine that runs them; everything a routine needs to
 * submit work comes through this context.
 * </p>
 */
public interface JobContext {

    /**
     * @return handle of the job being run
     */
    @NonNull JobHandle handle();

    /**
     * @return 1-based run number; restarts increment it
     */
    int run();

    /**
     * @return the conveyor driving this job
     */
    @NonNull Conveyor conveyor();

    /**
     * Submit a task bound to this job. Blocks while the conveyor's queue is full.
     *
     * @param action the task body
     * @throws InterruptedException       if interrupted while waiting for queue space
     * @throws IllegalJobStateException   if the job no longer accepts tasks
     * @throws ConveyorShutdownException  if the conveyor has been shut down
     */
    default void submit(@NonNull TaskAction action) throws InterruptedException {
        conveyor().submitTask(handle(), action);
    }
}
