/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/JobSnapshot.java
 description: Point-in-time view of a job: state, run number, outstanding count, per-run task counters and failures.
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

package tech.robd.jconveyor;

import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view of one registered job, taken under the job's lock so the fields are
 * mutually consistent. Task counters cover the current run only and are reset by
 * {@link Conveyor#restart(JobHandle)}.
 *
 * @param handle           the job's handle
 * @param state            lifecycle state at snapshot time
 * @param run              1-based run number (incremented by every restart)
 * @param outstanding      tasks accepted but not yet finished or discarded
 * @param tasksSubmitted   tasks accepted into the queue in this run
 * @param tasksExecuted    tasks whose action ran to the end (normally or not) in this run
 * @param tasksFailed      executed tasks whose action threw
 * @param tasksDiscarded   accepted tasks dropped from the queue by shutdown
 * @param failure          failure of the production or completion routine, if any
 * @param firstTaskFailure first failure thrown by a task action in this run, if any
 */
public record JobSnapshot(
        JobHandle handle,
        JobState state,
        int run,
        long outstanding,
        long tasksSubmitted,
        long tasksExecuted,
        long tasksFailed,
        long tasksDiscarded,
        @Nullable Throwable failure,
        @Nullable Throwable firstTaskFailure
) {

    public boolean isDone() {
        return state.isTerminal();
    }
}
