/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/JobState.java
 description: Lifecycle states of a job run, from CREATED through the driver phases to a terminal state.
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

/**
 * Lifecycle of one run of a job.
 *
 * <pre>
 * CREATED → PRODUCING → ALL_PUSHED → DRAINING → COMPLETING → COMPLETED
 *                                        │            └──────→ FAILED
 *                                        └──(shutdown)───────→ ABORTED
 * </pre>
 *
 * A failing production routine still goes through {@code ALL_PUSHED} and {@code DRAINING}
 * (tasks it already submitted run to the end) and then ends in {@link #FAILED} without
 * running the completion routine.
 */
public enum JobState {
    /** Registered (or restarted); the driver thread has not started production yet. */
    CREATED,
    /** The production routine is running and submitting tasks. */
    PRODUCING,
    /** The production routine returned; no more tasks come from it. */
    ALL_PUSHED,
    /** Waiting for the outstanding task count to reach zero. */
    DRAINING,
    /** Every task finished; the completion routine is running. */
    COMPLETING,
    /** The completion routine returned normally. */
    COMPLETED,
    /** The production or completion routine threw. */
    FAILED,
    /** The conveyor was shut down before the job drained. */
    ABORTED;

    // 🧩 Section: predicates

    /**
     * @return {@code true} once the run is over and waiters on "done" are released
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }

    /**
     * @return {@code true} while new tasks may still be accepted for the job
     */
    public boolean acceptsTasks() {
        return this == CREATED || this == PRODUCING || this == ALL_PUSHED || this == DRAINING;
    }

    /**
     * @return {@code true} once the production routine has returned (or the run is over)
     */
    public boolean isAllPushed() {
        return this != CREATED && this != PRODUCING;
    }
    // [/🧩 Section: predicates]
}
