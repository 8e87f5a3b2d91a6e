/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/IllegalJobStateException.java
 description: Raised for job lifecycle violations: restart/remove of a running job, or tasks submitted after drain.
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

/**
 * Thrown when an operation is not valid in the job's current {@link JobState}.
 * <p>
 * Typical causes: restarting or removing a job whose driver is still running, or
 * submitting a task to a job that has already drained.
 * </p>
 */
public final class IllegalJobStateException extends ConveyorException {

    private final JobHandle handle;
    private final JobState state;

    public IllegalJobStateException(JobHandle handle, JobState state, String operation) {
        super("Cannot " + operation + " " + handle + " in state " + state);
        this.handle = handle;
        this.state = state;
    }

    public JobHandle handle() {
        return handle;
    }

    /**
     * @return the state observed when the operation was rejected
     */
    public JobState state() {
        return state;
    }
}
