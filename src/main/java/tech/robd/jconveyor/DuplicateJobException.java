/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/DuplicateJobException.java
 description: Raised when a Job instance that is still registered is submitted again.
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
 * Thrown by {@link Conveyor#submitJob(Job)} when the same {@link Job} instance is already
 * registered. Use {@link Conveyor#restart(JobHandle)} to run a registered job again.
 */
public final class DuplicateJobException extends ConveyorException {

    private final JobHandle existing;

    public DuplicateJobException(JobHandle existing) {
        super("Job already registered as " + existing + "; use restart() to run it again");
        this.existing = existing;
    }

    /**
     * @return the handle under which the job is currently registered
     */
    public JobHandle existing() {
        return existing;
    }
}
