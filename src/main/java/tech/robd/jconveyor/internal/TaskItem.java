/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/TaskItem.java
 description: Immutable queue entry: a task action bound to the record of the job that owns it.
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

package tech.robd.jconveyor.internal;

import tech.robd.jconveyor.TaskAction;

/**
 * A task as it travels through the {@link TaskQueue}: the action plus the job it belongs to.
 * The owner is referenced directly, not through its handle, so a worker never has to resolve
 * the job through the registry.
 *
 * @param owner  the owning job's record
 * @param run    the run the task was submitted for, or {@link #ANY_RUN}
 * @param action the task body
 */
public record TaskItem(JobRecord owner, int run, TaskAction action) {

    /**
     * Accept the task into whatever run is current.
     */
    public static final int ANY_RUN = 0;

    public TaskItem(JobRecord owner, TaskAction action) {
        this(owner, ANY_RUN, action);
    }
}
