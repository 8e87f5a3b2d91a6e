/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/UnknownJobException.java
 description: Raised when a JobHandle does not resolve to a registered job (never issued, removed, or stale generation).
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
 * Thrown when an operation is given a {@link JobHandle} the registry cannot resolve.
 * <p>
 * This covers handles that were removed with {@link Conveyor#remove(JobHandle)} and stale
 * handles whose registry slot has since been reused by another job.
 * </p>
 */
public final class UnknownJobException extends ConveyorException {

    private final JobHandle handle;

    public UnknownJobException(JobHandle handle) {
        super("Unknown job " + handle);
        this.handle = handle;
    }

    public JobHandle handle() {
        return handle;
    }
}
