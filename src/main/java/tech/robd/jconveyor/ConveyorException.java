/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/ConveyorException.java
 description: Root of the unchecked exception hierarchy raised by the conveyor engine.
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
 * Base type for every caller-contract violation reported by a {@link Conveyor}.
 * <p>
 * Failures thrown by user routines (job production/completion, task actions) are never
 * wrapped in this type; they are recorded on the owning job and exposed through
 * {@link JobSnapshot}.
 * </p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public class ConveyorException extends RuntimeException {

    public ConveyorException(String message) {
        super(message);
    }

    public ConveyorException(String message, Throwable cause) {
        super(message, cause);
    }
}
