/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/ConveyorShutdownException.java
 description: Raised when work is submitted to, or blocked in, a conveyor that has been shut down.
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
 * Thrown when a submission reaches a {@link Conveyor} after {@link Conveyor#shutdown()},
 * including producers that were blocked on a full queue when the shutdown happened.
 */
public final class ConveyorShutdownException extends ConveyorException {

    public ConveyorShutdownException(String message) {
        super(message);
    }
}
