/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/JobHandle.java
 description: Opaque generation-checked identifier of a registered job: registry slot index plus slot generation.
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
 * Opaque, stable identifier of a job registered with a {@link Conveyor}.
 * <p>
 * A handle names a slot in the conveyor's job registry together with the generation that
 * slot had when the job was registered. Once the job is removed the slot may be reused, but
 * with a new generation, so an old handle is detected as stale and rejected with
 * {@link UnknownJobException} instead of reaching the newer job.
 * </p>
 *
 * @param slot       registry slot index
 * @param generation slot generation at registration time
 */
public record JobHandle(int slot, int generation) {

    @Override
    public String toString() {
        return "job#" + slot + "." + generation;
    }
}
