/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/TaskAction.java
 description: Functional interface for the executable body of a task.
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
 * The executable body of a task, run exactly once by a worker thread.
 * <p>
 * A task carries no result channel of its own: actions write into whatever shared state the
 * owning job set up (arrays, accumulators, concurrent collections), and the job reads it back
 * in its completion routine. Synchronizing that state is up to the caller.
 * </p>
 *
 * <pre>{@code
 * double[] out = new double[n];
 * for (int i = 0; i < n; i++) {
 *     int slot = i;
 *     ctx.submit(() -> out[slot] = Math.pow(1.01, slot));
 * }
 * }</pre>
 */
@FunctionalInterface
public interface TaskAction {

    // [🧩 Section: api]

    /**
     * Execute the task.
     *
     * @throws Exception on failure; the failure is recorded on the owning job and the job's
     *                   outstanding count is still decremented
     */
    void run() throws Exception;
    // [/🧩 Section: api]
}
