/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/ConveyorStats.java
 description: Approximate engine-wide statistics: pool size, queue occupancy and high-water mark, task totals.
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
 * Engine-wide statistics. Each value is read independently, so under load the record is an
 * approximation rather than an atomic snapshot.
 *
 * @param workers            number of worker threads
 * @param queueCapacity      queue bound, {@code 0} for unbounded
 * @param queuedTasks        tasks waiting in the queue
 * @param queueHighWaterMark largest number of tasks ever waiting in the queue at once
 * @param tasksExecuted      tasks run by workers since construction
 * @param tasksFailed        executed tasks whose action threw
 * @param tasksDiscarded     queued tasks dropped by shutdown
 * @param registeredJobs     jobs currently held by the registry
 * @param activeDrivers      job driver threads still running
 */
public record ConveyorStats(
        int workers,
        int queueCapacity,
        int queuedTasks,
        int queueHighWaterMark,
        long tasksExecuted,
        long tasksFailed,
        long tasksDiscarded,
        int registeredJobs,
        int activeDrivers
) {
}
