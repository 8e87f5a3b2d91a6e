/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/Job.java
 description: Capability interface for a job: a production routine that submits tasks and an optional completion routine.
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

import org.jspecify.annotations.NonNull;

/**
 * A unit of work that fans out into tasks and gathers their results.
 * <p>
 * A job is never run by a worker. Each run gets its own driver thread, which
 * <ol>
 *   <li>calls {@link #produce(JobContext)} to submit tasks,</li>
 *   <li>flags the job "all tasks pushed",</li>
 *   <li>waits until every task it submitted has finished,</li>
 *   <li>calls {@link #complete(JobContext)} and marks the job done.</li>
 * </ol>
 * Result buffers and other accumulated fields belong to the implementation; the engine does
 * not reset them when the job is restarted.
 * </p>
 *
 * <pre>{@code
 * JobHandle h = conveyor.submitJob(Job.of(
 *         ctx -> { for (int i = 0; i < n; i++) ctx.submit(() -> work(i)); },
 *         ctx -> publish()));
 * conveyor.waitUntilDone(h);
 * }</pre>
 */
@FunctionalInterface
public interface Job {

    // [🧩 Section: api]

    /**
     * Production routine. Submit tasks with {@link JobContext#submit(TaskAction)}; submission
     * blocks while the conveyor's queue is full.
     *
     * @param ctx the run's context
     * @throws Exception on failure; tasks already submitted still run, the completion routine
     *                   is skipped and the job ends in {@link JobState#FAILED}
     */
    void produce(@NonNull JobContext ctx) throws Exception;

    /**
     * Completion routine, run once per run after all tasks of the run finished.
     *
     * @param ctx the run's context
     * @throws Exception on failure; the job ends in {@link JobState#FAILED}
     */
    default void complete(@NonNull JobContext ctx) throws Exception {
        // nothing to gather by default
    }
    // [/🧩 Section: api]

    // 🧩 Section: factories

    /**
     * Build a job from a production lambda and a completion lambda.
     *
     * @param producer   production routine
     * @param completion completion routine
     * @return a job delegating to both
     * @throws IllegalArgumentException if either argument is null
     */
    static Job of(Job producer, JobCompletion completion) {
        if (producer == null || completion == null) {
            throw new IllegalArgumentException("Producer and completion cannot be null");
        }
        return new Job() {
            @Override
            public void produce(@NonNull JobContext ctx) throws Exception {
                producer.produce(ctx);
            }

            @Override
            public void complete(@NonNull JobContext ctx) throws Exception {
                completion.complete(ctx);
            }
        };
    }
    // [/🧩 Section: factories]
}
