/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/JobCompletion.java
 description: Functional interface for a job's completion routine, run once per run after all of its tasks finished.
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
 * Completion routine of a job: runs on the job's driver thread exactly once per run, after
 * every task the run submitted has finished and before the job is marked done.
 */
@FunctionalInterface
public interface JobCompletion {

    /** Completion that does nothing. */
    JobCompletion NONE = ctx -> { };

    // [🧩 Section: api]

    /**
     * @param ctx the run's context; submitting tasks from here is rejected
     * @throws Exception on failure; the job then ends in {@link JobState#FAILED}
     */
    void complete(@NonNull JobContext ctx) throws Exception;
    // [/🧩 Section: api]
}
