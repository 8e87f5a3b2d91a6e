/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/ConveyorThreadFactory.java
 description: Named ThreadFactory for worker and driver threads, with configurable daemon flag and a logging uncaught-exception handler.
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

import tech.robd.jconveyor.diagnostics.Diagnostics;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates platform threads named {@code <prefix>-<role>-<n>}.
 */
public final class ConveyorThreadFactory implements ThreadFactory {

    private static final Diagnostics DIAG = Diagnostics.of(ConveyorThreadFactory.class);

    private final String namePrefix;
    private final boolean daemon;
    private final AtomicInteger counter = new AtomicInteger();

    public ConveyorThreadFactory(String prefix, String role, boolean daemon) {
        this.namePrefix = prefix + "-" + role + "-";
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, namePrefix + counter.incrementAndGet());
        t.setDaemon(daemon);
        t.setUncaughtExceptionHandler((thread, e) ->
                DIAG.error(e, "uncaught failure on {}", thread.getName()));
        return t;
    }
}
