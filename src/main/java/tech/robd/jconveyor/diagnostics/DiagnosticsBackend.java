/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/diagnostics/DiagnosticsBackend.java
 description: Diagnostics sink forwarding to SLF4J (LocationAwareLogger when available).
              Trace switch via system property `jconveyor.diag`; warn/error are never gated.
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

package tech.robd.jconveyor.diagnostics;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Diagnostics sink that delegates to SLF4J.
 *
 * <p>Features:
 * <ul>
 *   <li>Trace enable/disable via system property {@code jconveyor.diag}
 *       (default {@code false}) and {@link #setEnabled(boolean)}.</li>
 *   <li>Per-owner {@link Logger} cache keyed by {@link Class}.</li>
 *   <li>Uses {@link LocationAwareLogger} when available to preserve caller location.</li>
 * </ul>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    /**
     * Fully-qualified class name for LocationAwareLogger to attribute calls correctly.
     */
    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property enabling trace output: {@code -Djconveyor.diag=true}.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "jconveyor.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(
                    System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim()
            );
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    // 🧩 Section: enablement
    static void setEnabled(boolean on) {
        enabled = on;
    }

    static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        if (!enabled) return; // fast path
        Logger log = logger(owner);
        if (!log.isDebugEnabled()) return;
        emit(log, LocationAwareLogger.DEBUG_INT, null, msg, args);
    }

    static void info(Class<?> owner, String msg, Object... args) {
        if (!enabled) return; // fast path
        Logger log = logger(owner);
        if (!log.isInfoEnabled()) return;
        emit(log, LocationAwareLogger.INFO_INT, null, msg, args);
    }

    static void warn(Class<?> owner, @Nullable Throwable failure, String msg, Object... args) {
        Logger log = logger(owner);
        if (!log.isWarnEnabled()) return;
        emit(log, LocationAwareLogger.WARN_INT, failure, msg, args);
    }

    static void error(Class<?> owner, @Nullable Throwable failure, String msg, Object... args) {
        Logger log = logger(owner);
        if (!log.isErrorEnabled()) return;
        emit(log, LocationAwareLogger.ERROR_INT, failure, msg, args);
    }

    /**
     * Route one event, attaching {@code failure} as the SLF4J throwable when present.
     */
    private static void emit(Logger log, int level, @Nullable Throwable failure, String msg, Object[] args) {
        // 🧩 Point: emitters/location-aware
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level, msg, args, failure);
            return;
        }
        Object[] withFailure = args;
        if (failure != null) {
            withFailure = new Object[args.length + 1];
            System.arraycopy(args, 0, withFailure, 0, args.length);
            withFailure[args.length] = failure;
        }
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> log.debug(msg, withFailure);
            case LocationAwareLogger.INFO_INT -> log.info(msg, withFailure);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, withFailure);
            default -> log.error(msg, withFailure);
        }
    }
    // [/🧩 Section: emitters]
}
