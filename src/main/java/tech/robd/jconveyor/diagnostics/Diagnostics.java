/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/diagnostics/Diagnostics.java
 description: Owner-bound logging facade for the engine. Debug/info are gated by the global
              diagnostics switch; warn/error always reach SLF4J and may carry a Throwable.
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

/**
 * Minimal logging facade bound to an owning {@link Class}.
 * <p>
 * Instance methods forward to the package-private {@code DiagnosticsBackend}:
 * <ul>
 *   <li>{@link #debug} and {@link #info} are tracing output and only emitted when
 *       {@code -Djconveyor.diag=true} is set (or {@link #setEnabled(boolean)} was called).</li>
 *   <li>{@link #warn} and {@link #error} report failures of user routines and shutdown
 *       problems, and are always forwarded.</li>
 * </ul>
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * Owning class used to pick the SLF4J logger.
     *
     * @return the owner class associated with this diagnostics instance
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Emit a debug trace message (dropped unless diagnostics are enabled).
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    /**
     * Emit an info trace message (dropped unless diagnostics are enabled).
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    /**
     * Emit a warning, optionally with the failure that caused it.
     *
     * @param failure the throwable to attach, or {@code null}
     * @param msg     SLF4J-style message pattern
     * @param args    arguments to format into {@code msg}
     */
    default void warn(@Nullable Throwable failure, String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), failure, msg, args);
    }

    /**
     * Emit an error, optionally with the failure that caused it.
     *
     * @param failure the throwable to attach, or {@code null}
     * @param msg     SLF4J-style message pattern
     * @param args    arguments to format into {@code msg}
     */
    default void error(@Nullable Throwable failure, String msg, Object... args) {
        DiagnosticsBackend.error(owner(), failure, msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}.
     *
     * @param owner the owning class (non-null)
     * @return a diagnostics instance routed to {@code owner}'s logger
     * @throws IllegalArgumentException if {@code owner} is null
     */
    static Diagnostics of(Class<?> owner) {
        if (owner == null) throw new IllegalArgumentException("Owner cannot be null");
        return new ActiveD(owner);
    }

    /**
     * @return whether debug/info tracing is currently emitted
     */
    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }

    /**
     * Flip debug/info tracing on or off for the whole JVM.
     *
     * @param enabled new state
     */
    static void setEnabled(boolean enabled) {
        DiagnosticsBackend.setEnabled(enabled);
    }
    // [/🧩 Section: factories]
}
