/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/diagnostics/Diagnostics.java
 description: Lightweight internal diagnostics facade. Instance methods forward to DiagnosticsBackend (SLF4J),
              with factories for active/dynamic/noop behavior and the global enable switch.
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

package tech.robd.jtrace.diagnostics;

import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.TraceLevel;

/**
 * Opt-in SLF4J side channel for the library's own debug chatter (queue creation, consumer start
 * and stop, rebinding sweeps), bound to an owning {@link Class}.
 * <p>
 * The always-on record of build failures, write failures and drops is {@code SetupLog}; its
 * entries are {@linkplain #mirror mirrored} here while diagnostics are enabled.
 * <ul>
 *   <li>{@link #of(Class)} resolves to a no-op if globally disabled when called.</li>
 *   <li>{@link #dynamic(Class)} checks the global flag per call, for owners created early.</li>
 * </ul>
 */
@FunctionalInterface
public interface Diagnostics {

    Class<?> owner();

    // 🧩 Section: forwarding

    /**
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), TraceLevel.DEBUG, msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), TraceLevel.WARN, msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveDiagnostics(owner) : NoOpDiagnostics.INSTANCE;
    }

    static Diagnostics dynamic(Class<?> owner) {
        return new ActiveDiagnostics(owner);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: global-switch

    /**
     * Turn diagnostics on. Instances already obtained from {@link #of(Class)} while disabled stay
     * no-ops.
     */
    static void enable() {
        DiagnosticsBackend.setEnabled(true);
    }

    static void disable() {
        DiagnosticsBackend.setEnabled(false);
    }

    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: global-switch]

    /**
     * Forward a pre-formatted trace entry to SLF4J under {@code loggerName} ({@code ""} is the root
     * logger). No-op while disabled.
     */
    static void mirror(String loggerName, TraceLevel level, String message, @Nullable Throwable error) {
        DiagnosticsBackend.mirror(loggerName, level, message, error);
    }
}
