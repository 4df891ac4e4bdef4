/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/diagnostics/DiagnosticsBackend.java
 description: Internal diagnostics sink that forwards to SLF4J (LocationAwareLogger when available).
              Global on/off switch via system property `jtrace.diag` and enable()/disable().
              Also mirrors SetupLog entries under their tracer name.
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;
import tech.robd.jtrace.TraceLevel;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J side of {@link Diagnostics}. Off unless {@code -Djtrace.diag=true} or
 * {@link Diagnostics#enable()}. Loggers are cached by name; owners log under their class name.
 * {@link LocationAwareLogger} is used when the binding offers it so the reported caller is the
 * library class, not this one.
 */
final class DiagnosticsBackend {

    // 🧩 Section: state
    static final String DIAGNOSTICS_PROPERTY_NAME = "jtrace.diag";

    private static final String FQCN = DiagnosticsBackend.class.getName();
    private static final ConcurrentMap<String, Logger> LOGGERS = new ConcurrentHashMap<>();

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: state]

    private DiagnosticsBackend() {
        // no instances
    }

    static void setEnabled(boolean on) {
        enabled = on;
    }

    static boolean isEnabled() {
        return enabled;
    }

    // 🧩 Section: emitters
    static void log(Class<?> owner, TraceLevel level, String msg, Object... args) {
        if (!enabled) return;
        emit(logger(owner.getName()), level, msg, args, null);
    }

    static void mirror(String loggerName, TraceLevel level, String message, @Nullable Throwable error) {
        if (!enabled) return;
        emit(logger(loggerName), level, message, null, error);
    }

    private static Logger logger(String name) {
        return LOGGERS.computeIfAbsent(name.isEmpty() ? Logger.ROOT_LOGGER_NAME : name, LoggerFactory::getLogger);
    }

    private static void emit(Logger log, TraceLevel level, String msg, Object @Nullable [] args, @Nullable Throwable t) {
        // 🧩 Point: emitters/location-aware
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, toSlf4jLevel(level), msg, args, t);
            return;
        }
        switch (level) {
            case DEBUG:
            case VERBOSE:
                if (log.isDebugEnabled()) log.debug(format(msg, args), t);
                break;
            case INFO:
                if (log.isInfoEnabled()) log.info(format(msg, args), t);
                break;
            case WARN:
                if (log.isWarnEnabled()) log.warn(format(msg, args), t);
                break;
            default:
                if (log.isErrorEnabled()) log.error(format(msg, args), t);
        }
    }

    private static String format(String msg, Object @Nullable [] args) {
        return args == null || args.length == 0 ? msg : MessageFormatter.arrayFormat(msg, args).getMessage();
    }

    /**
     * VERBOSE maps to DEBUG and SEVERE to ERROR.
     */
    static int toSlf4jLevel(TraceLevel level) {
        switch (level) {
            case DEBUG:
            case VERBOSE:
                return LocationAwareLogger.DEBUG_INT;
            case INFO:
                return LocationAwareLogger.INFO_INT;
            case WARN:
                return LocationAwareLogger.WARN_INT;
            default:
                return LocationAwareLogger.ERROR_INT;
        }
    }
    // [/🧩 Section: emitters]
}
