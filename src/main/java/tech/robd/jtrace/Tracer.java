/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/Tracer.java
 description: Named trace handle; forwards leveled calls to its currently bound writers without ever throwing.
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

package tech.robd.jtrace;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;
import java.util.List;

/**
 * Named handle through which call sites issue leveled trace calls.
 *
 * <p>A tracer holds an immutable list of bound writers, one per configured sink whose switch set
 * matched this tracer's name. The owning manager replaces the list as a whole on start/stop, and
 * every call reads it with a single volatile load, so a call never sees a partially updated set.</p>
 *
 * <p>Guarantees for every logging method:
 * <ul>
 *   <li>Nothing thrown by formatting or by a sink escapes to the caller.</li>
 *   <li>The entry is built at most once per call, and only if some bound writer is enabled.</li>
 *   <li>Messages use SLF4J {@code {}} placeholders; a trailing {@link Throwable} argument becomes
 *       the entry's error.</li>
 * </ul>
 */
public final class Tracer {

    /**
     * Root tracer name and catch-all switch prefix.
     */
    public static final String ALL = "";

    // 🧩 Section: state
    private final @NonNull String name;
    private final @NonNull SetupLog setupLog;
    private volatile List<TraceWriter> writers = List.of();
    // [/🧩 Section: state]

    Tracer(@NonNull String name, @NonNull SetupLog setupLog) {
        this.name = normalizeName(name);
        this.setupLog = setupLog;
    }

    // 🧩 Section: naming
    public static @NonNull String normalizeName(@Nullable String name) {
        return name == null ? ALL : name.trim();
    }

    public static @NonNull String nameFor(@NonNull Class<?> type) {
        return type.getName().replace('$', '.');
    }

    public @NonNull String name() {
        return name;
    }
    // [/🧩 Section: naming]

    // 🧩 Section: binding
    void configure(@NonNull List<TraceWriter> newWriters) {
        this.writers = List.copyOf(newWriters);
    }

    List<TraceWriter> boundWriters() {
        return writers;
    }

    /**
     * @return number of writers currently bound to this tracer
     */
    public int writerCount() {
        return writers.size();
    }
    // [/🧩 Section: binding]

    // 🧩 Section: enablement
    public boolean isEnabled(@NonNull TraceLevel level) {
        if (level == null) return false;
        for (TraceWriter writer : writers) {
            if (writer.isEnabled(level)) return true;
        }
        return false;
    }

    public boolean isDebugEnabled() {
        return isEnabled(TraceLevel.DEBUG);
    }

    public boolean isVerboseEnabled() {
        return isEnabled(TraceLevel.VERBOSE);
    }

    public boolean isInfoEnabled() {
        return isEnabled(TraceLevel.INFO);
    }

    public boolean isWarnEnabled() {
        return isEnabled(TraceLevel.WARN);
    }

    public boolean isErrorEnabled() {
        return isEnabled(TraceLevel.ERROR);
    }

    public boolean isSevereEnabled() {
        return isEnabled(TraceLevel.SEVERE);
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: generic-log
    public void log(@NonNull TraceLevel level, @Nullable String message) {
        dispatch(level, null, null, message, null);
    }

    public void log(@NonNull TraceLevel level, @Nullable String format, Object... args) {
        dispatch(level, null, null, format, args);
    }

    public void log(@NonNull TraceLevel level, @Nullable Throwable error, @Nullable String format, Object... args) {
        dispatch(level, error, null, format, args);
    }

    /**
     * Log with a structured detail object that sinks may render or serialize.
     */
    public void logDetails(@NonNull TraceLevel level, @Nullable Object details, @Nullable String message) {
        dispatch(level, null, details, message, null);
    }
    // [/🧩 Section: generic-log]

    // 🧩 Section: level-shortcuts
    public void debug(String format, Object... args) {
        dispatch(TraceLevel.DEBUG, null, null, format, args);
    }

    public void debug(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.DEBUG, error, null, format, args);
    }

    public void verbose(String format, Object... args) {
        dispatch(TraceLevel.VERBOSE, null, null, format, args);
    }

    public void verbose(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.VERBOSE, error, null, format, args);
    }

    public void info(String format, Object... args) {
        dispatch(TraceLevel.INFO, null, null, format, args);
    }

    public void info(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.INFO, error, null, format, args);
    }

    public void warn(String format, Object... args) {
        dispatch(TraceLevel.WARN, null, null, format, args);
    }

    public void warn(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.WARN, error, null, format, args);
    }

    public void error(String format, Object... args) {
        dispatch(TraceLevel.ERROR, null, null, format, args);
    }

    public void error(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.ERROR, error, null, format, args);
    }

    public void severe(String format, Object... args) {
        dispatch(TraceLevel.SEVERE, null, null, format, args);
    }

    public void severe(Throwable error, String format, Object... args) {
        dispatch(TraceLevel.SEVERE, error, null, format, args);
    }
    // [/🧩 Section: level-shortcuts]

    // 🧩 Section: dispatch
    private void dispatch(@Nullable TraceLevel level,
                          @Nullable Throwable error,
                          @Nullable Object details,
                          @Nullable String format,
                          Object @Nullable [] args) {
        if (level == null) return;
        // 🧩 Point: dispatch/single-volatile-read
        List<TraceWriter> current = writers;
        if (current.isEmpty()) return;
        TraceEntry entry = null;
        for (TraceWriter writer : current) {
            if (!writer.isEnabled(level)) continue;
            if (entry == null) {
                entry = buildEntry(level, error, details, format, args);
            }
            writer.write(entry);
        }
    }

    private TraceEntry buildEntry(TraceLevel level,
                                  @Nullable Throwable error,
                                  @Nullable Object details,
                                  @Nullable String format,
                                  Object @Nullable [] args) {
        Instant now = Instant.now();
        if (args == null || args.length == 0) {
            return new TraceEntry(now, name, level, format, details, error);
        }
        try {
            FormattingTuple tuple = MessageFormatter.arrayFormat(format, args);
            Throwable cause = error != null ? error : tuple.getThrowable();
            return new TraceEntry(now, name, level, tuple.getMessage(), details, cause);
        } catch (Exception e) {
            setupLog.append(new TraceEntry(now, nameFor(Tracer.class), TraceLevel.ERROR,
                    "Formatting failed for tracer '" + name + "' pattern '" + format + "'", null, e));
            return new TraceEntry(now, name, level, format, details, error);
        }
    }
    // [/🧩 Section: dispatch]

    @Override
    public String toString() {
        return "Tracer('" + name + "', writers=" + writers.size() + ")";
    }
}
