/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceWriter.java
 description: One bound (switch, entry writer) pair of a Tracer; isolates sink failures from the caller.
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

package tech.robd.jtrace;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.switches.TraceSwitch;
import tech.robd.jtrace.writer.EntryWriter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pairs the switch that matched a tracer's name with the entry writer of one configured sink.
 * Immutable apart from the failure counter; a tracer's list of these is replaced as a whole.
 * <p>
 * A failing sink stays bound: every failure is reported to the {@link SetupLog} and the next
 * call tries again. Checked exceptions thrown past the compiler are caught too.
 */
final class TraceWriter {

    private final @NonNull TraceSwitch traceSwitch;
    private final @NonNull EntryWriter<TraceEntry> entryWriter;
    private final @NonNull SetupLog setupLog;
    private final @NonNull String description;
    private final AtomicLong failureCount = new AtomicLong();

    TraceWriter(@NonNull TraceSwitch traceSwitch,
                @NonNull EntryWriter<TraceEntry> entryWriter,
                @NonNull SetupLog setupLog,
                @NonNull String description) {
        this.traceSwitch = traceSwitch;
        this.entryWriter = entryWriter;
        this.setupLog = setupLog;
        this.description = description;
    }

    boolean isEnabled(TraceLevel level) {
        try {
            return traceSwitch.isEnabled(level) && entryWriter.isEnabled();
        } catch (Exception e) {
            report("Checking " + description + " for " + level + " threw", e);
            return false;
        }
    }

    void write(TraceEntry entry) {
        try {
            entryWriter.write(entry);
        } catch (Exception e) {
            failureCount.incrementAndGet();
            report("Writing to " + description + " failed for tracer '" + entry.tracerName() + "'", e);
        }
    }

    // appended directly so a broken setup-log tracer cannot recurse
    private void report(String message, Exception cause) {
        setupLog.append(new TraceEntry(Instant.now(), Tracer.nameFor(TraceWriter.class), TraceLevel.ERROR,
                message, null, new WriteFailureException(message, cause)));
    }

    long failureCount() {
        return failureCount.get();
    }

    @NonNull EntryWriter<TraceEntry> entryWriter() {
        return entryWriter;
    }

    @NonNull TraceSwitch traceSwitch() {
        return traceSwitch;
    }

    @Override
    public String toString() {
        return "TraceWriter(" + description + ", " + traceSwitch + ")";
    }
}
