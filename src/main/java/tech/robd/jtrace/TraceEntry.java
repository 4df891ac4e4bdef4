/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceEntry.java
 description: Immutable trace entry (timestamp, tracer name, level, message, optional details and error).
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
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A single trace record. Instances are immutable and are handed to every enabled writer by
 * reference, so writers may keep them without copying.
 *
 * @param timestamp  creation time
 * @param tracerName normalized name of the tracer that produced the entry
 * @param level      severity
 * @param message    formatted message (never null, may be empty)
 * @param details    optional structured detail supplied by the caller
 * @param error      optional exception associated with the entry
 */
public record TraceEntry(@NonNull Instant timestamp,
                         @NonNull String tracerName,
                         @NonNull TraceLevel level,
                         @NonNull String message,
                         @Nullable Object details,
                         @Nullable Throwable error) {

    public TraceEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tracerName, "tracerName");
        Objects.requireNonNull(level, "level");
        if (message == null) message = "";
    }

    /**
     * Convenience factory stamped with the current time and no details.
     */
    public static @NonNull TraceEntry of(@NonNull String tracerName, @NonNull TraceLevel level, @Nullable String message) {
        return new TraceEntry(Instant.now(), tracerName, level, message, null, null);
    }

    public boolean hasError() {
        return error != null;
    }

    @Override
    public String toString() {
        return "TraceEntry[" + level + " " + tracerName + ": " + message
                + (error != null ? " (" + error.getClass().getSimpleName() + ")" : "") + "]";
    }
}
