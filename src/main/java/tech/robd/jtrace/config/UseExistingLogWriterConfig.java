/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/UseExistingLogWriterConfig.java
 description: Descriptor wrapping an already constructed LogWriter instance.
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

package tech.robd.jtrace.config;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.writer.LogWriter;

/**
 * Hands an existing writer to the manager. Equality is the identity of the wrapped writer, so the
 * same instance registered twice is one descriptor.
 * <p>
 * The writer is not closed on stop unless requested, since the caller constructed it.
 */
public final class UseExistingLogWriterConfig extends BaseLogWriterConfig {

    private final @NonNull LogWriter logWriter;

    public UseExistingLogWriterConfig(@NonNull LogWriter logWriter) {
        this(logWriter, false);
    }

    public UseExistingLogWriterConfig(@NonNull LogWriter logWriter, boolean disposeOnStop) {
        super(disposeOnStop);
        if (logWriter == null) throw new IllegalArgumentException("logWriter cannot be null");
        this.logWriter = logWriter;
    }

    public @NonNull LogWriter logWriter() {
        return logWriter;
    }

    @Override
    public @NonNull LogWriter createLogWriter(@NonNull SetupLog setupLog) {
        return logWriter;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UseExistingLogWriterConfig other && other.logWriter == logWriter;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(logWriter);
    }

    @Override
    public String toString() {
        return "UseExisting(" + logWriter + ")";
    }
}
