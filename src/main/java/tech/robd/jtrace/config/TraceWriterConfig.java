/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/TraceWriterConfig.java
 description: Pairs a LogWriterConfig with the SwitchSet deciding which tracers write to it.
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
import tech.robd.jtrace.switches.SwitchSet;
import tech.robd.jtrace.switches.TraceSwitch;
import tech.robd.jtrace.writer.LogWriter;

/**
 * One sink as seen by a {@code TraceManager}: the descriptor to build and the switches applied to
 * tracer names for it. Identity-equal on purpose, so the same descriptor may be configured twice
 * with different switch sets.
 */
public final class TraceWriterConfig {

    private final @NonNull LogWriterConfig logWriterConfig;
    private final @NonNull SwitchSet switches;

    public TraceWriterConfig(@NonNull LogWriterConfig logWriterConfig, @NonNull SwitchSet switches) {
        if (logWriterConfig == null) throw new IllegalArgumentException("logWriterConfig cannot be null");
        if (switches == null) throw new IllegalArgumentException("switches cannot be null");
        this.logWriterConfig = logWriterConfig;
        this.switches = switches;
    }

    public TraceWriterConfig(@NonNull LogWriterConfig logWriterConfig) {
        this(logWriterConfig, new SwitchSet());
    }

    public TraceWriterConfig(@NonNull LogWriter logWriter) {
        this(new UseExistingLogWriterConfig(logWriter));
    }

    public @NonNull TraceWriterConfig addSwitch(String prefix, @NonNull TraceSwitch traceSwitch) {
        switches.add(prefix, traceSwitch);
        return this;
    }

    public @NonNull LogWriterConfig logWriterConfig() {
        return logWriterConfig;
    }

    public @NonNull SwitchSet switches() {
        return switches;
    }

    @Override
    public String toString() {
        return "TraceWriterConfig(" + logWriterConfig + ", " + switches + ")";
    }
}
