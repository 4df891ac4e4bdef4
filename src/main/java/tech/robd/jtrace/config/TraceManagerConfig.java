/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/TraceManagerConfig.java
 description: Ordered list of TraceWriterConfigs for a TraceManager, with the default SLF4J configuration.
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
import tech.robd.jtrace.Tracer;
import tech.robd.jtrace.switches.SwitchSet;
import tech.robd.jtrace.switches.ThresholdTraceSwitch;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Trace writers of a {@code TraceManager}, applied on the next {@code start()}.
 */
public final class TraceManagerConfig {

    private final List<TraceWriterConfig> writers = new CopyOnWriteArrayList<>();

    public TraceManagerConfig(@NonNull TraceWriterConfig... writerConfigs) {
        for (TraceWriterConfig c : writerConfigs) add(c);
    }

    /**
     * SLF4J output for every tracer at {@code jtrace.default.threshold} ({@code INFO} if unset).
     */
    public static @NonNull TraceManagerConfig createDefault() {
        return new TraceManagerConfig(new TraceWriterConfig(new Slf4jLogWriterConfig(),
                SwitchSet.of(Tracer.ALL, new ThresholdTraceSwitch(JTraceProperties.defaultThreshold()))));
    }

    public @NonNull TraceManagerConfig add(@NonNull TraceWriterConfig writerConfig) {
        if (writerConfig == null) throw new IllegalArgumentException("writerConfig cannot be null");
        writers.add(writerConfig);
        return this;
    }

    public boolean remove(TraceWriterConfig writerConfig) {
        return writers.remove(writerConfig);
    }

    public @NonNull List<TraceWriterConfig> writers() {
        return List.copyOf(writers);
    }

    @Override
    public String toString() {
        return "TraceManagerConfig" + writers;
    }
}
