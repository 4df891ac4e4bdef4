/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/LogManagerConfig.java
 description: Set of LogWriterConfig descriptors plus manager-wide pipeline initializers.
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

package tech.robd.jtrace.config;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.ConfigurationException;
import tech.robd.jtrace.config.initializer.LogWriterInitializer;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Configuration of a {@code LogManager}.
 *
 * <ul>
 *   <li>Writers are a set keyed by descriptor equality, in insertion order; adding an equal
 *       descriptor again is a no-op.</li>
 *   <li>Initializers registered here run for every writer, after the descriptor's own.</li>
 * </ul>
 * Changes are picked up by the next {@code LogManager.start()}.
 */
public final class LogManagerConfig {

    // 🧩 Section: state
    private final Set<LogWriterConfig> writers = new CopyOnWriteArraySet<>();
    private final List<LogWriterInitializer> initializers = new CopyOnWriteArrayList<>();
    // [/🧩 Section: state]

    public LogManagerConfig() {
    }

    public LogManagerConfig(@NonNull LogWriterConfig... writerConfigs) {
        addWriters(List.of(writerConfigs));
    }

    // 🧩 Section: writers

    /**
     * @return {@code true} if the descriptor was not already present
     * @throws ConfigurationException if {@code writerConfig} is null
     */
    public boolean addWriter(@NonNull LogWriterConfig writerConfig) {
        if (writerConfig == null) throw new ConfigurationException("LogWriterConfig cannot be null");
        return writers.add(writerConfig);
    }

    public @NonNull LogManagerConfig addWriters(@NonNull Collection<? extends LogWriterConfig> writerConfigs) {
        for (LogWriterConfig c : writerConfigs) addWriter(c);
        return this;
    }

    public boolean removeWriter(LogWriterConfig writerConfig) {
        return writers.remove(writerConfig);
    }

    public @NonNull List<LogWriterConfig> writers() {
        return List.copyOf(writers);
    }

    public boolean contains(LogWriterConfig writerConfig) {
        return writers.contains(writerConfig);
    }

    public boolean containsAll(@NonNull Collection<? extends LogWriterConfig> writerConfigs) {
        return writers.containsAll(writerConfigs);
    }
    // [/🧩 Section: writers]

    // 🧩 Section: initializers
    public @NonNull LogManagerConfig addInitializer(@NonNull LogWriterInitializer initializer) {
        if (initializer == null) throw new ConfigurationException("initializer cannot be null");
        initializers.add(initializer);
        return this;
    }

    public @NonNull List<LogWriterInitializer> initializers() {
        return List.copyOf(initializers);
    }
    // [/🧩 Section: initializers]

    public void reset() {
        writers.clear();
        initializers.clear();
    }

    @Override
    public String toString() {
        return "LogManagerConfig(writers=" + writers + ", initializers=" + initializers.size() + ")";
    }
}
