/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/BaseLogWriterConfig.java
 description: Base LogWriterConfig holding the dispose-on-stop flag and the initializer list.
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
import tech.robd.jtrace.config.initializer.LogWriterInitializer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the parts common to every descriptor. Initializers are not part of equality: two
 * descriptors for the same sink are the same descriptor.
 */
public abstract class BaseLogWriterConfig implements LogWriterConfig {

    // 🧩 Section: state
    private volatile boolean disposeOnStop;
    private final List<LogWriterInitializer> initializers = new CopyOnWriteArrayList<>();
    // [/🧩 Section: state]

    protected BaseLogWriterConfig(boolean disposeOnStop) {
        this.disposeOnStop = disposeOnStop;
    }

    @Override
    public boolean isDisposeOnStop() {
        return disposeOnStop;
    }

    public @NonNull BaseLogWriterConfig setDisposeOnStop(boolean disposeOnStop) {
        this.disposeOnStop = disposeOnStop;
        return this;
    }

    @Override
    public @NonNull List<LogWriterInitializer> initializers() {
        return List.copyOf(initializers);
    }

    public @NonNull BaseLogWriterConfig addInitializer(@NonNull LogWriterInitializer initializer) {
        if (initializer == null) throw new IllegalArgumentException("initializer cannot be null");
        initializers.add(initializer);
        return this;
    }

    // 🧩 Section: equality
    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
    // [/🧩 Section: equality]
}
