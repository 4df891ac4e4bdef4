/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/BackgroundDispatchInitializer.java
 description: Pipeline stage that fronts a writer with a manager-shared BackgroundMultiLogWriter proxy.
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

package tech.robd.jtrace.config.initializer;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.LogManager;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.background.BackgroundDispatchOptions;
import tech.robd.jtrace.writer.background.BackgroundMultiLogWriter;

import java.util.List;

/**
 * Moves writes for the writer being built onto a background consumer thread.
 * <p>
 * All writers of one {@link LogManager} built with equal options share a single
 * {@link BackgroundMultiLogWriter}, which is registered in the build's {@link DependencyRegistry}
 * for later stages and imports such as {@link FlushWhenIdleImport}.
 */
public final class BackgroundDispatchInitializer implements PipelineInitializer {

    private final @NonNull BackgroundDispatchOptions options;

    public BackgroundDispatchInitializer() {
        this(BackgroundDispatchOptions.defaults());
    }

    public BackgroundDispatchInitializer(@NonNull BackgroundDispatchOptions options) {
        if (options == null) throw new IllegalArgumentException("options cannot be null");
        this.options = options;
    }

    public @NonNull BackgroundDispatchOptions options() {
        return options;
    }

    @Override
    public @NonNull LogWriter initialize(@NonNull LogWriter logWriter, @NonNull DependencyRegistry registry) {
        LogManager manager = registry.require(LogManager.class);
        SetupLog setupLog = registry.require(SetupLog.class);
        BackgroundMultiLogWriter background = manager.backgroundWriterFor(
                List.of(BackgroundDispatchInitializer.class, options),
                () -> new BackgroundMultiLogWriter(setupLog, options));
        registry.registerIfAbsent(BackgroundMultiLogWriter.class, background);
        return background.createProxyFor(logWriter);
    }

    @Override
    public String toString() {
        return "BackgroundDispatchInitializer(" + options + ")";
    }
}
