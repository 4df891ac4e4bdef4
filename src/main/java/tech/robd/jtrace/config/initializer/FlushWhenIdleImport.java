/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/FlushWhenIdleImport.java
 description: Import step: flush a buffering sink whenever its background queues are empty.
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
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.writer.BufferingLogWriter;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.background.BackgroundMultiLogWriter;

import java.util.Optional;

/**
 * Sets the flush predicate of the build's {@link BufferingLogWriter} to "the background queues
 * feeding it are empty", so buffered output is flushed once the consumer catches up rather than
 * after every batch.
 * <p>
 * Requires a {@link BackgroundDispatchInitializer} earlier in the pipeline. Without a buffering
 * writer or a background writer the step does nothing and notes that in the setup log.
 */
public final class FlushWhenIdleImport implements ImportInitializer {

    @Override
    public void importDependencies(@NonNull DependencyRegistry registry) {
        Optional<BufferingLogWriter> buffering = registry.findInstanceOf(BufferingLogWriter.class);
        Optional<BackgroundMultiLogWriter> background = registry.find(BackgroundMultiLogWriter.class);
        LogWriter finalWriter = registry.require(LogWriter.class);
        if (buffering.isEmpty() || background.isEmpty()) {
            registry.find(SetupLog.class).ifPresent(log -> log.tracerFor(FlushWhenIdleImport.class)
                    .warn("Nothing to wire for {}: buffering={}, background={}",
                            finalWriter, buffering.isPresent(), background.isPresent()));
            return;
        }
        BackgroundMultiLogWriter bg = background.get();
        BufferingLogWriter sink = buffering.get();
        sink.setFlushPredicate(() -> !bg.hasPendingEntries(sink));
    }

    @Override
    public String toString() {
        return "FlushWhenIdleImport";
    }
}
