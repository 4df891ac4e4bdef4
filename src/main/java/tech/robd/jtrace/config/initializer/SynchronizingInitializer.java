/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/SynchronizingInitializer.java
 description: Pipeline stage that serializes writes to a sink that is not thread-safe.
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
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.SynchronizingLogWriter;

/**
 * Wraps the writer in a {@link SynchronizingLogWriter}. Writers that are already synchronized are
 * returned unchanged.
 */
public final class SynchronizingInitializer implements PipelineInitializer {

    @Override
    public @NonNull LogWriter initialize(@NonNull LogWriter logWriter, @NonNull DependencyRegistry registry) {
        if (logWriter instanceof SynchronizingLogWriter) return logWriter;
        return new SynchronizingLogWriter(logWriter);
    }

    @Override
    public String toString() {
        return "SynchronizingInitializer";
    }
}
