/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/PipelineInitializer.java
 description: Transform stage (writer, registry) -> writer in a log writer build pipeline.
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

/**
 * One stage of a writer pipeline. Receives the writer built so far and returns the writer the
 * next stage (or the manager) should use, typically a proxy wrapping it. The registry is still
 * open: stages may register what they create for later stages and imports.
 */
@FunctionalInterface
public interface PipelineInitializer extends LogWriterInitializer {

    /**
     * @return the writer to continue with; never {@code null}
     */
    @NonNull LogWriter initialize(@NonNull LogWriter logWriter, @NonNull DependencyRegistry registry);
}
