/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/LogWriterConfig.java
 description: Value-equality descriptor from which a LogManager builds one log writer.
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
import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.config.initializer.LogWriterInitializer;
import tech.robd.jtrace.writer.LogWriter;

import java.util.List;

/**
 * Describes a log writer to build.
 *
 * <p>Implementations must define {@code equals}/{@code hashCode} structurally: equality is the only
 * key a {@code LogManager} uses to deduplicate descriptors and to find the running writer for a
 * descriptor.</p>
 */
public interface LogWriterConfig {

    /**
     * @param setupLog where the new writer reports its own problems
     * @return a new, not yet started writer; {@code null} is treated as a build failure
     */
    @Nullable LogWriter createLogWriter(@NonNull SetupLog setupLog);

    /**
     * @return {@code true} if the built writer is closed when the manager stops
     */
    boolean isDisposeOnStop();

    /**
     * @return pipeline and import initializers applied to this descriptor's writer, in order
     */
    @NonNull List<LogWriterInitializer> initializers();
}
