/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/Slf4jLogWriterConfig.java
 description: Descriptor for the SLF4J-forwarding log writer.
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
import tech.robd.jtrace.writer.Slf4jLogWriter;

/**
 * Builds a {@link Slf4jLogWriter}. All instances are equal, so a manager runs at most one.
 */
public final class Slf4jLogWriterConfig extends BaseLogWriterConfig {

    public Slf4jLogWriterConfig() {
        super(true);
    }

    @Override
    public @NonNull LogWriter createLogWriter(@NonNull SetupLog setupLog) {
        return new Slf4jLogWriter(setupLog);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == Slf4jLogWriterConfig.class;
    }

    @Override
    public int hashCode() {
        return Slf4jLogWriterConfig.class.hashCode();
    }

    @Override
    public String toString() {
        return "Slf4jLogWriterConfig";
    }
}
