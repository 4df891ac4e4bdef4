/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/LogWriter.java
 description: Runtime sink contract: lifecycle plus negotiation of typed entry writers.
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

package tech.robd.jtrace.writer;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.Startable;

import java.util.Map;
import java.util.Optional;

/**
 * A runtime sink. Owns one or more {@link EntryWriter}s, one per entry type it accepts.
 * <p>
 * {@link #close()} disposes the writer; it is terminal and implies {@link #stop()}.
 */
public interface LogWriter extends Startable, AutoCloseable {

    /**
     * Negotiate an entry writer for {@code entryType}. Never throws for an unsupported type.
     *
     * @param entryType the entry type the caller will write
     * @return a compatible entry writer, or empty
     */
    <T> @NonNull Optional<EntryWriter<T>> tryGetEntryWriter(@NonNull Class<T> entryType);

    /**
     * @return every entry writer keyed by the entry type it accepts, in a stable order
     */
    @NonNull Map<Class<?>, EntryWriter<?>> listEntryWriters();

    @Override
    void close();
}
