/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/EntryWriter.java
 description: Typed write endpoint implemented by sinks.
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

/**
 * Typed write endpoint of a sink.
 * <p>
 * {@link #write(Object)} receives the entry by reference. Implementations must not mutate it and
 * must copy anything they keep after returning, unless the entry type is immutable (as
 * {@link tech.robd.jtrace.TraceEntry} is).
 *
 * @param <T> entry type
 */
public interface EntryWriter<T> {

    /**
     * @return {@code false} if writing now would be discarded; callers may skip building entries
     */
    boolean isEnabled();

    void write(T entry);
}
