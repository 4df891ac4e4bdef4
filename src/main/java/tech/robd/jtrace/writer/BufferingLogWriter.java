/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/BufferingLogWriter.java
 description: Log writer that buffers output and flushes when its flush predicate says so.
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

import java.util.function.BooleanSupplier;

/**
 * A writer that buffers internally and needs to know when flushing is worthwhile.
 * <p>
 * The background dispatcher consults {@link #flushPredicate()} after each drained batch and
 * calls {@link #flush()} when it returns {@code true}. {@code FlushWhenIdleImport} sets the
 * predicate to "no more entries queued for this sink".
 */
public interface BufferingLogWriter extends LogWriter {

    BooleanSupplier flushPredicate();

    void setFlushPredicate(BooleanSupplier flushPredicate);

    void flush();
}
