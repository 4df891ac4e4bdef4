/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/SingleEntryTypeLogWriter.java
 description: Base for log writers that are their own (single) entry writer.
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
import tech.robd.jtrace.SetupLog;

import java.util.Map;
import java.util.Optional;

/**
 * A {@link LogWriter} that accepts exactly one entry type and is itself the {@link EntryWriter}.
 * <p>
 * A request for a subtype of {@link #entryType()} is satisfied too: a writer of {@code Object}
 * can write any entry.
 *
 * @param <T> accepted entry type
 */
public abstract class SingleEntryTypeLogWriter<T> extends BaseLogWriter implements EntryWriter<T> {

    private final @NonNull Class<T> entryType;

    protected SingleEntryTypeLogWriter(@NonNull SetupLog setupLog, @NonNull Class<T> entryType) {
        super(setupLog);
        if (entryType == null) throw new IllegalArgumentException("entryType cannot be null");
        this.entryType = entryType;
    }

    public final @NonNull Class<T> entryType() {
        return entryType;
    }

    @Override
    public <E> @NonNull Optional<EntryWriter<E>> tryGetEntryWriter(@NonNull Class<E> requested) {
        if (requested == null || !entryType.isAssignableFrom(requested)) {
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        EntryWriter<E> self = (EntryWriter<E>) (EntryWriter<?>) this;
        return Optional.of(self);
    }

    @Override
    public @NonNull Map<Class<?>, EntryWriter<?>> listEntryWriters() {
        return Map.of(entryType, this);
    }

    /**
     * Enabled while started.
     */
    @Override
    public boolean isEnabled() {
        return isStarted();
    }
}
