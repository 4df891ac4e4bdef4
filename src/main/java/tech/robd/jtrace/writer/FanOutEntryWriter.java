/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/FanOutEntryWriter.java
 description: Broadcasts each entry to several entry writers with per-writer failure isolation.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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
import tech.robd.jtrace.WriteFailureException;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes each entry to every wrapped {@link EntryWriter}, in registration order.
 *
 * <ul>
 *   <li>An exception from one child is recorded in the {@link SetupLog} and does not stop
 *       delivery to the others.</li>
 *   <li>{@link #isEnabled()} is true if any child is enabled.</li>
 *   <li>Disabled children are skipped on write.</li>
 * </ul>
 *
 * @param <T> entry type
 */
public final class FanOutEntryWriter<T> implements EntryWriter<T> {

    // 🧩 Section: state
    private final List<EntryWriter<T>> writers;
    private final SetupLog setupLog;
    private final AtomicLong failures = new AtomicLong();
    // [/🧩 Section: state]

    public FanOutEntryWriter(@NonNull List<? extends EntryWriter<T>> writers, @NonNull SetupLog setupLog) {
        if (writers == null || setupLog == null) {
            throw new IllegalArgumentException("writers and setupLog cannot be null");
        }
        this.writers = List.copyOf(writers);
        this.setupLog = setupLog;
    }

    // 🧩 Section: entry-writer
    @Override
    public boolean isEnabled() {
        for (EntryWriter<T> writer : writers) {
            if (isChildEnabled(writer)) return true;
        }
        return false;
    }

    @Override
    public void write(T entry) {
        for (EntryWriter<T> writer : writers) {
            if (!isChildEnabled(writer)) continue;
            try {
                writer.write(entry);
            } catch (Exception e) {
                failures.incrementAndGet();
                setupLog.tracerFor(FanOutEntryWriter.class).error(
                        new WriteFailureException("Fan-out child " + writer + " failed", e),
                        "Exception writing entry to {}; continuing with remaining writers", writer);
            }
        }
    }
    // [/🧩 Section: entry-writer]

    private boolean isChildEnabled(EntryWriter<T> writer) {
        try {
            return writer.isEnabled();
        } catch (Exception e) {
            setupLog.tracerFor(FanOutEntryWriter.class).error(e, "isEnabled() threw for {}", writer);
            return false;
        }
    }

    public @NonNull List<EntryWriter<T>> writers() {
        return writers;
    }

    /**
     * @return number of child write failures observed so far
     */
    public long failureCount() {
        return failures.get();
    }

    @Override
    public String toString() {
        return "FanOutEntryWriter" + writers;
    }
}
