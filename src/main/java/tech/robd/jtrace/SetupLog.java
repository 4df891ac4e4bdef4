/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/SetupLog.java
 description: Always-on, bounded, queryable self-diagnostic stream; also a TracerFactory for internal components.
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

package tech.robd.jtrace;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.config.JTraceProperties;
import tech.robd.jtrace.diagnostics.Diagnostics;
import tech.robd.jtrace.switches.OnOffTraceSwitch;
import tech.robd.jtrace.writer.EntryWriter;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * The self-diagnostic stream: build failures, write failures, drop counts and lifecycle warnings
 * recorded by the library itself, kept apart from user-routed output.
 *
 * <p>Entries are appended through tracers obtained from this log (it is a {@link TracerFactory}
 * whose tracers are always fully enabled) or directly via {@link #append(TraceEntry)}. The log is
 * bounded: once {@link #capacity()} entries are held the oldest is evicted and counted. Every entry
 * is also mirrored to SLF4J while {@link Diagnostics} are enabled.</p>
 *
 * <p>Thread-safe. Iteration works on a snapshot.</p>
 */
public final class SetupLog implements TracerFactory, Iterable<TraceEntry> {

    // 🧩 Section: state
    private final int capacity;
    private final ArrayDeque<TraceEntry> entries = new ArrayDeque<>();
    private final Object entriesLock = new Object();
    private long evicted;
    private final ConcurrentMap<String, Tracer> tracers = new ConcurrentHashMap<>();
    private final EntryWriter<TraceEntry> appender = new EntryWriter<>() {
        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public void write(TraceEntry entry) {
            append(entry);
        }

        @Override
        public String toString() {
            return "SetupLogAppender";
        }
    };
    // [/🧩 Section: state]

    public SetupLog() {
        this(JTraceProperties.setupCapacity());
    }

    public SetupLog(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, was " + capacity);
        this.capacity = capacity;
    }

    // 🧩 Section: tracer-factory
    @Override
    public @NonNull Tracer getTracer(@Nullable String name) {
        return tracers.computeIfAbsent(Tracer.normalizeName(name), key -> {
            Tracer tracer = new Tracer(key, this);
            tracer.configure(List.of(new TraceWriter(new OnOffTraceSwitch(true), appender, this, "SetupLog")));
            return tracer;
        });
    }
    // [/🧩 Section: tracer-factory]

    // 🧩 Section: append
    public void append(@NonNull TraceEntry entry) {
        if (entry == null) return;
        synchronized (entriesLock) {
            if (entries.size() >= capacity) {
                entries.pollFirst();
                evicted++;
            }
            entries.addLast(entry);
        }
        Diagnostics.mirror(entry.tracerName(), entry.level(), entry.message(), entry.error());
    }
    // [/🧩 Section: append]

    // 🧩 Section: query
    public @NonNull List<TraceEntry> entries() {
        synchronized (entriesLock) {
            return List.copyOf(entries);
        }
    }

    public @NonNull Stream<TraceEntry> stream() {
        return entries().stream();
    }

    @Override
    public @NonNull Iterator<TraceEntry> iterator() {
        return entries().iterator();
    }

    public int size() {
        synchronized (entriesLock) {
            return entries.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long count(@NonNull Predicate<? super TraceEntry> filter) {
        return stream().filter(filter).count();
    }

    public boolean hasEntriesAtOrAbove(@NonNull TraceLevel level) {
        return stream().anyMatch(e -> e.level().isAtLeast(level));
    }

    /**
     * @return number of entries evicted because the log was full
     */
    public long evictedCount() {
        synchronized (entriesLock) {
            return evicted;
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        synchronized (entriesLock) {
            entries.clear();
        }
    }
    // [/🧩 Section: query]

    @Override
    public String toString() {
        return "SetupLog(size=" + size() + ", capacity=" + capacity + ")";
    }
}
