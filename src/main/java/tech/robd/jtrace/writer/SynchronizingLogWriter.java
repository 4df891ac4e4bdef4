/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/SynchronizingLogWriter.java
 description: Proxy LogWriter that serializes writes to a non thread-safe sink with a single lock.
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
import tech.robd.jtrace.LifecycleState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wraps a sink that is not safe for concurrent writes. All entry writers of the inner writer
 * share one lock, so writes of different entry types are serialized too. Lifecycle calls are
 * delegated unchanged.
 */
public final class SynchronizingLogWriter implements LogWriter {

    private final @NonNull LogWriter inner;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SynchronizingLogWriter(@NonNull LogWriter inner) {
        if (inner == null) throw new IllegalArgumentException("inner cannot be null");
        this.inner = inner;
    }

    public @NonNull LogWriter inner() {
        return inner;
    }

    @Override
    public <T> @NonNull Optional<EntryWriter<T>> tryGetEntryWriter(@NonNull Class<T> entryType) {
        return inner.tryGetEntryWriter(entryType).map(this::synchronize);
    }

    @Override
    public @NonNull Map<Class<?>, EntryWriter<?>> listEntryWriters() {
        Map<Class<?>, EntryWriter<?>> wrapped = new LinkedHashMap<>();
        for (Map.Entry<Class<?>, EntryWriter<?>> e : inner.listEntryWriters().entrySet()) {
            wrapped.put(e.getKey(), synchronize(e.getValue()));
        }
        return wrapped;
    }

    /**
     * Run {@code action} holding the write lock, e.g. to flush a buffering sink between writes.
     */
    public void runLocked(@NonNull Runnable action) {
        writeLock.lock();
        try {
            action.run();
        } finally {
            writeLock.unlock();
        }
    }

    private <T> EntryWriter<T> synchronize(EntryWriter<T> target) {
        return new EntryWriter<>() {
            @Override
            public boolean isEnabled() {
                return target.isEnabled();
            }

            @Override
            public void write(T entry) {
                writeLock.lock();
                try {
                    target.write(entry);
                } finally {
                    writeLock.unlock();
                }
            }

            @Override
            public String toString() {
                return "Synchronized(" + target + ")";
            }
        };
    }

    @Override
    public void start() {
        inner.start();
    }

    @Override
    public void stop() {
        inner.stop();
    }

    @Override
    public LifecycleState state() {
        return inner.state();
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public String toString() {
        return "SynchronizingLogWriter(" + inner + ")";
    }
}
