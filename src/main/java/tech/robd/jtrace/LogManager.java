/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/LogManager.java
 description: Builds, starts, stops and rebuilds log writers from LogWriterConfig descriptors through initializer pipelines.
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
import tech.robd.jtrace.config.LogManagerConfig;
import tech.robd.jtrace.config.LogWriterConfig;
import tech.robd.jtrace.config.UseExistingLogWriterConfig;
import tech.robd.jtrace.config.initializer.DependencyRegistry;
import tech.robd.jtrace.config.initializer.ImportInitializer;
import tech.robd.jtrace.config.initializer.LogWriterInitializer;
import tech.robd.jtrace.config.initializer.PipelineInitializer;
import tech.robd.jtrace.diagnostics.Diagnostics;
import tech.robd.jtrace.writer.EntryWriter;
import tech.robd.jtrace.writer.FanOutEntryWriter;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.NoOpEntryWriter;
import tech.robd.jtrace.writer.background.BackgroundMultiLogWriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns the log writers built from a {@link LogManagerConfig}.
 *
 * <h2>Building</h2>
 * For every descriptor, on {@link #start()}:
 * <ol>
 *   <li>{@link LogWriterConfig#createLogWriter(SetupLog)} creates the base writer.</li>
 *   <li>A fresh {@link DependencyRegistry} is seeded with the {@link SetupLog}, this manager, the
 *       descriptor and the base writer.</li>
 *   <li>Pipeline initializers (the descriptor's, then the manager-wide ones) each wrap the writer;
 *       every intermediate writer is registered under its class.</li>
 *   <li>The final writer is registered as {@code LogWriter}, the registry is sealed, and import
 *       initializers run.</li>
 * </ol>
 * A failure in any step is recorded in the setup log as a {@link LogWriterBuildException} and
 * only that descriptor is left without a writer. Background writers start first, then the built
 * writers; a writer that fails to start is recorded and stays {@code FAILED}.
 *
 * <h2>Lookups</h2>
 * Lookups start the manager lazily. An unknown descriptor is a caller error
 * ({@link ConfigurationException}); a broken writer yields a {@link NoOpEntryWriter}.
 */
public final class LogManager extends BaseManager {

    private static final Diagnostics DIAG = Diagnostics.of(LogManager.class);

    private record BuiltWriter(@NonNull LogWriterConfig config, @Nullable LogWriter writer) {
    }

    // 🧩 Section: state
    private final @NonNull LogManagerConfig config;
    private final @NonNull SetupLog setupLog;
    // guarded by lock
    private final Map<LogWriterConfig, BuiltWriter> writers = new LinkedHashMap<>();
    private final List<LogWriter> disposeOnStop = new ArrayList<>();
    private final Map<Object, BackgroundMultiLogWriter> backgroundWriters = new LinkedHashMap<>();
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public LogManager() {
        this(new LogManagerConfig());
    }

    public LogManager(@NonNull LogManagerConfig config) {
        this(config, new SetupLog());
    }

    public LogManager(@NonNull LogManagerConfig config, @NonNull SetupLog setupLog) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (setupLog == null) throw new IllegalArgumentException("setupLog cannot be null");
        this.config = config;
        this.setupLog = setupLog;
    }

    /**
     * Manager over existing writers; they are not closed when the manager stops.
     */
    public static @NonNull LogManager of(@NonNull LogWriter... logWriters) {
        LogManagerConfig config = new LogManagerConfig();
        for (LogWriter w : logWriters) config.addWriter(new UseExistingLogWriterConfig(w));
        return new LogManager(config);
    }

    public static @NonNull LogManager of(@NonNull LogWriterConfig... writerConfigs) {
        return new LogManager(new LogManagerConfig(writerConfigs));
    }
    // [/🧩 Section: construction]

    // 🧩 Section: lifecycle
    @Override
    protected void internalStart() {
        if (!writers.isEmpty() || !backgroundWriters.isEmpty()) {
            internalStop();
        }
        for (LogWriterConfig writerConfig : config.writers()) {
            writers.put(writerConfig, new BuiltWriter(writerConfig, build(writerConfig)));
        }
        // 🧩 Point: lifecycle/start-order
        for (BackgroundMultiLogWriter background : backgroundWriters.values()) {
            try {
                background.start();
            } catch (RuntimeException e) {
                setupTracer().severe(e, "Starting {} failed", background);
            }
        }
        for (BuiltWriter built : writers.values()) {
            if (built.writer() == null) continue;
            try {
                built.writer().start();
            } catch (RuntimeException e) {
                setupTracer().severe(e, "Starting {} for {} failed", built.writer(), built.config());
            }
        }
        DIAG.debug("{} built {} writers", this, writers.size());
    }

    private @Nullable LogWriter build(LogWriterConfig writerConfig) {
        LogWriter base;
        try {
            base = writerConfig.createLogWriter(setupLog);
        } catch (RuntimeException e) {
            recordBuildFailure(writerConfig, "createLogWriter threw", e);
            return null;
        }
        if (base == null) {
            recordBuildFailure(writerConfig, "createLogWriter returned null", null);
            return null;
        }
        try {
            DependencyRegistry registry = new DependencyRegistry();
            registry.register(SetupLog.class, setupLog);
            registry.register(LogManager.class, this);
            registry.register(LogWriterConfig.class, writerConfig);
            registry.registerByClass(writerConfig);
            registry.registerByClass(base);

            List<LogWriterInitializer> initializers = new ArrayList<>(writerConfig.initializers());
            initializers.addAll(config.initializers());

            LogWriter current = base;
            for (LogWriterInitializer initializer : initializers) {
                if (!(initializer instanceof PipelineInitializer)) continue;
                LogWriter next = ((PipelineInitializer) initializer).initialize(current, registry);
                if (next == null) {
                    throw new ConfigurationException(initializer + " returned a null writer");
                }
                registry.registerByClass(next);
                current = next;
            }
            registry.register(LogWriter.class, current);
            registry.seal();
            for (LogWriterInitializer initializer : initializers) {
                if (initializer instanceof ImportInitializer) {
                    ((ImportInitializer) initializer).importDependencies(registry);
                }
            }
            if (writerConfig.isDisposeOnStop()) disposeOnStop.add(current);
            return current;
        } catch (RuntimeException e) {
            recordBuildFailure(writerConfig, "initializer pipeline failed", e);
            return null;
        }
    }

    private void recordBuildFailure(LogWriterConfig writerConfig, String reason, @Nullable Throwable cause) {
        setupTracer().severe(new LogWriterBuildException("Building writer for " + writerConfig + ": " + reason, cause),
                "Build of {} failed: {}; other writers are unaffected", writerConfig, reason);
    }

    @Override
    protected void internalStop() {
        for (BuiltWriter built : writers.values()) {
            if (built.writer() == null) continue;
            try {
                built.writer().stop();
            } catch (RuntimeException e) {
                setupTracer().error(e, "Stopping {} failed", built.writer());
            }
        }
        for (LogWriter writer : disposeOnStop) {
            try {
                writer.close();
            } catch (RuntimeException e) {
                setupTracer().error(e, "Closing {} failed", writer);
            }
        }
        disposeOnStop.clear();
        writers.clear();
        // 🧩 Point: lifecycle/drain-after-writers
        for (BackgroundMultiLogWriter background : backgroundWriters.values()) {
            try {
                background.close();
            } catch (RuntimeException e) {
                setupTracer().error(e, "Stopping {} failed", background);
            }
        }
        backgroundWriters.clear();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: lookups

    /**
     * @return the running writer for {@code writerConfig}, or empty if its build failed or the
     * manager is closed
     * @throws ConfigurationException if {@code writerConfig} is not configured
     */
    public @NonNull Optional<LogWriter> getLogWriter(@NonNull LogWriterConfig writerConfig) {
        ensureStarted();
        lock.lock();
        try {
            if (isDisposed()) return Optional.empty();
            return Optional.ofNullable(requireKnown(writerConfig).writer());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the entry writer of {@code writerConfig}'s writer for {@code entryType}, or a
     * {@link NoOpEntryWriter} if the writer is broken, not started or incompatible
     * @throws ConfigurationException if {@code writerConfig} is not configured
     */
    public <T> @NonNull EntryWriter<T> getEntryWriter(@NonNull Class<T> entryType, @NonNull LogWriterConfig writerConfig) {
        ensureStarted();
        LogWriter writer;
        lock.lock();
        try {
            if (isDisposed()) {
                setupTracer().warn("getEntryWriter({}) on closed manager returns a no-op writer", writerConfig);
                return NoOpEntryWriter.instance();
            }
            writer = requireKnown(writerConfig).writer();
        } finally {
            lock.unlock();
        }
        if (writer == null) {
            setupTracer().warn("No writer for {} (build failed); returning a no-op writer", writerConfig);
            return NoOpEntryWriter.instance();
        }
        if (!writer.isStarted()) {
            setupTracer().warn("{} is {}; returning a no-op writer", writer, writer.state());
            return NoOpEntryWriter.instance();
        }
        Optional<EntryWriter<T>> entryWriter = writer.tryGetEntryWriter(entryType);
        if (entryWriter.isEmpty()) {
            setupTracer().warn("{} has no entry writer for {}; returning a no-op writer", writer, entryType.getName());
            return NoOpEntryWriter.instance();
        }
        return entryWriter.get();
    }

    /**
     * @return every compatible entry writer of every started writer, in descriptor order
     */
    public <T> @NonNull List<EntryWriter<T>> getEntryWriters(@NonNull Class<T> entryType) {
        List<EntryWriter<T>> out = new ArrayList<>();
        for (LogWriter writer : getLogWriters()) {
            if (!writer.isStarted()) continue;
            writer.tryGetEntryWriter(entryType).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Aggregate entry writer: no-op for none, the writer itself for one, a
     * {@link FanOutEntryWriter} for several.
     */
    public <T> @NonNull EntryWriter<T> getEntryWriter(@NonNull Class<T> entryType) {
        List<EntryWriter<T>> all = getEntryWriters(entryType);
        if (all.isEmpty()) return NoOpEntryWriter.instance();
        if (all.size() == 1) return all.get(0);
        return new FanOutEntryWriter<>(all, setupLog);
    }

    /**
     * @return successfully built writers in descriptor order
     */
    public @NonNull List<LogWriter> getLogWriters() {
        ensureStarted();
        lock.lock();
        try {
            List<LogWriter> out = new ArrayList<>();
            for (BuiltWriter built : writers.values()) {
                if (built.writer() != null) out.add(built.writer());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    private BuiltWriter requireKnown(LogWriterConfig writerConfig) {
        BuiltWriter built = writerConfig == null ? null : writers.get(writerConfig);
        if (built == null) {
            throw new ConfigurationException("LogWriterConfig " + writerConfig + " is not configured in " + this);
        }
        return built;
    }
    // [/🧩 Section: lookups]

    // 🧩 Section: background

    /**
     * Shared background writer for {@code key}, created by {@code factory} on first use. Used by
     * initializers so that one consumer thread serves many writers. Background writers are
     * started with the manager and closed when it stops.
     */
    public @NonNull BackgroundMultiLogWriter backgroundWriterFor(@NonNull Object key,
                                                                 @NonNull Supplier<BackgroundMultiLogWriter> factory) {
        lock.lock();
        try {
            return backgroundWriters.computeIfAbsent(key, k -> factory.get());
        } finally {
            lock.unlock();
        }
    }

    public @NonNull List<BackgroundMultiLogWriter> backgroundWriters() {
        lock.lock();
        try {
            return List.copyOf(backgroundWriters.values());
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: background]

    public @NonNull LogManagerConfig config() {
        return config;
    }

    @Override
    public @NonNull SetupLog setupLog() {
        return setupLog;
    }

    private Tracer setupTracer() {
        return setupLog.tracerFor(LogManager.class);
    }

    @Override
    public String toString() {
        return "LogManager(" + state() + ", writers=" + config.writers().size() + ")";
    }
}
