/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/LogManagerTest.java
 description: LogManager build pipeline, failure isolation, lookups, aggregate shapes and lifecycle.
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

package tech.robd.jtrace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.robd.jtrace.config.LogManagerConfig;
import tech.robd.jtrace.config.LogWriterConfig;
import tech.robd.jtrace.config.UseExistingLogWriterConfig;
import tech.robd.jtrace.config.initializer.DependencyRegistry;
import tech.robd.jtrace.config.initializer.ImportInitializer;
import tech.robd.jtrace.config.initializer.PipelineInitializer;
import tech.robd.jtrace.tools.FailingLogWriterConfig;
import tech.robd.jtrace.tools.RecordingLogWriter;
import tech.robd.jtrace.writer.EntryWriter;
import tech.robd.jtrace.writer.FanOutEntryWriter;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.NoOpEntryWriter;
import tech.robd.jtrace.writer.SynchronizingLogWriter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class LogManagerTest {

    @Test
    @DisplayName("A descriptor that fails to build is recorded and skipped")
    void buildFailureIsIsolated() {
        RecordingLogWriter sink = new RecordingLogWriter();
        LogWriterConfig throwing = FailingLogWriterConfig.throwing("a");
        LogWriterConfig returningNull = FailingLogWriterConfig.returningNull("b");
        LogWriterConfig healthy = new UseExistingLogWriterConfig(sink);
        try (LogManager lm = LogManager.of(throwing, returningNull, healthy)) {
            lm.start();

            assertEquals(LifecycleState.STARTED, lm.state());
            assertTrue(lm.getLogWriter(throwing).isEmpty());
            assertTrue(lm.getLogWriter(returningNull).isEmpty());
            assertSame(sink, lm.getLogWriter(healthy).orElseThrow());
            assertTrue(sink.isStarted());
            assertEquals(2, lm.setupLog().count(e -> e.level() == TraceLevel.SEVERE
                    && e.error() instanceof LogWriterBuildException));
        }
    }

    @Test
    @DisplayName("Unknown descriptors are caller errors")
    void unknownDescriptor() {
        try (LogManager lm = LogManager.of(new RecordingLogWriter())) {
            LogWriterConfig unknown = new UseExistingLogWriterConfig(new RecordingLogWriter());
            assertThrows(ConfigurationException.class, () -> lm.getLogWriter(unknown));
            assertThrows(ConfigurationException.class, () -> lm.getEntryWriter(TraceEntry.class, unknown));
        }
    }

    @Test
    @DisplayName("Broken, unstarted or incompatible writers yield a no-op entry writer")
    void noOpForUnusableWriters() {
        RecordingLogWriter failsToStart = new RecordingLogWriter() {
            @Override
            protected void internalStart() {
                throw new IllegalStateException("port in use");
            }
        };
        RecordingLogWriter healthy = new RecordingLogWriter();
        LogWriterConfig failedBuild = FailingLogWriterConfig.throwing("x");
        LogWriterConfig failedStart = new UseExistingLogWriterConfig(failsToStart);
        LogWriterConfig ok = new UseExistingLogWriterConfig(healthy);
        try (LogManager lm = LogManager.of(failedBuild, failedStart, ok)) {
            assertSame(NoOpEntryWriter.instance(), lm.getEntryWriter(TraceEntry.class, failedBuild));
            assertSame(NoOpEntryWriter.instance(), lm.getEntryWriter(TraceEntry.class, failedStart));
            assertSame(NoOpEntryWriter.instance(), lm.getEntryWriter(String.class, ok));
            assertSame(healthy, lm.getEntryWriter(TraceEntry.class, ok));

            assertEquals(LifecycleState.FAILED, failsToStart.state());
            assertTrue(healthy.isStarted(), "a failed start does not affect other writers");
            assertTrue(lm.setupLog().count(e -> e.level() == TraceLevel.WARN) >= 3);
        }
    }

    @Test
    @DisplayName("Aggregate entry writer: none -> no-op, one -> itself, many -> fan-out")
    void aggregateShapes() {
        try (LogManager none = new LogManager()) {
            assertSame(NoOpEntryWriter.instance(), none.getEntryWriter(TraceEntry.class));
            assertTrue(none.getEntryWriters(TraceEntry.class).isEmpty());
        }

        RecordingLogWriter only = new RecordingLogWriter();
        try (LogManager one = LogManager.of(only)) {
            assertSame(only, one.getEntryWriter(TraceEntry.class));
        }

        RecordingLogWriter first = new RecordingLogWriter();
        RecordingLogWriter second = new RecordingLogWriter();
        try (LogManager many = LogManager.of(first, second)) {
            EntryWriter<TraceEntry> aggregate = many.getEntryWriter(TraceEntry.class);
            FanOutEntryWriter<TraceEntry> fanOut = assertInstanceOf(FanOutEntryWriter.class, aggregate);
            assertEquals(2, fanOut.writers().size());

            aggregate.write(TraceEntry.of("Agg", TraceLevel.INFO, "both"));
            assertEquals(List.of("both"), first.messages());
            assertEquals(List.of("both"), second.messages());
        }
    }

    @Test
    @DisplayName("Equal descriptors are deduplicated")
    void deduplication() {
        RecordingLogWriter sink = new RecordingLogWriter();
        LogManagerConfig config = new LogManagerConfig();
        assertTrue(config.addWriter(new UseExistingLogWriterConfig(sink)));
        assertFalse(config.addWriter(new UseExistingLogWriterConfig(sink)));
        try (LogManager lm = new LogManager(config)) {
            assertEquals(1, lm.getLogWriters().size());
        }
        assertThrows(ConfigurationException.class, () -> config.addWriter(null));
    }

    @Test
    @DisplayName("Pipeline runs descriptor initializers, then global ones, then imports on a sealed registry")
    void pipelineOrderAndRegistry() {
        RecordingLogWriter sink = new RecordingLogWriter();
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<DependencyRegistry> seen = new AtomicReference<>();

        PipelineInitializer local = (writer, registry) -> {
            order.add("local");
            assertSame(sink, writer);
            assertTrue(registry.find(RecordingLogWriter.class).isPresent());
            return new SynchronizingLogWriter(writer);
        };
        PipelineInitializer global = (writer, registry) -> {
            order.add("global");
            assertInstanceOf(SynchronizingLogWriter.class, writer);
            assertTrue(registry.find(SynchronizingLogWriter.class).isPresent());
            return writer;
        };
        ImportInitializer imports = registry -> {
            order.add("import");
            seen.set(registry);
        };

        UseExistingLogWriterConfig descriptor = new UseExistingLogWriterConfig(sink);
        descriptor.addInitializer(local).addInitializer(imports);
        LogManagerConfig config = new LogManagerConfig(descriptor).addInitializer(global);

        try (LogManager lm = new LogManager(config)) {
            LogWriter built = lm.getLogWriter(descriptor).orElseThrow();

            assertEquals(List.of("local", "global", "import"), order);
            assertInstanceOf(SynchronizingLogWriter.class, built);
            assertTrue(built.isStarted());
            assertTrue(sink.isStarted(), "starting the proxy starts the real writer");

            DependencyRegistry registry = seen.get();
            assertTrue(registry.isSealed());
            assertSame(built, registry.require(LogWriter.class));
            assertSame(lm, registry.require(LogManager.class));
            assertSame(lm.setupLog(), registry.require(SetupLog.class));
            assertSame(descriptor, registry.require(LogWriterConfig.class));
            assertThrows(LifecycleStateException.class, () -> registry.register(String.class, "late"));
        }
    }

    @Test
    @DisplayName("A pipeline stage returning null fails only that descriptor")
    void nullPipelineResultIsBuildFailure() {
        RecordingLogWriter sink = new RecordingLogWriter();
        UseExistingLogWriterConfig descriptor = new UseExistingLogWriterConfig(sink);
        PipelineInitializer broken = (writer, registry) -> null;
        descriptor.addInitializer(broken);
        try (LogManager lm = new LogManager(new LogManagerConfig(descriptor))) {
            assertTrue(lm.getLogWriter(descriptor).isEmpty());
            assertTrue(lm.setupLog().stream().anyMatch(e -> e.error() instanceof LogWriterBuildException
                    && e.error().getCause() instanceof ConfigurationException));
        }
    }

    @Test
    @DisplayName("stop() closes dispose-on-stop writers and only stops the others")
    void disposeOnStop() {
        RecordingLogWriter disposable = new RecordingLogWriter();
        RecordingLogWriter kept = new RecordingLogWriter();
        LogManager lm = LogManager.of(
                new UseExistingLogWriterConfig(disposable, true),
                new UseExistingLogWriterConfig(kept, false));
        lm.start();
        lm.stop();
        lm.stop();

        assertEquals(LifecycleState.DISPOSED, disposable.state());
        assertEquals(1, disposable.disposeCount());
        assertEquals(LifecycleState.STOPPED, kept.state());
        assertEquals(0, kept.disposeCount());
        assertEquals(1, kept.stopCount(), "stop is idempotent");
        lm.close();
    }

    @Test
    @DisplayName("start() on a running manager rebuilds and restarts writers")
    void restart() {
        RecordingLogWriter sink = new RecordingLogWriter();
        try (LogManager lm = LogManager.of(sink)) {
            lm.start();
            lm.start();
            assertEquals(2, sink.startCount());
            assertEquals(1, sink.stopCount());
            assertTrue(sink.isStarted());
        }
        assertEquals(2, sink.stopCount());
    }

    @Test
    @DisplayName("A closed manager answers lookups with empty results")
    void closedManager() {
        RecordingLogWriter sink = new RecordingLogWriter();
        LogWriterConfig descriptor = new UseExistingLogWriterConfig(sink);
        LogManager lm = LogManager.of(descriptor);
        lm.start();
        lm.close();

        assertTrue(lm.isDisposed());
        assertTrue(lm.getLogWriter(descriptor).isEmpty());
        assertSame(NoOpEntryWriter.instance(), lm.getEntryWriter(TraceEntry.class, descriptor));
        assertTrue(lm.getLogWriters().isEmpty());
        assertFalse(sink.isStarted());
    }

    @Test
    void getLogWritersListsOnlyBuiltWriters() {
        RecordingLogWriter first = new RecordingLogWriter();
        RecordingLogWriter second = new RecordingLogWriter();
        try (LogManager lm = LogManager.of(new UseExistingLogWriterConfig(first),
                FailingLogWriterConfig.throwing("broken"), new UseExistingLogWriterConfig(second))) {
            assertEquals(List.of(first, second), lm.getLogWriters());
            assertEquals(LifecycleState.STARTED, lm.state(), "lookups start the manager");
        }
    }
}
