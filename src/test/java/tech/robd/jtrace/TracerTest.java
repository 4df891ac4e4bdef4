/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/TracerTest.java
 description: Tracer call semantics: switching, formatting, isolation and inert handles.
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
import tech.robd.jtrace.config.TraceManagerConfig;
import tech.robd.jtrace.config.TraceWriterConfig;
import tech.robd.jtrace.switches.OnOffTraceSwitch;
import tech.robd.jtrace.switches.SwitchSet;
import tech.robd.jtrace.switches.ThresholdTraceSwitch;
import tech.robd.jtrace.tools.CheckedFailingLogWriter;
import tech.robd.jtrace.tools.RecordingLogWriter;
import tech.robd.jtrace.tools.ThrowingLogWriter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class TracerTest {

    @Test
    @DisplayName("INFO threshold: info recorded, debug suppressed")
    void infoRecordedDebugSuppressed() {
        RecordingLogWriter sink = new RecordingLogWriter();
        try (TraceManager tm = TraceManager.forWriter(sink, new ThresholdTraceSwitch(TraceLevel.INFO))) {
            Tracer tracer = tm.getTracer("Scenario");
            tracer.info("a");
            tracer.debug("b");

            assertEquals(1, sink.count());
            TraceEntry entry = sink.entries().get(0);
            assertEquals("a", entry.message());
            assertEquals(TraceLevel.INFO, entry.level());
            assertEquals("Scenario", entry.tracerName());
            assertNotNull(entry.timestamp());
        }
    }

    @Test
    @DisplayName("Most specific prefix rule suppresses a call the broader rule would allow")
    void mostSpecificRuleApplies() {
        RecordingLogWriter sink = new RecordingLogWriter();
        SwitchSet switches = new SwitchSet()
                .add("App.", new ThresholdTraceSwitch(TraceLevel.INFO))
                .add("App.Sub.", new ThresholdTraceSwitch(TraceLevel.ERROR));
        try (TraceManager tm = TraceManager.forWriter(sink, switches)) {
            tm.getTracer("App.Sub.Worker").warn("suppressed");
            tm.getTracer("App.Other").warn("allowed");
            tm.getTracer("Elsewhere").severe("no rule");

            assertEquals(List.of("allowed"), sink.messages());
            assertEquals(0, tm.getTracer("Elsewhere").writerCount());
        }
    }

    @Test
    @DisplayName("Threshold changes apply to an already obtained tracer")
    void thresholdMutationIsLive() {
        RecordingLogWriter sink = new RecordingLogWriter();
        ThresholdTraceSwitch sw = new ThresholdTraceSwitch(TraceLevel.ERROR);
        try (TraceManager tm = TraceManager.forWriter(sink, sw)) {
            Tracer tracer = tm.tracerFor(TracerTest.class);
            tracer.info("before");
            assertFalse(tracer.isInfoEnabled());

            sw.setThreshold(TraceLevel.DEBUG);
            tracer.info("after");
            assertTrue(tracer.isDebugEnabled());

            assertEquals(List.of("after"), sink.messages());
        }
    }

    @Test
    @DisplayName("After stop a held tracer is inert and never throws")
    void inertAfterStop() {
        RecordingLogWriter sink = new RecordingLogWriter();
        TraceManager tm = TraceManager.forWriter(sink, new OnOffTraceSwitch(true));
        Tracer tracer = tm.getTracer("Held");
        tracer.info("one");
        tm.stop();

        assertDoesNotThrow(() -> {
            tracer.severe("two");
            tracer.error(new RuntimeException("x"), "three {}", 3);
            tracer.logDetails(TraceLevel.WARN, Map.of("k", "v"), "four");
        });
        assertFalse(tracer.isSevereEnabled());
        assertEquals(0, tracer.writerCount());
        assertEquals(List.of("one"), sink.messages());
        tm.close();
    }

    @Test
    @DisplayName("A throwing sink neither reaches the caller nor starves a healthy sink")
    void failingSinkIsIsolated() {
        SetupLog setupLog = new SetupLog();
        ThrowingLogWriter broken = new ThrowingLogWriter(setupLog);
        RecordingLogWriter healthy = new RecordingLogWriter(setupLog);
        TraceManagerConfig config = new TraceManagerConfig(
                new TraceWriterConfig(broken).addSwitch(Tracer.ALL, new OnOffTraceSwitch(true)),
                new TraceWriterConfig(healthy).addSwitch(Tracer.ALL, new ThresholdTraceSwitch(TraceLevel.INFO)));
        try (TraceManager tm = new TraceManager(config, setupLog)) {
            Tracer tracer = tm.getTracer("Isolation");
            int enabledCalls = 0;
            for (int i = 0; i < 10; i++) {
                final int n = i;
                assertDoesNotThrow(() -> tracer.info("msg {}", n));
                enabledCalls++;
                tracer.debug("hidden {}", n);
            }

            assertEquals(enabledCalls, healthy.count());
            assertEquals(20, broken.attempts(), "failing sink stays bound and is retried every call");
            long failures = setupLog.count(e -> e.error() instanceof WriteFailureException);
            assertEquals(20, failures);
            assertTrue(setupLog.hasEntriesAtOrAbove(TraceLevel.ERROR));
        }
    }

    @Test
    @DisplayName("SLF4J placeholders are formatted and a trailing throwable becomes the error")
    void formatting() {
        RecordingLogWriter sink = new RecordingLogWriter();
        try (TraceManager tm = TraceManager.forWriter(sink, new OnOffTraceSwitch(true))) {
            Tracer tracer = tm.getTracer("Fmt");
            IllegalStateException boom = new IllegalStateException("boom");

            tracer.info("{} + {} = {}", 1, 2, 3);
            tracer.warn("failed {}", "op", boom);
            tracer.error(boom, "explicit {}", "cause");
            tracer.log(TraceLevel.VERBOSE, "literal {} kept");
            tracer.logDetails(TraceLevel.INFO, Map.of("id", 7), "with details");

            List<TraceEntry> entries = sink.entries();
            assertEquals("1 + 2 = 3", entries.get(0).message());
            assertEquals("failed op", entries.get(1).message());
            assertSame(boom, entries.get(1).error());
            assertEquals("explicit cause", entries.get(2).message());
            assertSame(boom, entries.get(2).error());
            assertEquals("literal {} kept", entries.get(3).message());
            assertEquals(TraceLevel.VERBOSE, entries.get(3).level());
            assertEquals(Map.of("id", 7), entries.get(4).details());
        }
    }

    @Test
    @DisplayName("Arguments are not formatted when no writer is enabled")
    void noFormattingWhenDisabled() {
        RecordingLogWriter sink = new RecordingLogWriter();
        AtomicInteger toStringCalls = new AtomicInteger();
        Object arg = new Object() {
            @Override
            public String toString() {
                toStringCalls.incrementAndGet();
                return "arg";
            }
        };
        try (TraceManager tm = TraceManager.forWriter(sink, new ThresholdTraceSwitch(TraceLevel.WARN))) {
            Tracer tracer = tm.getTracer("Lazy");
            tracer.debug("value {}", arg);
            assertEquals(0, toStringCalls.get());

            tracer.warn("value {}", arg);
            assertEquals(1, toStringCalls.get());
        }
    }

    @Test
    @DisplayName("One entry instance is shared by every enabled writer")
    void entryBuiltOnce() {
        RecordingLogWriter first = new RecordingLogWriter();
        RecordingLogWriter second = new RecordingLogWriter();
        TraceManagerConfig config = new TraceManagerConfig(
                new TraceWriterConfig(first).addSwitch("", new OnOffTraceSwitch(true)),
                new TraceWriterConfig(second).addSwitch("", new OnOffTraceSwitch(true)));
        try (TraceManager tm = new TraceManager(config)) {
            Tracer tracer = tm.getTracer("Shared");
            assertEquals(2, tracer.writerCount());
            tracer.info("x {}", 1);

            assertSame(first.entries().get(0), second.entries().get(0));
        }
    }

    @Test
    @DisplayName("Throwing argument toString never escapes")
    void throwingArgumentIsContained() {
        RecordingLogWriter sink = new RecordingLogWriter();
        Object hostile = new Object() {
            @Override
            public String toString() {
                throw new UnsupportedOperationException("nope");
            }
        };
        try (TraceManager tm = TraceManager.forWriter(sink, new OnOffTraceSwitch(true))) {
            assertDoesNotThrow(() -> tm.getTracer("Hostile").info("value {}", hostile));
            assertEquals(1, sink.count());
        }
    }

    @Test
    @DisplayName("A manager without writers hands out disabled tracers")
    void noWriters() {
        try (TraceManager tm = new TraceManager(new TraceManagerConfig())) {
            Tracer tracer = tm.getTracer(null);
            assertEquals(Tracer.ALL, tracer.name());
            assertEquals(0, tracer.writerCount());
            assertFalse(tracer.isEnabled(TraceLevel.SEVERE));
            assertDoesNotThrow(() -> tracer.severe("dropped"));
        }
    }

    @Test
    void nameForNestedClass() {
        assertEquals("tech.robd.jtrace.TracerTest.Inner", Tracer.nameFor(Inner.class));
        assertEquals("", Tracer.normalizeName(null));
        assertEquals("A.B", Tracer.normalizeName("  A.B "));
    }

    private static final class Inner {
    }

    @Test
    @DisplayName("A checked exception thrown by a sink does not reach the caller")
    void undeclaredCheckedSinkFailureIsContained() {
        SetupLog setupLog = new SetupLog();
        CheckedFailingLogWriter sink = new CheckedFailingLogWriter(setupLog, 1);
        try (TraceManager tm = new TraceManager(new TraceManagerConfig(
                new TraceWriterConfig(sink).addSwitch(Tracer.ALL, new OnOffTraceSwitch(true))), setupLog)) {
            Tracer tracer = tm.getTracer("x");
            assertDoesNotThrow(() -> tracer.info("a"));
            tracer.info("b");

            assertEquals(List.of("b"), sink.messages(), "the sink stays bound after the failure");
            TraceEntry failure = setupLog.stream()
                    .filter(e -> e.error() instanceof WriteFailureException)
                    .findFirst().orElseThrow();
            assertTrue(failure.error().getCause() instanceof IOException);
            assertEquals("disk full", failure.error().getCause().getMessage());
        }
    }
}
