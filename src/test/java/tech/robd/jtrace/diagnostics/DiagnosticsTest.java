/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/diagnostics/DiagnosticsTest.java
 description: Global switch, owner-bound instances and setup-log mirroring of the diagnostics facade.
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

package tech.robd.jtrace.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.TraceLevel;

import static org.junit.jupiter.api.Assertions.*;

final class DiagnosticsTest {

    private static final String MIRRORED = "diag.mirror.Component";

    private boolean wasEnabled;
    private Logger mirrored;
    private Logger owned;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        wasEnabled = Diagnostics.isEnabled();
        appender = new ListAppender<>();
        appender.start();
        mirrored = (Logger) LoggerFactory.getLogger(MIRRORED);
        owned = (Logger) LoggerFactory.getLogger(DiagnosticsTest.class);
        for (Logger l : new Logger[]{mirrored, owned}) {
            l.setLevel(Level.DEBUG);
            l.addAppender(appender);
        }
    }

    @AfterEach
    void detach() {
        for (Logger l : new Logger[]{mirrored, owned}) {
            l.detachAppender(appender);
            l.setLevel(null);
        }
        if (wasEnabled) Diagnostics.enable(); else Diagnostics.disable();
    }

    @Test
    void setupLogEntriesAreMirroredWhileEnabled() {
        Diagnostics.enable();
        SetupLog setupLog = new SetupLog(8);
        setupLog.getTracer(MIRRORED).severe(new IllegalStateException("bad"), "build of {} failed", "x");

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel(), "SEVERE is written as error");
        assertEquals("build of x failed", event.getFormattedMessage());
        assertEquals("bad", event.getThrowableProxy().getMessage());

        Diagnostics.disable();
        setupLog.getTracer(MIRRORED).warn("quiet");
        assertEquals(1, appender.list.size());
        assertEquals(2, setupLog.size(), "the setup log itself is always on");
    }

    @Test
    void ofSnapshotsTheSwitchAndDynamicChecksPerCall() {
        Diagnostics.disable();
        Diagnostics snapshot = Diagnostics.of(DiagnosticsTest.class);
        Diagnostics dynamic = Diagnostics.dynamic(DiagnosticsTest.class);
        assertSame(NoOpDiagnostics.INSTANCE, snapshot);

        Diagnostics.enable();
        snapshot.warn("never {}", 1);
        dynamic.warn("now {}", 2);
        dynamic.debug("detail");

        assertEquals(2, appender.list.size());
        assertEquals("now 2", appender.list.get(0).getFormattedMessage());
        assertEquals(DiagnosticsTest.class.getName(), appender.list.get(0).getLoggerName());
        assertEquals(Level.DEBUG, appender.list.get(1).getLevel());
        assertEquals(DiagnosticsTest.class, Diagnostics.of(DiagnosticsTest.class).owner());
    }

    @Test
    void slf4jLevelMapping() {
        assertEquals(DiagnosticsBackend.toSlf4jLevel(TraceLevel.DEBUG), DiagnosticsBackend.toSlf4jLevel(TraceLevel.VERBOSE));
        assertEquals(DiagnosticsBackend.toSlf4jLevel(TraceLevel.ERROR), DiagnosticsBackend.toSlf4jLevel(TraceLevel.SEVERE));
        assertThrows(IllegalArgumentException.class, () -> Diagnostics.dynamic(null));
    }
}
