/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceManager.java
 description: Tracer registry and routing: binds each tracer to the sinks whose switch sets match its name.
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
import tech.robd.jtrace.config.LogManagerConfig;
import tech.robd.jtrace.config.LogWriterConfig;
import tech.robd.jtrace.config.TraceManagerConfig;
import tech.robd.jtrace.config.TraceWriterConfig;
import tech.robd.jtrace.config.UseExistingLogWriterConfig;
import tech.robd.jtrace.diagnostics.Diagnostics;
import tech.robd.jtrace.switches.SwitchSet;
import tech.robd.jtrace.switches.ThresholdTraceSwitch;
import tech.robd.jtrace.switches.TraceSwitch;
import tech.robd.jtrace.writer.EntryWriter;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.NoOpEntryWriter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Hands out {@link Tracer}s and keeps them bound to the configured sinks.
 *
 * <h2>Routing</h2>
 * Each {@link TraceWriterConfig} pairs a sink with a {@link SwitchSet}. A tracer is bound to one
 * writer per sink whose switch set has a match for the tracer's name; the matching switch then
 * decides per call and level.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} makes sure the {@link LogManager} runs every configured sink, rebuilding
 *       it only when a sink is missing, then rebinds every registered tracer.</li>
 *   <li>{@link #stop()} rebinds every tracer to nothing; handles already held become inert.</li>
 *   <li>{@link #close()} stops; later {@link #getTracer(String)} calls return inert tracers.</li>
 * </ul>
 *
 * <h2>Registry</h2>
 * One tracer per normalized name. Each {@code getTracer} counts a holder and
 * {@link #releaseTracer(Tracer)} gives one back; a tracer with no holders is removed by the next
 * sweep ({@code start()}, {@link #purgeReclaimedTracers()}) or lookup of its name. Tracers that
 * are never released live as long as the manager.
 */
public final class TraceManager extends BaseManager implements TracerFactory {

    private static final Diagnostics DIAG = Diagnostics.of(TraceManager.class);

    private record ActiveTraceWriter(@NonNull TraceWriterConfig config, @NonNull EntryWriter<TraceEntry> entryWriter) {
    }

    private static final class Registration {
        final Tracer tracer;
        int holders = 1;

        Registration(Tracer tracer) {
            this.tracer = tracer;
        }
    }

    // 🧩 Section: state
    private final @NonNull LogManager logManager;
    private final boolean ownsLogManager;
    private final @NonNull TraceManagerConfig config;
    // guarded by lock
    private final Map<String, Registration> tracers = new HashMap<>();
    private volatile List<ActiveTraceWriter> activeWriters = List.of();
    // [/🧩 Section: state]

    // 🧩 Section: construction

    /**
     * Manager writing {@code INFO} and above (or {@code jtrace.default.threshold}) to SLF4J.
     */
    public TraceManager() {
        this(TraceManagerConfig.createDefault());
    }

    public TraceManager(@NonNull TraceManagerConfig config) {
        this(config, new SetupLog());
    }

    public TraceManager(@NonNull TraceManagerConfig config, @NonNull SetupLog setupLog) {
        this(new LogManager(new LogManagerConfig(), setupLog), config, true);
    }

    /**
     * Manager over a shared {@link LogManager}. The log manager is started as needed but not
     * stopped or closed by this manager.
     */
    public TraceManager(@NonNull LogManager logManager, @NonNull TraceManagerConfig config) {
        this(logManager, config, false);
    }

    private TraceManager(LogManager logManager, TraceManagerConfig config, boolean ownsLogManager) {
        if (logManager == null) throw new IllegalArgumentException("logManager cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.logManager = logManager;
        this.config = config;
        this.ownsLogManager = ownsLogManager;
    }

    public static @NonNull TraceManager forWriter(@NonNull LogWriter logWriter) {
        return forWriter(logWriter, new ThresholdTraceSwitch(JTraceProperties.defaultThreshold()));
    }

    public static @NonNull TraceManager forWriter(@NonNull LogWriter logWriter, @NonNull TraceSwitch traceSwitch) {
        return forWriter(logWriter, traceSwitch, Tracer.ALL);
    }

    public static @NonNull TraceManager forWriter(@NonNull LogWriter logWriter,
                                                  @NonNull TraceSwitch traceSwitch,
                                                  @Nullable String prefix) {
        return forWriter(logWriter, SwitchSet.of(prefix, traceSwitch));
    }

    public static @NonNull TraceManager forWriter(@NonNull LogWriter logWriter, @NonNull SwitchSet switches) {
        return new TraceManager(new TraceManagerConfig(
                new TraceWriterConfig(new UseExistingLogWriterConfig(logWriter), switches)));
    }

    /**
     * Process-wide default manager, created on first use. Meant for application entry points;
     * libraries should take a {@link TracerFactory} instead.
     */
    public static @NonNull TraceManager instance() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        static final TraceManager INSTANCE = new TraceManager();
    }
    // [/🧩 Section: construction]

    // 🧩 Section: lifecycle
    @Override
    protected void internalStart() {
        List<TraceWriterConfig> writerConfigs = config.writers();
        List<LogWriterConfig> needed = new ArrayList<>();
        for (TraceWriterConfig twc : writerConfigs) needed.add(twc.logWriterConfig());

        // 🧩 Point: lifecycle/avoid-restart
        LogManagerConfig logConfig = logManager.config();
        if (logConfig.containsAll(needed)) {
            logManager.ensureStarted();
        } else {
            logConfig.addWriters(needed);
            logManager.start();
        }

        List<ActiveTraceWriter> active = new ArrayList<>();
        for (TraceWriterConfig twc : writerConfigs) {
            EntryWriter<TraceEntry> entryWriter = logManager.getEntryWriter(TraceEntry.class, twc.logWriterConfig());
            if (entryWriter instanceof NoOpEntryWriter) {
                setupTracer().warn("Skipping {}: no usable TraceEntry writer", twc);
                continue;
            }
            active.add(new ActiveTraceWriter(twc, entryWriter));
        }
        activeWriters = List.copyOf(active);

        int purged = 0;
        Iterator<Registration> it = tracers.values().iterator();
        while (it.hasNext()) {
            Registration r = it.next();
            if (r.holders <= 0) {
                r.tracer.configure(List.of());
                it.remove();
                purged++;
            } else {
                r.tracer.configure(traceWritersFor(r.tracer.name()));
            }
        }
        DIAG.debug("{} started: {} active writers, {} tracers rebound, {} purged",
                this, active.size(), tracers.size(), purged);
    }

    @Override
    protected void internalStop() {
        activeWriters = List.of();
        for (Registration r : tracers.values()) {
            r.tracer.configure(List.of());
        }
        if (ownsLogManager) logManager.stop();
    }

    @Override
    protected void internalClose() {
        tracers.clear();
        if (ownsLogManager) logManager.close();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: tracers
    @Override
    public @NonNull Tracer getTracer(@Nullable String name) {
        ensureStarted();
        String normalized = Tracer.normalizeName(name);
        lock.lock();
        try {
            if (isDisposed()) {
                setupTracer().warn("getTracer('{}') after close returns an inert tracer", normalized);
                return new Tracer(normalized, setupLog());
            }
            Registration existing = tracers.get(normalized);
            if (existing != null && existing.holders > 0) {
                existing.holders++;
                return existing.tracer;
            }
            if (existing != null) {
                existing.tracer.configure(List.of());
            }
            Tracer tracer = new Tracer(normalized, setupLog());
            tracer.configure(traceWritersFor(normalized));
            tracers.put(normalized, new Registration(tracer));
            return tracer;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back one hold on {@code tracer}. Once every {@code getTracer} for its name has been
     * matched by a release, the next sweep or lookup drops it and makes it inert.
     *
     * @return {@code false} if {@code tracer} is not registered here or has no holders left
     */
    public boolean releaseTracer(@NonNull Tracer tracer) {
        if (tracer == null) return false;
        lock.lock();
        try {
            Registration r = tracers.get(tracer.name());
            if (r == null || r.tracer != tracer || r.holders <= 0) return false;
            r.holders--;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of released tracers removed
     */
    public int purgeReclaimedTracers() {
        lock.lock();
        try {
            int purged = 0;
            Iterator<Registration> it = tracers.values().iterator();
            while (it.hasNext()) {
                Registration r = it.next();
                if (r.holders <= 0) {
                    r.tracer.configure(List.of());
                    it.remove();
                    purged++;
                }
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of tracers currently registered, released or not
     */
    public int registeredTracerCount() {
        lock.lock();
        try {
            return tracers.size();
        } finally {
            lock.unlock();
        }
    }

    private List<TraceWriter> traceWritersFor(String tracerName) {
        List<TraceWriter> out = new ArrayList<>();
        for (ActiveTraceWriter active : activeWriters) {
            active.config().switches().findBestMatch(tracerName).ifPresent(sw -> out.add(
                    new TraceWriter(sw, active.entryWriter(), setupLog(), active.config().logWriterConfig().toString())));
        }
        return out;
    }
    // [/🧩 Section: tracers]

    public @NonNull TraceManagerConfig config() {
        return config;
    }

    public @NonNull LogManager logManager() {
        return logManager;
    }

    @Override
    public @NonNull SetupLog setupLog() {
        return logManager.setupLog();
    }

    private Tracer setupTracer() {
        return setupLog().tracerFor(TraceManager.class);
    }

    @Override
    public String toString() {
        return "TraceManager(" + state() + ", writers=" + config.writers().size() + ")";
    }
}
