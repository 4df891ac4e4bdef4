/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/tools/RecordingLogWriter.java
 description: Test sink recording every TraceEntry, with optional per-write delay and gate.
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

package tech.robd.jtrace.tools;

import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.TraceEntry;
import tech.robd.jtrace.writer.SingleEntryTypeLogWriter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Records entries in arrival order. Writes are accepted whenever called, even when stopped, so
 * tests can observe writes that should not have happened.
 */
public class RecordingLogWriter extends SingleEntryTypeLogWriter<TraceEntry> {

    private final List<TraceEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicInteger starts = new AtomicInteger();
    private final AtomicInteger stops = new AtomicInteger();
    private final AtomicInteger disposals = new AtomicInteger();
    private volatile long writeDelayMs;
    private volatile CountDownLatch gate;

    public RecordingLogWriter() {
        this(new SetupLog());
    }

    public RecordingLogWriter(SetupLog setupLog) {
        super(setupLog, TraceEntry.class);
    }

    /**
     * Every write sleeps this long first.
     */
    public RecordingLogWriter withWriteDelay(long delayMs) {
        this.writeDelayMs = delayMs;
        return this;
    }

    /**
     * Writes block until {@code gate} opens (or 5 s pass).
     */
    public RecordingLogWriter withGate(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    @Override
    public void write(TraceEntry entry) {
        pause();
        record(entry);
    }

    protected void record(TraceEntry entry) {
        entries.add(entry);
    }

    private void pause() {
        try {
            CountDownLatch g = gate;
            if (g != null) g.await(5, TimeUnit.SECONDS);
            long delay = writeDelayMs;
            if (delay > 0) Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected void internalStart() {
        starts.incrementAndGet();
    }

    @Override
    protected void internalStop() {
        stops.incrementAndGet();
    }

    @Override
    protected void internalDispose() {
        disposals.incrementAndGet();
    }

    public List<TraceEntry> entries() {
        return List.copyOf(entries);
    }

    public List<String> messages() {
        return entries.stream().map(TraceEntry::message).collect(Collectors.toList());
    }

    public int count() {
        return entries.size();
    }

    public int startCount() {
        return starts.get();
    }

    public int stopCount() {
        return stops.get();
    }

    public int disposeCount() {
        return disposals.get();
    }

    public void clear() {
        entries.clear();
    }
}
