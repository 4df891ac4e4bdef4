/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/BaseLogWriter.java
 description: Abstract LogWriter with lock-guarded lifecycle transitions (start/stop/close) and
              template hooks for subclasses.
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
import tech.robd.jtrace.LifecycleState;
import tech.robd.jtrace.LifecycleStateException;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.Tracer;
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Base for {@link LogWriter}s.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #start()} runs {@link #internalStart()}; success moves to {@code STARTED}, an
 *       exception moves to {@code FAILED} and is rethrown for the owner to record.</li>
 *   <li>{@link #stop()} runs {@link #internalStop()} from {@code STARTED} or {@code FAILED}.</li>
 *   <li>{@link #close()} stops, runs {@link #internalDispose()}, and is terminal.</li>
 * </ul>
 * Transitions are serialized by a lock; {@link #state()} is a volatile read.
 */
public abstract class BaseLogWriter implements LogWriter {

    private static final Diagnostics DIAG = Diagnostics.of(BaseLogWriter.class);

    // 🧩 Section: state
    private final @NonNull SetupLog setupLog;
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile LifecycleState state = LifecycleState.NOT_STARTED;
    // [/🧩 Section: state]

    protected BaseLogWriter(@NonNull SetupLog setupLog) {
        if (setupLog == null) throw new IllegalArgumentException("SetupLog cannot be null");
        this.setupLog = setupLog;
    }

    // 🧩 Section: lifecycle
    @Override
    public final void start() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.STARTED) return;
            if (state == LifecycleState.DISPOSED) {
                throw new LifecycleStateException("Cannot start disposed log writer " + this);
            }
            try {
                internalStart();
                state = LifecycleState.STARTED;
                DIAG.debug("{} started", this);
            } catch (RuntimeException e) {
                state = LifecycleState.FAILED;
                throw e;
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public final void stop() {
        lifecycleLock.lock();
        try {
            if (state != LifecycleState.STARTED && state != LifecycleState.FAILED) return;
            try {
                internalStop();
            } finally {
                state = LifecycleState.STOPPED;
                DIAG.debug("{} stopped", this);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public final void close() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.DISPOSED) return;
            try {
                stop();
            } finally {
                try {
                    internalDispose();
                } finally {
                    state = LifecycleState.DISPOSED;
                }
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public final LifecycleState state() {
        return state;
    }

    public final boolean isDisposed() {
        return state == LifecycleState.DISPOSED;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: hooks
    protected void internalStart() {
    }

    protected void internalStop() {
    }

    protected void internalDispose() {
    }
    // [/🧩 Section: hooks]

    protected final @NonNull SetupLog setupLog() {
        return setupLog;
    }

    /**
     * @return a setup-log tracer named after the concrete writer class
     */
    protected final @NonNull Tracer setupTracer() {
        return setupLog.tracerFor(getClass());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + state + ")";
    }
}
