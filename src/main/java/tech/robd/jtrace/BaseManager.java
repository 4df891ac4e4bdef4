/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/BaseManager.java
 description: Lock-guarded start/stop/close lifecycle shared by LogManager and TraceManager.
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
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Common lifecycle for managers.
 *
 * <p>All transitions run under {@link #lock}, which subclasses also use to guard their own tables.
 * The lock is never held while a log call writes to a sink.</p>
 *
 * <ul>
 *   <li>{@link #start()} always (re)runs {@link #internalStart()}; a manager that is already
 *       started is rebuilt. Failures are recorded in the setup log at {@code SEVERE} and leave the
 *       manager {@code FAILED}; they are not thrown.</li>
 *   <li>{@link #ensureStarted()} starts only if not started.</li>
 *   <li>{@link #stop()} is idempotent.</li>
 *   <li>{@link #close()} stops and is terminal; {@code start()} after close is ignored with a
 *       warning.</li>
 * </ul>
 */
public abstract class BaseManager implements Startable, AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(BaseManager.class);

    // 🧩 Section: state
    protected final ReentrantLock lock = new ReentrantLock();
    private volatile LifecycleState state = LifecycleState.NOT_STARTED;
    // [/🧩 Section: state]

    // 🧩 Section: lifecycle
    @Override
    public final void start() {
        lock.lock();
        try {
            if (state == LifecycleState.DISPOSED) {
                setupLog().tracerFor(getClass()).warn("start() ignored: {} is closed", this);
                return;
            }
            try {
                internalStart();
                state = LifecycleState.STARTED;
                DIAG.debug("{} started", this);
            } catch (RuntimeException e) {
                state = LifecycleState.FAILED;
                setupLog().tracerFor(getClass()).severe(e, "Start of {} failed", this);
            }
        } finally {
            lock.unlock();
        }
    }

    public final void ensureStarted() {
        // 🧩 Point: lifecycle/fast-path
        LifecycleState s = state;
        if (s == LifecycleState.STARTED || s == LifecycleState.DISPOSED) return;
        lock.lock();
        try {
            if (state != LifecycleState.STARTED && state != LifecycleState.DISPOSED) {
                start();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final void stop() {
        lock.lock();
        try {
            if (state != LifecycleState.STARTED && state != LifecycleState.FAILED) return;
            try {
                internalStop();
            } catch (RuntimeException e) {
                setupLog().tracerFor(getClass()).error(e, "Stop of {} failed", this);
            } finally {
                state = LifecycleState.STOPPED;
                DIAG.debug("{} stopped", this);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final void close() {
        lock.lock();
        try {
            if (state == LifecycleState.DISPOSED) return;
            stop();
            try {
                internalClose();
            } finally {
                state = LifecycleState.DISPOSED;
            }
        } finally {
            lock.unlock();
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
    protected abstract void internalStart();

    protected abstract void internalStop();

    /**
     * Runs once, after the final stop, under the lock.
     */
    protected void internalClose() {
    }

    public abstract @NonNull SetupLog setupLog();
    // [/🧩 Section: hooks]
}
