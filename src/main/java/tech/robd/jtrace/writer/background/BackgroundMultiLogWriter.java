/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/background/BackgroundMultiLogWriter.java
 description: Asynchronous multiplexer: bounded per-proxy queues drained round-robin by one daemon consumer thread.
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

package tech.robd.jtrace.writer.background;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.LifecycleState;
import tech.robd.jtrace.LifecycleStateException;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.Startable;
import tech.robd.jtrace.Tracer;
import tech.robd.jtrace.WriteFailureException;
import tech.robd.jtrace.diagnostics.Diagnostics;
import tech.robd.jtrace.writer.BufferingLogWriter;
import tech.robd.jtrace.writer.EntryWriter;
import tech.robd.jtrace.writer.LogWriter;
import tech.robd.jtrace.writer.SynchronizingLogWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decouples producers from sink latency.
 *
 * <p>{@link #createProxyFor(LogWriter)} fronts a real writer with a proxy whose entry writers only
 * enqueue. One daemon consumer thread visits the proxy queues in registration order, draining up
 * to {@code batchSize} entries from each before moving on, and writes them to the real sinks.</p>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>FIFO per queue. No order across queues.</li>
 *   <li>A full queue applies the {@link BackpressurePolicy}; producers wait at most the enqueue
 *       timeout. Drops are counted, and the first drop on each queue is reported to the setup
 *       log.</li>
 *   <li>An exception writing one entry, checked or not, is reported and the loop continues.</li>
 *   <li>After each batch a {@link BufferingLogWriter} sink is flushed if its predicate is true.</li>
 *   <li>{@link #stop()} stops accepting, drains until the queues are empty or the drain timeout
 *       expires, reports leftovers as drops, and only then stops the real sinks.</li>
 * </ul>
 *
 * <p>Restartable: {@code start()} after {@code stop()} runs a new consumer thread over the same
 * proxies. {@link #close()} is terminal; it closes only the real writers whose proxy was closed,
 * the others are left stopped for their owner.</p>
 */
public final class BackgroundMultiLogWriter implements Startable, AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(BackgroundMultiLogWriter.class);
    private static final long IDLE_WAIT_MS = 10;
    private static final long SHUTDOWN_GRACE_MS = 1_000;
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    // 🧩 Section: state
    private final @NonNull SetupLog setupLog;
    private final @NonNull BackgroundDispatchOptions options;
    private final List<ProxyLogWriter> proxies = new CopyOnWriteArrayList<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Semaphore workSignal = new Semaphore(0);
    private final AtomicLong dropped = new AtomicLong();
    private volatile LifecycleState state = LifecycleState.NOT_STARTED;
    private volatile boolean accepting;
    private volatile boolean stopRequested;
    private volatile long drainDeadlineNanos;
    private @Nullable ExecutorService executor;
    // [/🧩 Section: state]

    public BackgroundMultiLogWriter(@NonNull SetupLog setupLog) {
        this(setupLog, BackgroundDispatchOptions.defaults());
    }

    public BackgroundMultiLogWriter(@NonNull SetupLog setupLog, @NonNull BackgroundDispatchOptions options) {
        if (setupLog == null || options == null) {
            throw new IllegalArgumentException("setupLog and options cannot be null");
        }
        this.setupLog = setupLog;
        this.options = options;
    }

    // 🧩 Section: proxies

    /**
     * Create a proxy for {@code inner}. The proxy exposes one queued entry writer per entry type
     * {@code inner} lists. If this writer is already running the proxy is started immediately.
     *
     * @throws LifecycleStateException if this writer is closed
     */
    public @NonNull LogWriter createProxyFor(@NonNull LogWriter inner) {
        if (inner == null) throw new IllegalArgumentException("inner cannot be null");
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.DISPOSED) {
                throw new LifecycleStateException("Cannot create proxy on closed " + this);
            }
            ProxyLogWriter proxy = new ProxyLogWriter(inner);
            proxies.add(proxy);
            if (state == LifecycleState.STARTED) {
                proxy.start();
            }
            DIAG.debug("Created background proxy for {}", inner);
            return proxy;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * @param writer a proxy returned by {@link #createProxyFor(LogWriter)}, or the real writer it fronts,
     *               also when that writer is wrapped in a {@link SynchronizingLogWriter}
     * @return {@code true} if any queue feeding {@code writer} holds entries not yet written
     */
    public boolean hasPendingEntries(@NonNull LogWriter writer) {
        for (ProxyLogWriter p : proxies) {
            if ((p == writer || p.inner == writer || p.sink == writer) && p.pendingCount() > 0) return true;
        }
        return false;
    }

    public int pendingCount() {
        int total = 0;
        for (ProxyLogWriter p : proxies) total += p.pendingCount();
        return total;
    }

    /**
     * @return entries dropped by backpressure or left over after a drain timeout
     */
    public long droppedCount() {
        return dropped.get();
    }

    public int proxyCount() {
        return proxies.size();
    }

    public @NonNull BackgroundDispatchOptions options() {
        return options;
    }
    // [/🧩 Section: proxies]

    // 🧩 Section: lifecycle
    @Override
    public void start() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.STARTED) return;
            if (state == LifecycleState.DISPOSED) {
                throw new LifecycleStateException("Cannot start closed " + this);
            }
            stopRequested = false;
            for (ProxyLogWriter proxy : proxies) {
                if (proxy.state() == LifecycleState.DISPOSED) continue;
                try {
                    proxy.start();
                } catch (Exception e) {
                    setupTracer().severe(e, "Starting {} failed", proxy.inner);
                }
            }
            ExecutorService exec = Executors.newSingleThreadExecutor(consumerThreadFactory());
            executor = exec;
            accepting = true;
            exec.execute(this::runLoop);
            state = LifecycleState.STARTED;
            DIAG.debug("{} started with {} proxies", this, proxies.size());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void stop() {
        lifecycleLock.lock();
        try {
            if (state != LifecycleState.STARTED) return;
            accepting = false;
            drainDeadlineNanos = System.nanoTime() + options.drainTimeout().toNanos();
            stopRequested = true;
            workSignal.release();
            awaitConsumer();

            long leftover = 0;
            for (ProxyLogWriter proxy : proxies) leftover += proxy.discardPending();
            if (leftover > 0) {
                dropped.addAndGet(leftover);
                setupTracer().warn("{} entries still queued after drain timeout {} were dropped",
                        leftover, options.drainTimeout());
            }
            for (ProxyLogWriter proxy : proxies) proxy.stopInner();
            state = LifecycleState.STOPPED;
            DIAG.debug("{} stopped", this);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void awaitConsumer() {
        ExecutorService exec = executor;
        if (exec == null) return;
        executor = null;
        exec.shutdown();
        // 🧩 Point: lifecycle/bounded-drain
        try {
            long waitMs = options.drainTimeout().toMillis() + SHUTDOWN_GRACE_MS;
            if (!exec.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                exec.shutdownNow();
                if (!exec.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    setupTracer().error("Background consumer did not terminate; a sink may be blocked");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }

    @Override
    public void close() {
        lifecycleLock.lock();
        try {
            if (state == LifecycleState.DISPOSED) return;
            stop();
            proxies.clear();
            state = LifecycleState.DISPOSED;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public LifecycleState state() {
        return state;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: consumer-loop
    private void runLoop() {
        DIAG.debug("Consumer loop running on {}", Thread.currentThread().getName());
        while (!Thread.currentThread().isInterrupted()) {
            workSignal.drainPermits();
            int written;
            try {
                written = drainRound();
            } catch (Exception e) {
                // entry writes are isolated in drainBatch; this covers faults around them
                setupTracer().error(e, "Background consumer round failed; continuing");
                written = 0;
            }
            if (stopRequested && (written == 0 || drainExpired())) break;
            if (written == 0) {
                try {
                    workSignal.tryAcquire(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        DIAG.debug("Consumer loop exiting");
    }

    private int drainRound() {
        int total = 0;
        for (ProxyLogWriter proxy : proxies) {
            int written = 0;
            for (QueueEntryWriter<?> queue : proxy.queues) {
                written += queue.drainBatch(options.batchSize());
            }
            if (written > 0) proxy.flushIfRequested();
            total += written;
        }
        return total;
    }

    private boolean drainExpired() {
        return stopRequested && System.nanoTime() - drainDeadlineNanos > 0;
    }
    // [/🧩 Section: consumer-loop]

    private ThreadFactory consumerThreadFactory() {
        String name = options.threadName() + "-" + THREAD_SEQ.incrementAndGet();
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private Tracer setupTracer() {
        return setupLog.tracerFor(BackgroundMultiLogWriter.class);
    }

    @Override
    public String toString() {
        return "BackgroundMultiLogWriter(" + options.threadName() + ", " + state + ")";
    }

    // 🧩 Section: proxy-writer

    /**
     * Producer-facing side of one real writer.
     */
    private final class ProxyLogWriter implements LogWriter {

        private final LogWriter inner;
        // inner without a synchronizing wrapper
        private final LogWriter sink;
        private final @Nullable SynchronizingLogWriter synchronizer;
        private final List<QueueEntryWriter<?>> queues;
        private final Map<Class<?>, EntryWriter<?>> byType;
        private volatile LifecycleState proxyState = LifecycleState.NOT_STARTED;
        private volatile boolean closeInnerOnStop;

        ProxyLogWriter(LogWriter inner) {
            this.inner = inner;
            this.synchronizer = inner instanceof SynchronizingLogWriter ? (SynchronizingLogWriter) inner : null;
            this.sink = synchronizer != null ? synchronizer.inner() : inner;
            Map<Class<?>, EntryWriter<?>> map = new LinkedHashMap<>();
            List<QueueEntryWriter<?>> list = new ArrayList<>();
            for (Map.Entry<Class<?>, EntryWriter<?>> e : inner.listEntryWriters().entrySet()) {
                QueueEntryWriter<?> q = newQueue(e.getValue());
                list.add(q);
                map.put(e.getKey(), q);
            }
            this.queues = List.copyOf(list);
            this.byType = Collections.unmodifiableMap(map);
        }

        private <T> QueueEntryWriter<T> newQueue(EntryWriter<T> target) {
            return new QueueEntryWriter<>(this, target);
        }

        boolean isAccepting() {
            return accepting && proxyState == LifecycleState.STARTED;
        }

        @Override
        public <T> @NonNull Optional<EntryWriter<T>> tryGetEntryWriter(@NonNull Class<T> entryType) {
            if (entryType == null) return Optional.empty();
            for (Map.Entry<Class<?>, EntryWriter<?>> e : byType.entrySet()) {
                if (e.getKey().isAssignableFrom(entryType)) {
                    @SuppressWarnings("unchecked")
                    EntryWriter<T> w = (EntryWriter<T>) e.getValue();
                    return Optional.of(w);
                }
            }
            return Optional.empty();
        }

        @Override
        public @NonNull Map<Class<?>, EntryWriter<?>> listEntryWriters() {
            return byType;
        }

        @Override
        public synchronized void start() {
            if (proxyState == LifecycleState.STARTED) return;
            if (proxyState == LifecycleState.DISPOSED) {
                throw new LifecycleStateException("Cannot start closed proxy for " + inner);
            }
            try {
                inner.start();
                proxyState = LifecycleState.STARTED;
            } catch (RuntimeException e) {
                proxyState = LifecycleState.FAILED;
                throw e;
            }
        }

        /**
         * Stops accepting; queued entries stay for the consumer. The real writer is stopped here
         * only if no consumer is running.
         */
        @Override
        public synchronized void stop() {
            if (proxyState != LifecycleState.STARTED && proxyState != LifecycleState.FAILED) return;
            proxyState = LifecycleState.STOPPED;
            if (state != LifecycleState.STARTED) stopInner();
        }

        @Override
        public synchronized void close() {
            if (proxyState == LifecycleState.DISPOSED) return;
            stop();
            closeInnerOnStop = true;
            proxyState = LifecycleState.DISPOSED;
            if (state != LifecycleState.STARTED) closeInner();
        }

        @Override
        public LifecycleState state() {
            return proxyState;
        }

        int pendingCount() {
            int n = 0;
            for (QueueEntryWriter<?> q : queues) n += q.size();
            return n;
        }

        long discardPending() {
            long n = 0;
            for (QueueEntryWriter<?> q : queues) n += q.discard();
            return n;
        }

        void flushIfRequested() {
            if (!(sink instanceof BufferingLogWriter buffering)) return;
            try {
                if (!buffering.flushPredicate().getAsBoolean()) return;
                if (synchronizer != null) {
                    synchronizer.runLocked(buffering::flush);
                } else {
                    buffering.flush();
                }
            } catch (Exception e) {
                setupTracer().error(new WriteFailureException("Flush of " + sink + " failed", e),
                        "Flush of {} failed", sink);
            }
        }

        void stopInner() {
            if (closeInnerOnStop) {
                closeInner();
                return;
            }
            try {
                inner.stop();
            } catch (Exception e) {
                setupTracer().error(e, "Stopping {} failed", inner);
            }
            if (proxyState == LifecycleState.STARTED) proxyState = LifecycleState.STOPPED;
        }

        void closeInner() {
            try {
                inner.close();
            } catch (Exception e) {
                setupTracer().error(e, "Closing {} failed", inner);
            }
        }

        @Override
        public String toString() {
            return "BackgroundProxy(" + inner + ")";
        }
    }
    // [/🧩 Section: proxy-writer]

    // 🧩 Section: queue-writer

    /**
     * Bounded queue in front of one real entry writer.
     */
    private final class QueueEntryWriter<T> implements EntryWriter<T> {

        private final ProxyLogWriter proxy;
        private final EntryWriter<T> target;
        private final ArrayBlockingQueue<T> queue = new ArrayBlockingQueue<>(options.queueCapacity());
        private final AtomicLong queueDrops = new AtomicLong();
        private final AtomicBoolean dropReported = new AtomicBoolean();

        QueueEntryWriter(ProxyLogWriter proxy, EntryWriter<T> target) {
            this.proxy = proxy;
            this.target = target;
        }

        @Override
        public boolean isEnabled() {
            return proxy.isAccepting() && target.isEnabled();
        }

        @Override
        public void write(T entry) {
            if (entry == null) return;
            if (!proxy.isAccepting()) {
                drop(1, "not accepting entries");
                return;
            }
            // 🧩 Point: queue-writer/backpressure
            switch (options.backpressure()) {
                case BLOCK:
                    try {
                        if (!queue.offer(entry, options.enqueueTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                            drop(1, "queue full after waiting " + options.enqueueTimeout());
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        drop(1, "interrupted while waiting for queue space");
                    }
                    break;
                case DROP_NEWEST:
                    if (!queue.offer(entry)) drop(1, "queue full");
                    break;
                case DROP_OLDEST:
                    while (!queue.offer(entry)) {
                        if (queue.poll() != null) drop(1, "queue full, oldest evicted");
                    }
                    break;
            }
            workSignal.release();
        }

        int drainBatch(int max) {
            int n = 0;
            T entry;
            while (n < max && !drainExpired() && (entry = queue.poll()) != null) {
                n++;
                try {
                    target.write(entry);
                } catch (Exception e) {
                    setupTracer().error(new WriteFailureException("Background write to " + target + " failed", e),
                            "Background write to {} failed", target);
                }
            }
            return n;
        }

        int size() {
            return queue.size();
        }

        int discard() {
            List<T> rest = new ArrayList<>();
            queue.drainTo(rest);
            queueDrops.addAndGet(rest.size());
            return rest.size();
        }

        private void drop(long count, String reason) {
            queueDrops.addAndGet(count);
            dropped.addAndGet(count);
            if (dropReported.compareAndSet(false, true)) {
                setupTracer().warn("Dropping entries for {}: {} (policy {}); further drops are counted only",
                        target, reason, options.backpressure());
            }
        }

        @Override
        public String toString() {
            return "QueueEntryWriter(" + target + ", size=" + queue.size() + ", dropped=" + queueDrops.get() + ")";
        }
    }
    // [/🧩 Section: queue-writer]
}
