/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/background/BackgroundDispatchOptions.java
 description: Tuning for a BackgroundMultiLogWriter: queue size, batching, timeouts, backpressure, thread name.
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

package tech.robd.jtrace.writer.background;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.config.JTraceProperties;

import java.time.Duration;

/**
 * Background dispatch settings. Equal options share one consumer thread per {@code LogManager}
 * when used through {@code BackgroundDispatchInitializer}.
 *
 * @param queueCapacity  bound of each proxy queue
 * @param batchSize      maximum entries drained from one queue per visit
 * @param enqueueTimeout longest a producer waits under {@link BackpressurePolicy#BLOCK}
 * @param drainTimeout   longest {@code stop()} waits for queued entries to reach the sinks
 * @param backpressure   full-queue policy
 * @param threadName     consumer thread name prefix
 */
public record BackgroundDispatchOptions(int queueCapacity,
                                        int batchSize,
                                        @NonNull Duration enqueueTimeout,
                                        @NonNull Duration drainTimeout,
                                        @NonNull BackpressurePolicy backpressure,
                                        @NonNull String threadName) {

    public static final String DEFAULT_THREAD_NAME = "jtrace-background";

    public BackgroundDispatchOptions {
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (enqueueTimeout == null || enqueueTimeout.isNegative()) {
            throw new IllegalArgumentException("enqueueTimeout must be >= 0");
        }
        if (drainTimeout == null || drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }
        if (backpressure == null) throw new IllegalArgumentException("backpressure cannot be null");
        if (threadName == null || threadName.isBlank()) throw new IllegalArgumentException("threadName cannot be blank");
    }

    /**
     * Options from {@code jtrace.background.*} system properties.
     */
    public static @NonNull BackgroundDispatchOptions defaults() {
        return new BackgroundDispatchOptions(
                JTraceProperties.queueCapacity(),
                JTraceProperties.batchSize(),
                JTraceProperties.enqueueTimeout(),
                JTraceProperties.drainTimeout(),
                JTraceProperties.backpressure(),
                DEFAULT_THREAD_NAME);
    }

    // 🧩 Section: withers
    public @NonNull BackgroundDispatchOptions withQueueCapacity(int capacity) {
        return new BackgroundDispatchOptions(capacity, batchSize, enqueueTimeout, drainTimeout, backpressure, threadName);
    }

    public @NonNull BackgroundDispatchOptions withBatchSize(int size) {
        return new BackgroundDispatchOptions(queueCapacity, size, enqueueTimeout, drainTimeout, backpressure, threadName);
    }

    public @NonNull BackgroundDispatchOptions withEnqueueTimeout(@NonNull Duration timeout) {
        return new BackgroundDispatchOptions(queueCapacity, batchSize, timeout, drainTimeout, backpressure, threadName);
    }

    public @NonNull BackgroundDispatchOptions withDrainTimeout(@NonNull Duration timeout) {
        return new BackgroundDispatchOptions(queueCapacity, batchSize, enqueueTimeout, timeout, backpressure, threadName);
    }

    public @NonNull BackgroundDispatchOptions withBackpressure(@NonNull BackpressurePolicy policy) {
        return new BackgroundDispatchOptions(queueCapacity, batchSize, enqueueTimeout, drainTimeout, policy, threadName);
    }

    public @NonNull BackgroundDispatchOptions withThreadName(@NonNull String name) {
        return new BackgroundDispatchOptions(queueCapacity, batchSize, enqueueTimeout, drainTimeout, backpressure, name);
    }
    // [/🧩 Section: withers]
}
