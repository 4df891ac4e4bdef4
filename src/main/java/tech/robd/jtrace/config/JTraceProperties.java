/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/JTraceProperties.java
 description: Reads jtrace.* system properties with safe fallbacks.
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

package tech.robd.jtrace.config;

import tech.robd.jtrace.TraceLevel;
import tech.robd.jtrace.diagnostics.Diagnostics;
import tech.robd.jtrace.writer.background.BackpressurePolicy;

import java.time.Duration;
import java.util.Locale;

/**
 * System-property backed defaults. A malformed value falls back to the default and is reported
 * through {@link Diagnostics}; reading a property never throws.
 */
public final class JTraceProperties {

    private static final Diagnostics DIAG = Diagnostics.dynamic(JTraceProperties.class);

    public static final String SETUP_CAPACITY = "jtrace.setup.capacity";
    public static final String DEFAULT_THRESHOLD = "jtrace.default.threshold";
    public static final String QUEUE_CAPACITY = "jtrace.background.queueCapacity";
    public static final String BATCH_SIZE = "jtrace.background.batchSize";
    public static final String ENQUEUE_TIMEOUT_MS = "jtrace.background.enqueueTimeoutMs";
    public static final String DRAIN_TIMEOUT_MS = "jtrace.background.drainTimeoutMs";
    public static final String BACKPRESSURE = "jtrace.background.backpressure";

    private JTraceProperties() {
        // no instances
    }

    public static int setupCapacity() {
        return positiveInt(SETUP_CAPACITY, 10_000);
    }

    public static TraceLevel defaultThreshold() {
        String raw = System.getProperty(DEFAULT_THRESHOLD);
        if (raw == null || raw.isBlank()) return TraceLevel.INFO;
        try {
            return TraceLevel.parse(raw);
        } catch (IllegalArgumentException e) {
            DIAG.warn("Ignoring {}='{}': {}", DEFAULT_THRESHOLD, raw, e.getMessage());
            return TraceLevel.INFO;
        }
    }

    public static int queueCapacity() {
        return positiveInt(QUEUE_CAPACITY, 1024);
    }

    public static int batchSize() {
        return positiveInt(BATCH_SIZE, 64);
    }

    public static Duration enqueueTimeout() {
        return Duration.ofMillis(nonNegativeLong(ENQUEUE_TIMEOUT_MS, 100));
    }

    public static Duration drainTimeout() {
        return Duration.ofMillis(nonNegativeLong(DRAIN_TIMEOUT_MS, 5_000));
    }

    public static BackpressurePolicy backpressure() {
        String raw = System.getProperty(BACKPRESSURE);
        if (raw == null || raw.isBlank()) return BackpressurePolicy.BLOCK;
        try {
            return BackpressurePolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            DIAG.warn("Ignoring {}='{}'", BACKPRESSURE, raw);
            return BackpressurePolicy.BLOCK;
        }
    }

    // 🧩 Section: parsing
    static int positiveInt(String key, int fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) return value;
        } catch (NumberFormatException e) {
            DIAG.warn("Ignoring {}='{}': not an integer", key, raw);
            return fallback;
        }
        DIAG.warn("Ignoring {}='{}': must be > 0", key, raw);
        return fallback;
    }

    static long nonNegativeLong(String key, long fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            long value = Long.parseLong(raw.trim());
            if (value >= 0) return value;
        } catch (NumberFormatException e) {
            DIAG.warn("Ignoring {}='{}': not a number", key, raw);
            return fallback;
        }
        DIAG.warn("Ignoring {}='{}': must be >= 0", key, raw);
        return fallback;
    }
    // [/🧩 Section: parsing]
}
