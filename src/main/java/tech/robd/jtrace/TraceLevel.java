/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceLevel.java
 description: Ordered trace severity levels, lowest (DEBUG) to highest (SEVERE).
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

import java.util.Locale;

/**
 * Trace severity. Declaration order is severity order, so {@link #compareTo(Enum)} can be used
 * for threshold checks.
 */
public enum TraceLevel {
    DEBUG,
    VERBOSE,
    INFO,
    WARN,
    ERROR,
    SEVERE;

    /**
     * @param threshold the minimum level
     * @return {@code true} if this level is at or above {@code threshold}
     */
    public boolean isAtLeast(TraceLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Case-insensitive parse, tolerant of surrounding whitespace.
     *
     * @param text level name, e.g. {@code "info"}
     * @return the matching level
     * @throws IllegalArgumentException if {@code text} is null or names no level
     */
    public static TraceLevel parse(String text) {
        if (text == null) throw new IllegalArgumentException("Trace level cannot be null");
        return TraceLevel.valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
