/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/switches/ThresholdTraceSwitch.java
 description: Switch enabling every level at or above a runtime-mutable threshold.
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

package tech.robd.jtrace.switches;

import org.jspecify.annotations.NonNull;
import tech.robd.jtrace.TraceLevel;

/**
 * Enables levels at or above {@link #getThreshold()}. The threshold may be changed while
 * tracers are in use; the next call observes the new value.
 */
public final class ThresholdTraceSwitch implements TraceSwitch {

    private volatile @NonNull TraceLevel threshold;

    public ThresholdTraceSwitch(@NonNull TraceLevel threshold) {
        if (threshold == null) throw new IllegalArgumentException("threshold cannot be null");
        this.threshold = threshold;
    }

    @Override
    public boolean isEnabled(TraceLevel level) {
        return level != null && level.isAtLeast(threshold);
    }

    public @NonNull TraceLevel getThreshold() {
        return threshold;
    }

    public void setThreshold(@NonNull TraceLevel threshold) {
        if (threshold == null) throw new IllegalArgumentException("threshold cannot be null");
        this.threshold = threshold;
    }

    @Override
    public String toString() {
        return "ThresholdTraceSwitch(" + threshold + ")";
    }
}
