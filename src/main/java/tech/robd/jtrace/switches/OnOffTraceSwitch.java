/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/switches/OnOffTraceSwitch.java
 description: Switch that enables all levels or none, runtime-mutable.
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

import tech.robd.jtrace.TraceLevel;

/**
 * All-or-nothing switch. The flag may be flipped while tracers are in use.
 */
public final class OnOffTraceSwitch implements TraceSwitch {

    private volatile boolean on;

    public OnOffTraceSwitch(boolean on) {
        this.on = on;
    }

    @Override
    public boolean isEnabled(TraceLevel level) {
        return on;
    }

    public boolean isOn() {
        return on;
    }

    public void setOn(boolean on) {
        this.on = on;
    }

    @Override
    public String toString() {
        return "OnOffTraceSwitch(" + (on ? "on" : "off") + ")";
    }
}
