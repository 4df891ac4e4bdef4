/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/switches/TraceSwitch.java
 description: Predicate deciding whether a trace level is enabled; lambdas act as custom switches.
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
 * Decides whether calls at a given {@link TraceLevel} are active for the tracer names it is
 * registered against in a {@link SwitchSet}.
 * <p>
 * Built-in variants are {@link ThresholdTraceSwitch} and {@link OnOffTraceSwitch}; any lambda
 * {@code level -> boolean} is a custom switch. Implementations are called on the hot path from
 * many threads and must be thread-safe and cheap.
 */
@FunctionalInterface
public interface TraceSwitch {

    boolean isEnabled(TraceLevel level);
}
