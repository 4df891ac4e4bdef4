/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceRuntimeException.java
 description: Root of the unchecked exception hierarchy thrown by jtrace.
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

/**
 * Base class for exceptions raised by jtrace. Nothing in this hierarchy ever escapes a
 * {@link Tracer} log call; these surface only from configuration and lifecycle operations, or as
 * the {@link TraceEntry#error()} of entries recorded in the {@link SetupLog}.
 */
public class TraceRuntimeException extends RuntimeException {

    public TraceRuntimeException(String message) {
        super(message);
    }

    public TraceRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
