/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/LogWriterBuildException.java
 description: Failure creating a log writer or running its initializer pipeline.
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
 * Wraps an exception thrown while creating a log writer from its config or while running the
 * writer's initializer pipeline. The {@link LogManager} records it in the {@link SetupLog} and
 * excludes the failing config; it is never thrown to callers.
 */
public final class LogWriterBuildException extends TraceRuntimeException {

    public LogWriterBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
