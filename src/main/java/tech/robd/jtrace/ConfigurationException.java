/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/ConfigurationException.java
 description: Invalid, duplicate or unknown configuration (descriptor lookups, registry keys, null config values).
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
 * Caller error in configuration: a null or duplicate value, a missing dependency, or a lookup
 * of a {@code LogWriterConfig} the manager does not know about.
 */
public final class ConfigurationException extends TraceRuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
