/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/ImportInitializer.java
 description: Post-seal wiring step that reads instances registered by pipeline stages.
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

package tech.robd.jtrace.config.initializer;

import org.jspecify.annotations.NonNull;

/**
 * Runs after every pipeline stage, once the registry is sealed. Used to wire concerns that need
 * objects produced by several stages, e.g. the final writer and a background dispatcher.
 */
@FunctionalInterface
public interface ImportInitializer extends LogWriterInitializer {

    void importDependencies(@NonNull DependencyRegistry registry);
}
