/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TracerFactory.java
 description: Source of named Tracer handles; implemented by TraceManager and SetupLog.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Hands out {@link Tracer}s by name.
 */
public interface TracerFactory {

    /**
     * @param name tracer name; trimmed, {@code null} means the root tracer ({@code ""})
     * @return the tracer for the normalized name, never {@code null}
     */
    @NonNull Tracer getTracer(@Nullable String name);

    /**
     * Tracer named after {@code type}, with nested-class {@code '$'} separators mapped to {@code '.'}.
     */
    default @NonNull Tracer tracerFor(@NonNull Class<?> type) {
        if (type == null) throw new IllegalArgumentException("type cannot be null");
        return getTracer(Tracer.nameFor(type));
    }

    default @NonNull Tracer tracerFor(@NonNull Object owner) {
        if (owner == null) throw new IllegalArgumentException("owner cannot be null");
        return tracerFor(owner.getClass());
    }
}
