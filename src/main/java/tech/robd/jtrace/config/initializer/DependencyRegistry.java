/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/config/initializer/DependencyRegistry.java
 description: Typed, insertion-ordered, write-then-seal instance store scoped to one writer build.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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
import tech.robd.jtrace.ConfigurationException;
import tech.robd.jtrace.LifecycleStateException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Instances produced while building one log writer, keyed by type.
 *
 * <ul>
 *   <li>Keys are registered once; a second {@link #register} for the same key is a
 *       {@link ConfigurationException}.</li>
 *   <li>After {@link #seal()} any registration is a {@link LifecycleStateException}; lookups keep
 *       working.</li>
 *   <li>Lookups by supertype ({@link #findInstanceOf}) scan in registration order.</li>
 * </ul>
 */
public final class DependencyRegistry {

    // 🧩 Section: state
    private final Map<Class<?>, Object> instances = new LinkedHashMap<>();
    private boolean sealed;
    // [/🧩 Section: state]

    // 🧩 Section: registration
    public synchronized <T> void register(@NonNull Class<T> key, @NonNull T instance) {
        checkWritable(key, instance);
        if (instances.containsKey(key)) {
            throw new ConfigurationException("Dependency already registered for " + key.getName());
        }
        instances.put(key, instance);
    }

    /**
     * @return {@code true} if registered, {@code false} if the key was already present
     */
    public synchronized <T> boolean registerIfAbsent(@NonNull Class<T> key, @NonNull T instance) {
        checkWritable(key, instance);
        return instances.putIfAbsent(key, instance) == null;
    }

    /**
     * Register {@code instance} under its runtime class unless that key is taken.
     */
    @SuppressWarnings("unchecked")
    public synchronized boolean registerByClass(@NonNull Object instance) {
        if (instance == null) throw new IllegalArgumentException("instance cannot be null");
        return registerIfAbsent((Class<Object>) instance.getClass(), instance);
    }

    private void checkWritable(Class<?> key, Object instance) {
        if (key == null || instance == null) throw new IllegalArgumentException("key and instance cannot be null");
        if (sealed) {
            throw new LifecycleStateException("DependencyRegistry is sealed; cannot register " + key.getName());
        }
        if (!key.isInstance(instance)) {
            throw new ConfigurationException(instance.getClass().getName() + " is not a " + key.getName());
        }
    }
    // [/🧩 Section: registration]

    // 🧩 Section: lookup
    public synchronized <T> @NonNull Optional<T> find(@NonNull Class<T> key) {
        return Optional.ofNullable(key.cast(instances.get(key)));
    }

    /**
     * @throws ConfigurationException if nothing is registered under {@code key}
     */
    public <T> @NonNull T require(@NonNull Class<T> key) {
        return find(key).orElseThrow(() ->
                new ConfigurationException("Required dependency " + key.getName() + " not registered"));
    }

    /**
     * First registered instance assignable to {@code type}, whatever key it was registered under.
     */
    public synchronized <T> @NonNull Optional<T> findInstanceOf(@NonNull Class<T> type) {
        for (Object o : instances.values()) {
            if (type.isInstance(o)) return Optional.of(type.cast(o));
        }
        return Optional.empty();
    }

    public synchronized <T> @NonNull List<T> findAllInstancesOf(@NonNull Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Object o : instances.values()) {
            if (type.isInstance(o) && !out.contains(type.cast(o))) out.add(type.cast(o));
        }
        return out;
    }

    public synchronized @NonNull List<Class<?>> keys() {
        return List.copyOf(instances.keySet());
    }
    // [/🧩 Section: lookup]

    // 🧩 Section: seal
    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }
    // [/🧩 Section: seal]

    @Override
    public synchronized String toString() {
        return "DependencyRegistry(" + instances.keySet() + (sealed ? ", sealed" : "") + ")";
    }
}
