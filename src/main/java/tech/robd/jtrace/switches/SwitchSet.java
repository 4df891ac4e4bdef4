/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/switches/SwitchSet.java
 description: Ordered tracer-name-prefix to TraceSwitch mapping resolved by longest dotted-prefix match,
              first-registered wins on ties.
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

package tech.robd.jtrace.switches;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.ConfigurationException;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered mapping from tracer-name prefix to {@link TraceSwitch}.
 *
 * <p>Matching rules:
 * <ul>
 *   <li>Prefixes are normalized on registration: trimmed, and a single trailing {@code '.'}
 *       removed, so {@code "App."} and {@code "App"} are the same prefix.</li>
 *   <li>A prefix {@code p} matches {@code name} iff {@code p} is empty (catch-all),
 *       {@code name.equals(p)}, or {@code name.startsWith(p + ".")}. Matching is case-sensitive
 *       and segment-aware: {@code "App"} does not match {@code "Application"}.</li>
 *   <li>The longest matching prefix wins. If the same prefix is registered more than once the
 *       first registration wins; the list is ordered so this is deterministic.</li>
 * </ul>
 *
 * <p>Entries added after a {@code TraceManager} has started are only seen by tracers after the
 * next {@code start()} sweep. The switches themselves are live: mutating a
 * {@link ThresholdTraceSwitch} takes effect immediately.</p>
 */
public final class SwitchSet implements Iterable<SwitchSet.Entry> {

    /**
     * One registration.
     *
     * @param prefix      normalized prefix ({@code ""} is the catch-all)
     * @param traceSwitch the switch applied to matching tracer names
     */
    public record Entry(@NonNull String prefix, @NonNull TraceSwitch traceSwitch) {
    }

    // 🧩 Section: state
    private final List<Entry> entries = new CopyOnWriteArrayList<>();
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public SwitchSet() {
    }

    /**
     * Single-entry set, the common case for a one-sink configuration.
     */
    public static @NonNull SwitchSet of(@Nullable String prefix, @NonNull TraceSwitch traceSwitch) {
        return new SwitchSet().add(prefix, traceSwitch);
    }

    /**
     * Register {@code traceSwitch} for {@code prefix}.
     *
     * @param prefix      tracer-name prefix; {@code null} or blank means all tracers
     * @param traceSwitch the switch
     * @return this set, for chaining
     * @throws ConfigurationException if {@code traceSwitch} is null
     */
    public @NonNull SwitchSet add(@Nullable String prefix, @NonNull TraceSwitch traceSwitch) {
        if (traceSwitch == null) {
            throw new ConfigurationException("TraceSwitch for prefix '" + prefix + "' cannot be null");
        }
        entries.add(new Entry(normalizePrefix(prefix), traceSwitch));
        return this;
    }
    // [/🧩 Section: construction]

    // 🧩 Section: matching

    /**
     * Find the switch registered under the longest prefix matching {@code tracerName}.
     *
     * @param tracerName tracer name; trimmed, {@code null} treated as the root ({@code ""})
     * @return the best match, or empty if nothing matches (tracing disabled for that name)
     */
    public @NonNull Optional<TraceSwitch> findBestMatch(@Nullable String tracerName) {
        String name = tracerName == null ? "" : tracerName.trim();
        Entry best = null;
        for (Entry entry : entries) {
            // strict '>' keeps the first registration on equal lengths
            if (matches(entry.prefix(), name) && (best == null || entry.prefix().length() > best.prefix().length())) {
                best = entry;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.traceSwitch());
    }

    /**
     * @param prefix normalized prefix
     * @param name   normalized tracer name
     */
    static boolean matches(String prefix, String name) {
        if (prefix.isEmpty()) return true;
        if (!name.startsWith(prefix)) return false;
        return name.length() == prefix.length() || name.charAt(prefix.length()) == '.';
    }

    /**
     * Trim and drop one trailing dot; {@code null} becomes {@code ""}.
     */
    public static @NonNull String normalizePrefix(@Nullable String prefix) {
        if (prefix == null) return "";
        String p = prefix.trim();
        return p.endsWith(".") ? p.substring(0, p.length() - 1) : p;
    }
    // [/🧩 Section: matching]

    // 🧩 Section: view
    public @NonNull List<Entry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public @NonNull Iterator<Entry> iterator() {
        return entries().iterator();
    }

    @Override
    public String toString() {
        return "SwitchSet" + entries;
    }
    // [/🧩 Section: view]
}
