/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/NoOpEntryWriter.java
 description: Disabled entry writer that discards everything.
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

package tech.robd.jtrace.writer;

/**
 * Always disabled, discards writes. Returned in place of a broken or missing sink so callers
 * never have to null-check.
 */
public final class NoOpEntryWriter<T> implements EntryWriter<T> {

    private static final NoOpEntryWriter<Object> INSTANCE = new NoOpEntryWriter<>();

    private NoOpEntryWriter() {
    }

    @SuppressWarnings("unchecked")
    public static <T> NoOpEntryWriter<T> instance() {
        return (NoOpEntryWriter<T>) INSTANCE;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void write(T entry) {
        // no-op
    }

    @Override
    public String toString() {
        return "NoOpEntryWriter";
    }
}
