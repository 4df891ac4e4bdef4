/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/background/BackpressurePolicy.java
 description: What a background proxy does when its queue is full.
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

package tech.robd.jtrace.writer.background;

/**
 * Applied when a producer writes to a full background queue. Producers never block unboundedly.
 */
public enum BackpressurePolicy {
    /**
     * Wait up to the enqueue timeout for space, then drop the new entry.
     */
    BLOCK,
    /**
     * Drop the new entry immediately.
     */
    DROP_NEWEST,
    /**
     * Evict the oldest queued entry to make room.
     */
    DROP_OLDEST
}
