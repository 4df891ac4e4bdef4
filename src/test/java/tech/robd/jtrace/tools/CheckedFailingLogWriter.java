/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/tools/CheckedFailingLogWriter.java
 description: Recording sink whose first writes throw an undeclared checked IOException.
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

package tech.robd.jtrace.tools;

import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.TraceEntry;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fails the first {@code failures} writes with {@code IOException("disk full")}, thrown without a
 * {@code throws} clause the way a wrapped I/O library can, then records normally.
 */
public final class CheckedFailingLogWriter extends RecordingLogWriter {

    private final AtomicInteger remainingFailures;

    public CheckedFailingLogWriter(SetupLog setupLog, int failures) {
        super(setupLog);
        this.remainingFailures = new AtomicInteger(failures);
    }

    @Override
    public void write(TraceEntry entry) {
        if (remainingFailures.getAndDecrement() > 0) {
            throw undeclared(new IOException("disk full"));
        }
        super.write(entry);
    }

    /**
     * Throws {@code t} unchanged, checked or not; the return type only lets callers write
     * {@code throw undeclared(e)}.
     */
    public static RuntimeException undeclared(Throwable t) {
        throw CheckedFailingLogWriter.<RuntimeException>rethrow(t);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E rethrow(Throwable t) throws E {
        throw (E) t;
    }
}
