/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/writer/Slf4jLogWriter.java
 description: Log writer forwarding TraceEntry instances to SLF4J loggers named after the tracer.
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

import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.robd.jtrace.SetupLog;
import tech.robd.jtrace.TraceEntry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Writes trace entries to SLF4J, using the tracer name as logger name ({@code ""} maps to the
 * root logger). {@code VERBOSE} is written as debug and {@code SEVERE} as error. Details, when
 * present, are appended to the message.
 */
public final class Slf4jLogWriter extends SingleEntryTypeLogWriter<TraceEntry> {

    private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();

    public Slf4jLogWriter(@NonNull SetupLog setupLog) {
        super(setupLog, TraceEntry.class);
    }

    @Override
    public void write(TraceEntry entry) {
        if (entry == null || !isStarted()) return;
        Logger logger = loggerFor(entry.tracerName());
        String message = entry.details() == null ? entry.message() : entry.message() + " " + entry.details();
        switch (entry.level()) {
            case DEBUG:
            case VERBOSE:
                if (logger.isDebugEnabled()) logger.debug(message, entry.error());
                break;
            case INFO:
                if (logger.isInfoEnabled()) logger.info(message, entry.error());
                break;
            case WARN:
                if (logger.isWarnEnabled()) logger.warn(message, entry.error());
                break;
            default:
                if (logger.isErrorEnabled()) logger.error(message, entry.error());
        }
    }

    private Logger loggerFor(String name) {
        return loggers.computeIfAbsent(name.isEmpty() ? Logger.ROOT_LOGGER_NAME : name, LoggerFactory::getLogger);
    }

    @Override
    protected void internalStop() {
        loggers.clear();
    }
}
