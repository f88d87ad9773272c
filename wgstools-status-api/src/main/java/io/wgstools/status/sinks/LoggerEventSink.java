package io.wgstools.status.sinks;

/*
 * Copyright (c) wgstools
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.wgstools.status.EventSink;
import io.wgstools.status.EventType;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/// An event sink that writes every event to a Log4j 2 logger at the event's own level.
public class LoggerEventSink implements EventSink {

    private final Logger logger;

    public LoggerEventSink() {
        this(LogManager.getLogger(LoggerEventSink.class));
    }

    public LoggerEventSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public LoggerEventSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        Level level = toLog4jLevel(event.getLevel());
        if (logger.isEnabled(level)) {
            Object error = params.get("error");
            if (error instanceof Throwable t) {
                logger.log(level, formatEventMessage(event, params), t);
            } else {
                logger.log(level, formatEventMessage(event, params));
            }
        }
    }

    static Level toLog4jLevel(EventType.Level level) {
        switch (level) {
            case TRACE:
                return Level.TRACE;
            case DEBUG:
                return Level.DEBUG;
            case WARN:
                return Level.WARN;
            case ERROR:
                return Level.ERROR;
            case INFO:
            default:
                return Level.INFO;
        }
    }
}
