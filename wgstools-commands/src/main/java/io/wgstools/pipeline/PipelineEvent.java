package io.wgstools.pipeline;

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

import io.wgstools.status.EventType;

import java.util.Map;

/// Events reported while a fetch run progresses.
public enum PipelineEvent implements EventType {
    MODE_FORCE(Level.DEBUG),
    MODE_DOWNLOAD_ONLY(Level.DEBUG),
    MODE_REVERSE(Level.DEBUG),
    /// Local state found when resuming or downloading without force
    LOCAL_STATE(Level.INFO, EventType.params("localFiles", Integer.class, "completed", Integer.class)),
    DISCOVERY_RESPONSE(Level.DEBUG, EventType.params("ids", Integer.class)),
    NOTHING_PENDING(Level.INFO),
    PENDING(Level.INFO, EventType.params("count", Integer.class, "taxid", String.class, "exclude", String.class)),
    COLLECTION_START(Level.DEBUG, EventType.params("index", Integer.class, "total", Integer.class,
        "collection", String.class)),
    COLLECTION_IN_DISK(Level.DEBUG, EventType.params("collection", String.class)),
    ATTEMPT_FAILED(Level.WARN, EventType.params("operation", String.class, "attempt", Integer.class,
        "attempts", Integer.class, "error", Throwable.class)),
    RETRY_WAIT(Level.INFO, EventType.params("operation", String.class, "seconds", Long.class)),
    FILE_PRESENT(Level.DEBUG, EventType.params("file", String.class)),
    FILE_RETRIEVED(Level.DEBUG, EventType.params("file", String.class, "bytes", Long.class)),
    FILE_NORMALIZED(Level.TRACE, EventType.params("file", String.class, "encoding", String.class,
        "headers", Long.class)),
    COLLECTION_DONE(Level.INFO, EventType.params("collection", String.class, "processed", Integer.class,
        "ratio", Double.class, "skipped", Boolean.class, "downloadOnly", Boolean.class)),
    RUN_DONE(Level.INFO, EventType.params("downloadOnly", Boolean.class)),
    LEDGER_CLEANUP_FAILED(Level.WARN, EventType.params("ledger", String.class, "error", Throwable.class)),
    /// The run stopped; `resumable` tells whether a resumed run can continue it
    FATAL(Level.ERROR, EventType.params("kind", String.class, "message", String.class, "resumable", Boolean.class));

    private final Level level;
    private final Map<String, Class<?>> requiredParams;

    PipelineEvent(Level level) {
        this(level, Map.of());
    }

    PipelineEvent(Level level, Map<String, Class<?>> requiredParams) {
        this.level = level;
        this.requiredParams = requiredParams;
    }

    @Override
    public Level getLevel() {
        return level;
    }

    @Override
    public Map<String, Class<?>> getRequiredParams() {
        return requiredParams;
    }
}
