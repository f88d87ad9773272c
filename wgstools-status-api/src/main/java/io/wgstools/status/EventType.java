package io.wgstools.status;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Interface for event types that can be reported through an [EventSink].
///
/// Implement this as an enum where each constant is one kind of event with a level and the
/// parameters it requires, for example:
/// ```java
/// public enum MyEvent implements EventType {
///     FILE_DONE(Level.INFO, EventType.params("file", String.class, "bytes", Long.class));
///     ...
/// }
/// ```
/// Sinks validate the required parameters before rendering the event.
public interface EventType {
    /// Logging levels for events
    enum Level {
        /// Fine-grained detail, normally only useful while debugging
        TRACE,
        /// Detail shown in verbose mode
        DEBUG,
        /// Normal progress of a run
        INFO,
        /// Problems the run recovers from
        WARN,
        /// Problems that end the run
        ERROR
    }

    /// @return the logging level of this event
    Level getLevel();

    /// @return parameter names mapped to their required types, in declaration order
    Map<String, Class<?>> getRequiredParams();

    /// @return the event name
    String name();

    /// Build an ordered parameter declaration from alternating names and types.
    /// @param namesAndTypes `name1, Type1.class, name2, Type2.class, ...`
    /// @return an unmodifiable, ordered map of parameter names to types
    static Map<String, Class<?>> params(Object... namesAndTypes) {
        if (namesAndTypes.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters must be given as name/type pairs");
        }
        Map<String, Class<?>> params = new LinkedHashMap<>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            params.put((String) namesAndTypes[i], (Class<?>) namesAndTypes[i + 1]);
        }
        return Collections.unmodifiableMap(params);
    }
}
