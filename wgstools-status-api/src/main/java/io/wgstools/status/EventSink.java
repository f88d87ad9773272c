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

import java.util.Map;

/// Receives structured events from a running pipeline.
///
/// Sinks decide how events are rendered: log records, console text, or in-memory
/// capture for tests. Events are delivered from the pipeline's single worker thread.
public interface EventSink {

    /// Report an event with named parameters.
    ///
    /// @param event the event type
    /// @param params parameter names mapped to values; must contain every required parameter
    void log(EventType event, Map<String, Object> params);

    /// Report an event that has no parameters.
    /// @param event the event type
    default void log(EventType event) {
        log(event, Map.of());
    }

    /// Validate that all required parameters are present and of the correct type.
    /// Null values are allowed.
    ///
    /// @param event the event type
    /// @param params parameter names mapped to values
    /// @throws IllegalArgumentException if a parameter is missing or has the wrong type
    default void validateRequiredParams(EventType event, Map<String, Object> params) {
        for (Map.Entry<String, Class<?>> required : event.getRequiredParams().entrySet()) {
            String name = required.getKey();
            if (!params.containsKey(name)) {
                throw new IllegalArgumentException("Missing required parameter: " + name + " for event: " + event.name());
            }
            Object value = params.get(name);
            if (value == null) {
                continue;
            }
            Class<?> type = required.getValue();
            if (type.isInstance(value)) {
                continue;
            }
            if (Number.class.isAssignableFrom(type) && value instanceof Number) {
                continue;
            }
            throw new IllegalArgumentException("Parameter " + name + " for event " + event.name()
                + " must be of type " + type.getSimpleName() + ", but was " + value.getClass().getSimpleName());
        }
    }

    /// Format an event as its left-justified name followed by `name:value` pairs.
    ///
    /// @param event the event type
    /// @param params parameter names mapped to values
    /// @return the formatted message
    default String formatEventMessage(EventType event, Map<String, Object> params) {
        StringBuilder sb = new StringBuilder(String.format("%-18s", event.name()));
        for (String name : event.getRequiredParams().keySet()) {
            sb.append(' ').append(name).append(':').append(params.get(name));
        }
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (!event.getRequiredParams().containsKey(entry.getKey())) {
                sb.append(' ').append(entry.getKey()).append(':').append(entry.getValue());
            }
        }
        return sb.toString().trim();
    }
}
