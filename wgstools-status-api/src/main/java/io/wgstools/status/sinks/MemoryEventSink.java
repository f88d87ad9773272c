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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/// An event sink that keeps every event in memory, in arrival order.
public class MemoryEventSink implements EventSink {

    /// One captured event
    /// @param event the event type
    /// @param params the event parameters
    public record Recorded(EventType event, Map<String, Object> params) {
        /// @param name a parameter name
        /// @return the parameter value, or null
        public Object param(String name) {
            return params.get(name);
        }
    }

    private final List<Recorded> events = new CopyOnWriteArrayList<>();

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        events.add(new Recorded(event, Map.copyOf(params.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)))));
    }

    /// @return all captured events
    public List<Recorded> events() {
        return List.copyOf(events);
    }

    /// @param type the event type to select
    /// @return the captured events of that type
    public List<Recorded> ofType(EventType type) {
        return events.stream().filter(r -> r.event() == type).collect(Collectors.toList());
    }

    /// @param type the event type to count
    /// @return how many events of that type were captured
    public long count(EventType type) {
        return events.stream().filter(r -> r.event() == type).count();
    }

    /// @return the captured event types, in order
    public List<EventType> types() {
        return events.stream().map(Recorded::event).collect(Collectors.toList());
    }

    /// Forget everything captured so far.
    public void clear() {
        events.clear();
    }
}
