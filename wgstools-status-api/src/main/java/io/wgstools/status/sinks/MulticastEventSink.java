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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/// Delivers each event to several sinks. A failing sink is logged and does not stop delivery
/// to the others.
public class MulticastEventSink implements EventSink {
    private static final Logger logger = LogManager.getLogger(MulticastEventSink.class);

    private final List<EventSink> sinks;

    public MulticastEventSink(EventSink... sinks) {
        this(List.of(sinks));
    }

    public MulticastEventSink(List<EventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        for (EventSink sink : sinks) {
            try {
                sink.log(event, params);
            } catch (RuntimeException e) {
                logger.error("Event sink {} failed on {}", sink.getClass().getSimpleName(), event.name(), e);
            }
        }
    }
}
