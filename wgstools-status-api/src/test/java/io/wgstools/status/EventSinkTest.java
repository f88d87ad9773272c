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

import io.wgstools.status.sinks.MemoryEventSink;
import io.wgstools.status.sinks.MulticastEventSink;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSinkTest {

    enum SampleEvent implements EventType {
        FILE_DONE(Level.INFO, EventType.params("file", String.class, "bytes", Long.class)),
        BARE(Level.DEBUG, EventType.params());

        private final Level level;
        private final Map<String, Class<?>> params;

        SampleEvent(Level level, Map<String, Class<?>> params) {
            this.level = level;
            this.params = params;
        }

        @Override
        public Level getLevel() {
            return level;
        }

        @Override
        public Map<String, Class<?>> getRequiredParams() {
            return params;
        }
    }

    @Test
    void testMissingParameterIsRejected() {
        MemoryEventSink sink = new MemoryEventSink();
        assertThatThrownBy(() -> sink.log(SampleEvent.FILE_DONE, Map.of("file", "a.gz")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bytes");
    }

    @Test
    void testWrongTypeIsRejectedButNumbersWiden() {
        MemoryEventSink sink = new MemoryEventSink();
        assertThatThrownBy(() -> sink.log(SampleEvent.FILE_DONE, Map.of("file", 3, "bytes", 1L)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("String");

        sink.log(SampleEvent.FILE_DONE, Map.of("file", "a.gz", "bytes", 12));
        assertThat(sink.count(SampleEvent.FILE_DONE)).isEqualTo(1);
    }

    @Test
    void testNullValuesAreAllowed() {
        MemoryEventSink sink = new MemoryEventSink();
        Map<String, Object> params = new HashMap<>();
        params.put("file", null);
        params.put("bytes", 0L);
        sink.log(SampleEvent.FILE_DONE, params);
        assertThat(sink.ofType(SampleEvent.FILE_DONE).get(0).param("file")).isNull();
    }

    @Test
    void testFormatKeepsDeclarationOrder() {
        MemoryEventSink sink = new MemoryEventSink();
        String message = sink.formatEventMessage(SampleEvent.FILE_DONE, Map.of("bytes", 7L, "file", "x.gz"));
        assertThat(message).startsWith("FILE_DONE").endsWith("file:x.gz bytes:7");
        assertThat(sink.formatEventMessage(SampleEvent.BARE, Map.of())).isEqualTo("BARE");
    }

    @Test
    void testMulticastSurvivesFailingSink() {
        MemoryEventSink memory = new MemoryEventSink();
        EventSink failing = (event, params) -> {
            throw new IllegalStateException("boom");
        };
        MulticastEventSink multicast = new MulticastEventSink(failing, memory);
        multicast.log(SampleEvent.BARE);
        multicast.log(SampleEvent.FILE_DONE, Map.of("file", "y.gz", "bytes", 1L));
        assertThat(memory.types()).containsExactly(SampleEvent.BARE, SampleEvent.FILE_DONE);
    }
}
