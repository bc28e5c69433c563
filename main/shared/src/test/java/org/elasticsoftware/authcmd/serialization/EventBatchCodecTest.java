/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.authcmd.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.errors.SerializationException;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.EventRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class EventBatchCodecTest {
    private final EventBatchCodec codec = new EventBatchCodec(new ObjectMapper());

    @Test
    void testDecodeBatch() {
        List<EventRecord> events = List.of(
                new EventRecord(AggregateKind.USER, "c1", 5L, "{}".getBytes(UTF_8), UUID.randomUUID()),
                new EventRecord(AggregateKind.USER, "c2", 6L, "{}".getBytes(UTF_8), UUID.randomUUID()));

        List<EventRecord> decoded = codec.decode(codec.encode(events));

        assertEquals(2, decoded.size());
        assertEquals("c1", decoded.get(0).correlationId());
        assertEquals(6L, decoded.get(1).version());
    }

    @Test
    void testEmptyResult() {
        assertTrue(codec.decode(null).isEmpty());
        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertTrue(codec.decode("[]".getBytes(UTF_8)).isEmpty());
        assertTrue(codec.decode("null".getBytes(UTF_8)).isEmpty());
    }

    @Test
    void testNotAList() {
        assertThrows(SerializationException.class, () -> codec.decode("{\"version\":1}".getBytes(UTF_8)));
    }
}
