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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.kafka.common.errors.SerializationException;
import org.elasticsoftware.authcmd.protocol.EventRecord;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes the list of hydrated events the event store places in the result of a
 * response.
 */
public final class EventBatchCodec {
    private static final TypeReference<List<EventRecord>> EVENT_LIST = new TypeReference<>() {
    };
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public EventBatchCodec(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(EVENT_LIST);
        this.writer = objectMapper.writerFor(EVENT_LIST);
    }

    public List<EventRecord> decode(byte[] result) {
        if (result == null || result.length == 0) {
            return Collections.emptyList();
        }
        try {
            List<EventRecord> events = reader.readValue(result);
            return events != null ? events : Collections.emptyList();
        } catch (IOException e) {
            throw new SerializationException("Unable to read event batch", e);
        }
    }

    public byte[] encode(List<EventRecord> events) {
        try {
            return writer.writeValueAsBytes(events);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to write event batch", e);
        }
    }
}
