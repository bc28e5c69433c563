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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.authcmd.protocol.ProtocolMessage;

import java.io.IOException;

/**
 * JSON {@link Serde} for one {@link ProtocolMessage} type. Every topic this service touches
 * carries exactly one message type, so the type is fixed per instance.
 */
public final class ProtocolMessageSerde<T extends ProtocolMessage> implements Serde<T> {
    private final Class<T> messageType;
    private final Serializer<T> serializer;
    private final Deserializer<T> deserializer;

    public ProtocolMessageSerde(ObjectMapper objectMapper, Class<T> messageType) {
        this.messageType = messageType;
        this.serializer = new SerializerImpl<>(objectMapper.writerFor(messageType));
        this.deserializer = new DeserializerImpl<>(objectMapper.readerFor(messageType));
    }

    public Class<T> getMessageType() {
        return messageType;
    }

    @Override
    public Serializer<T> serializer() {
        return serializer;
    }

    @Override
    public Deserializer<T> deserializer() {
        return deserializer;
    }

    private static class SerializerImpl<T extends ProtocolMessage> implements Serializer<T> {
        private final ObjectWriter writer;

        private SerializerImpl(ObjectWriter writer) {
            this.writer = writer;
        }

        @Override
        public byte[] serialize(String topic, T data) {
            if (data == null) {
                return null;
            }
            try {
                return writer.writeValueAsBytes(data);
            } catch (JsonProcessingException e) {
                throw new SerializationException("Unable to serialize " + data.getClass().getSimpleName() + " for topic " + topic, e);
            }
        }
    }

    private static class DeserializerImpl<T extends ProtocolMessage> implements Deserializer<T> {
        private final ObjectReader reader;

        private DeserializerImpl(ObjectReader reader) {
            this.reader = reader;
        }

        @Override
        public T deserialize(String topic, byte[] data) {
            if (data == null) {
                return null;
            }
            try {
                return reader.readValue(data);
            } catch (IOException e) {
                throw new SerializationException("Unable to deserialize message from topic " + topic, e);
            }
        }
    }
}
