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

package org.elasticsoftware.authcmd.registration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.authcmd.kafka.MessageSink;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.ErrorKind;
import org.elasticsoftware.authcmd.protocol.ResponseRecord;
import org.elasticsoftware.authcmd.users.User;
import org.elasticsoftware.authcmd.users.UserProjections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the outcome of a registration, correlated with the intent that caused it.
 */
public class OutcomeEmitter {
    private static final Logger logger = LoggerFactory.getLogger(OutcomeEmitter.class);
    private final MessageSink<ResponseRecord> sink;
    private final ObjectMapper objectMapper;

    public OutcomeEmitter(MessageSink<ResponseRecord> sink, ObjectMapper objectMapper) {
        this.sink = sink;
        this.objectMapper = objectMapper;
    }

    public void registered(String correlationId, User user) {
        byte[] result;
        try {
            result = objectMapper.writeValueAsBytes(UserProjections.toExternalRecord(user));
        } catch (JsonProcessingException e) {
            logger.error("Unable to serialize {} for correlationId {}", user, correlationId, e);
            failed(correlationId, ErrorKind.INTERNAL, "Error marshalling user: " + e.getMessage());
            return;
        }
        logger.info("Registered {} for correlationId {}", user, correlationId);
        sink.send(ResponseRecord.success(AggregateKind.USER, correlationId, result));
    }

    public void failed(String correlationId, ErrorKind errorKind, String error) {
        logger.debug("Registration with correlationId {} failed with {}: {}", correlationId, errorKind, error);
        sink.send(ResponseRecord.failure(AggregateKind.USER, correlationId, errorKind, error));
    }
}
