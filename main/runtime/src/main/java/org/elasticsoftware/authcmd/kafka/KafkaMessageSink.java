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

package org.elasticsoftware.authcmd.kafka;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.UnsupportedVersionException;
import org.elasticsoftware.authcmd.protocol.ProtocolMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;

/**
 * Publishes messages to one topic, keyed on their correlation id. A failed publish is logged and
 * not retried. Errors that no retry can fix mark the service as broken.
 */
public class KafkaMessageSink<T extends ProtocolMessage> implements MessageSink<T>, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(KafkaMessageSink.class);
    private final Producer<String, T> producer;
    private final String topic;
    private final ApplicationEventPublisher eventPublisher;

    public KafkaMessageSink(ProducerFactory<String, T> producerFactory,
                            String topic,
                            ApplicationEventPublisher eventPublisher) {
        this(producerFactory.createProducer(), topic, eventPublisher);
    }

    KafkaMessageSink(Producer<String, T> producer, String topic, ApplicationEventPublisher eventPublisher) {
        this.producer = producer;
        this.topic = topic;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void send(T message) {
        ProducerRecord<String, T> producerRecord = new ProducerRecord<>(topic, message.correlationId(), message);
        try {
            producer.send(producerRecord, (metadata, exception) -> onCompletion(message, metadata, exception));
        } catch (KafkaException | IllegalStateException e) {
            // a closed producer throws IllegalStateException
            onCompletion(message, null, e);
        }
    }

    private void onCompletion(T message, RecordMetadata metadata, Exception exception) {
        if (exception == null) {
            logger.trace("Published {} with correlationId {} to {}-{} at offset {}",
                    message.getClass().getSimpleName(),
                    message.correlationId(),
                    metadata.topic(),
                    metadata.partition(),
                    metadata.offset());
        } else if (isFatal(exception)) {
            logger.error("Unrecoverable error while publishing {} with correlationId {} to {}",
                    message.getClass().getSimpleName(),
                    message.correlationId(),
                    topic,
                    exception);
            eventPublisher.publishEvent(new AvailabilityChangeEvent<>(this, LivenessState.BROKEN));
        } else {
            logger.error("Failed to publish {} with correlationId {} to {}",
                    message.getClass().getSimpleName(),
                    message.correlationId(),
                    topic,
                    exception);
        }
    }

    static boolean isFatal(Exception exception) {
        return exception instanceof AuthenticationException
                || exception instanceof AuthorizationException
                || exception instanceof UnsupportedVersionException;
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public void close() {
        logger.info("Closing producer for {}", topic);
        try {
            producer.close(Duration.ofSeconds(5));
        } catch (KafkaException e) {
            logger.error("Error closing producer for {}", topic, e);
        }
    }
}
