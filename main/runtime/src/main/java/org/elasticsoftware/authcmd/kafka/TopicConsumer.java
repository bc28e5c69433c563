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

import com.google.common.annotations.VisibleForTesting;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.Deserializer;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.ProtocolMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.elasticsoftware.authcmd.kafka.TopicConsumerState.*;

/**
 * Reads one topic on a dedicated thread and hands the messages of the accepted aggregate kind to a
 * {@link MessageHandler} on the worker pool. Messages are taken in arrival order and their offset
 * is marked as soon as they are taken, whether they are handled, ignored or undecodable.
 * <p>
 * At most {@code maxInFlight} messages are handled at the same time. When that limit is reached the
 * assigned partitions are paused, the consumer keeps polling to stay in the group, and they are
 * resumed once a handler completes.
 */
public class TopicConsumer<T extends ProtocolMessage> extends Thread implements AutoCloseable, ConsumerRebalanceListener {
    private static final Logger logger = LoggerFactory.getLogger(TopicConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);
    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final String topic;
    private final String groupId;
    private final Deserializer<T> deserializer;
    private final AggregateKind acceptedKind;
    private final MessageHandler<T> handler;
    private final Executor workerPool;
    private final ApplicationEventPublisher eventPublisher;
    private final int maxInFlight;
    private final Semaphore inFlight;
    private final Deque<PendingMessage<T>> pending = new ArrayDeque<>();
    private final Map<TopicPartition, OffsetAndMetadata> processedOffsets = new HashMap<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private volatile TopicConsumerState processState = INITIALIZING;
    private volatile Consumer<String, byte[]> consumer;

    public TopicConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                         String topic,
                         String groupId,
                         Deserializer<T> deserializer,
                         AggregateKind acceptedKind,
                         MessageHandler<T> handler,
                         Executor workerPool,
                         int maxInFlight,
                         ApplicationEventPublisher eventPublisher) {
        super(topic + "-TopicConsumer");
        this.consumerFactory = consumerFactory;
        this.topic = topic;
        this.groupId = groupId;
        this.deserializer = deserializer;
        this.acceptedKind = acceptedKind;
        this.handler = handler;
        this.workerPool = workerPool;
        this.maxInFlight = maxInFlight;
        this.inFlight = new Semaphore(maxInFlight);
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void run() {
        boolean failed = false;
        try (Consumer<String, byte[]> kafkaConsumer = consumerFactory.createConsumer(groupId, ClientIds.forTopic(topic), null)) {
            this.consumer = kafkaConsumer;
            kafkaConsumer.subscribe(List.of(topic), this);
            if (processState == INITIALIZING) {
                processState = RUNNING;
            }
            logger.info("Consuming {} in group {}", topic, groupId);
            while (processState == RUNNING) {
                process(kafkaConsumer);
            }
            failed = processState == ERROR;
            if (!failed) {
                try {
                    commitProcessedOffsets(kafkaConsumer, true);
                } catch (KafkaException e) {
                    logger.error("Failed to commit offsets of {} on shutdown", topic, e);
                }
            }
        } catch (KafkaException e) {
            logger.error("Error in TopicConsumer for {}", topic, e);
            failed = true;
        } finally {
            processState = SHUTTING_DOWN;
            shutdownLatch.countDown();
        }
        if (failed) {
            // raise an error for the liveness check
            eventPublisher.publishEvent(new AvailabilityChangeEvent<>(this, LivenessState.BROKEN));
        }
    }

    private void process(Consumer<String, byte[]> kafkaConsumer) {
        try {
            dispatchPending();
            if (pending.isEmpty()) {
                if (!kafkaConsumer.paused().isEmpty()) {
                    logger.debug("Resuming {} after handlers completed", kafkaConsumer.paused());
                    kafkaConsumer.resume(kafkaConsumer.paused());
                }
            } else if (kafkaConsumer.paused().size() < kafkaConsumer.assignment().size()) {
                logger.debug("{} messages in flight on {}, pausing {}", inFlightCount(), topic, kafkaConsumer.assignment());
                kafkaConsumer.pause(kafkaConsumer.assignment());
            }
            ConsumerRecords<String, byte[]> consumerRecords = kafkaConsumer.poll(POLL_TIMEOUT);
            for (ConsumerRecord<String, byte[]> consumerRecord : consumerRecords) {
                pending.add(decode(consumerRecord));
            }
            dispatchPending();
            commitProcessedOffsets(kafkaConsumer, false);
        } catch (WakeupException | InterruptException e) {
            // ignore
        } catch (KafkaException e) {
            // this is an unrecoverable exception
            logger.error("Unrecoverable exception in TopicConsumer for {}", topic, e);
            processState = ERROR;
        }
    }

    private PendingMessage<T> decode(ConsumerRecord<String, byte[]> consumerRecord) {
        T message;
        try {
            message = deserializer.deserialize(consumerRecord.topic(), consumerRecord.value());
        } catch (SerializationException e) {
            logger.warn("Skipping undecodable message at {}-{} offset {}",
                    consumerRecord.topic(), consumerRecord.partition(), consumerRecord.offset(), e);
            return new PendingMessage<>(consumerRecord, null);
        }
        if (message == null) {
            logger.warn("Skipping empty message at {}-{} offset {}",
                    consumerRecord.topic(), consumerRecord.partition(), consumerRecord.offset());
            return new PendingMessage<>(consumerRecord, null);
        }
        if (message.aggregateKind() == null) {
            logger.warn("Skipping {} without aggregate discriminator at {}-{} offset {} with correlationId {}",
                    message.getClass().getSimpleName(), consumerRecord.topic(), consumerRecord.partition(),
                    consumerRecord.offset(), message.correlationId());
            return new PendingMessage<>(consumerRecord, null);
        }
        if (message.aggregateKind() != acceptedKind) {
            logger.debug("Ignoring {} with correlationId {} for aggregate {}",
                    message.getClass().getSimpleName(), message.correlationId(), message.aggregateKind());
            return new PendingMessage<>(consumerRecord, null);
        }
        return new PendingMessage<>(consumerRecord, message);
    }

    private void dispatchPending() {
        while (!pending.isEmpty()) {
            PendingMessage<T> head = pending.peek();
            if (head.message() != null) {
                if (!inFlight.tryAcquire()) {
                    return;
                }
                submit(head.message());
            }
            pending.poll();
            markProcessed(head.consumerRecord());
        }
    }

    private void submit(T message) {
        try {
            workerPool.execute(() -> {
                try {
                    handler.handle(message);
                } catch (RuntimeException e) {
                    logger.error("Unhandled exception while handling {} with correlationId {}",
                            message.getClass().getSimpleName(), message.correlationId(), e);
                } finally {
                    inFlight.release();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.release();
            logger.error("Worker pool rejected {} with correlationId {}",
                    message.getClass().getSimpleName(), message.correlationId(), e);
        }
    }

    private void markProcessed(ConsumerRecord<String, byte[]> consumerRecord) {
        processedOffsets.put(
                new TopicPartition(consumerRecord.topic(), consumerRecord.partition()),
                new OffsetAndMetadata(consumerRecord.offset() + 1));
    }

    private void commitProcessedOffsets(Consumer<String, byte[]> kafkaConsumer, boolean sync) {
        if (processedOffsets.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>(processedOffsets);
        processedOffsets.clear();
        if (sync) {
            kafkaConsumer.commitSync(offsets);
        } else {
            kafkaConsumer.commitAsync(offsets, (committed, exception) -> {
                if (exception != null) {
                    logger.error("Failed to commit offsets {} for {}", committed, topic, exception);
                }
            });
        }
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        if (partitions.isEmpty()) {
            return;
        }
        logger.info("Partitions {} revoked", partitions);
        // messages that were not taken yet are redelivered to the new owner
        pending.removeIf(pendingMessage -> partitions.contains(
                new TopicPartition(pendingMessage.consumerRecord().topic(), pendingMessage.consumerRecord().partition())));
        Map<TopicPartition, OffsetAndMetadata> revokedOffsets = new HashMap<>();
        partitions.forEach(partition -> {
            OffsetAndMetadata offset = processedOffsets.remove(partition);
            if (offset != null) {
                revokedOffsets.put(partition, offset);
            }
        });
        if (!revokedOffsets.isEmpty() && consumer != null) {
            try {
                consumer.commitSync(revokedOffsets);
            } catch (KafkaException e) {
                logger.error("Failed to commit offsets {} of revoked partitions", revokedOffsets, e);
            }
        }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        if (!partitions.isEmpty()) {
            logger.info("Partitions {} assigned", partitions);
        }
    }

    @Override
    public void close() {
        logger.info("Shutting down TopicConsumer for {}", topic);
        if (processState == RUNNING || processState == INITIALIZING) {
            processState = SHUTTING_DOWN;
        }
        if (!isAlive()) {
            return;
        }
        // wait maximum of 10 seconds for the shutdown to complete
        try {
            if (shutdownLatch.await(10, TimeUnit.SECONDS)) {
                logger.info("TopicConsumer for {} has been shutdown", topic);
            } else {
                logger.warn("TopicConsumer for {} did not shutdown within 10 seconds", topic);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public String getTopic() {
        return topic;
    }

    public boolean isRunning() {
        return processState == RUNNING;
    }

    @VisibleForTesting
    int inFlightCount() {
        return maxInFlight - inFlight.availablePermits();
    }

    private record PendingMessage<T>(ConsumerRecord<String, byte[]> consumerRecord, T message) {
    }
}
