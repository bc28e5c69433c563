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

import org.apache.kafka.common.errors.SerializationException;
import org.elasticsoftware.authcmd.kafka.MessageHandler;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.ErrorKind;
import org.elasticsoftware.authcmd.protocol.EventRecord;
import org.elasticsoftware.authcmd.protocol.ResponseRecord;
import org.elasticsoftware.authcmd.serialization.EventBatchCodec;
import org.elasticsoftware.authcmd.store.AuthStore;
import org.elasticsoftware.authcmd.store.PersistenceException;
import org.elasticsoftware.authcmd.users.InvalidUserPayloadException;
import org.elasticsoftware.authcmd.users.User;
import org.elasticsoftware.authcmd.users.UserPayloadReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Replays the events of an event store response into users and stores them. Every event yields
 * one outcome with the event's own correlation id; the events of a batch are replayed
 * concurrently and independently of each other.
 */
public class QueryCorrelator implements MessageHandler<ResponseRecord> {
    private static final Logger logger = LoggerFactory.getLogger(QueryCorrelator.class);
    private final AuthStore authStore;
    private final EventBatchCodec eventBatchCodec;
    private final UserPayloadReader payloadReader;
    private final OutcomeEmitter outcomeEmitter;
    private final Executor replayExecutor;

    public QueryCorrelator(AuthStore authStore,
                           EventBatchCodec eventBatchCodec,
                           UserPayloadReader payloadReader,
                           OutcomeEmitter outcomeEmitter,
                           Executor replayExecutor) {
        this.authStore = authStore;
        this.eventBatchCodec = eventBatchCodec;
        this.payloadReader = payloadReader;
        this.outcomeEmitter = outcomeEmitter;
        this.replayExecutor = replayExecutor;
    }

    @Override
    public void handle(ResponseRecord response) {
        if (response.hasError()) {
            logger.warn("Event store returned error {} for correlationId {}", response.error(), response.correlationId());
            outcomeEmitter.failed(response.correlationId(), ErrorKind.INTERNAL, "Error from event store: " + response.error());
            return;
        }
        List<EventRecord> events;
        try {
            events = eventBatchCodec.decode(response.result());
        } catch (SerializationException e) {
            logger.error("Unable to decode the events for correlationId {}", response.correlationId(), e);
            outcomeEmitter.failed(response.correlationId(), ErrorKind.INTERNAL, "Error unmarshalling events: " + e.getMessage());
            return;
        }
        logger.debug("Replaying {} events for correlationId {}", events.size(), response.correlationId());
        List<CompletableFuture<Void>> replays = new ArrayList<>(events.size());
        for (EventRecord event : events) {
            if (isUserEvent(event, response.correlationId())) {
                replays.add(submitReplay(event));
            }
        }
        CompletableFuture.allOf(replays.toArray(CompletableFuture[]::new)).join();
    }

    private CompletableFuture<Void> submitReplay(EventRecord event) {
        try {
            return CompletableFuture.runAsync(() -> replay(event), replayExecutor);
        } catch (RejectedExecutionException e) {
            logger.error("Unable to schedule the replay of event {} with correlationId {}", event.eventId(), event.correlationId(), e);
            outcomeEmitter.failed(event.correlationId(), ErrorKind.INTERNAL, "Error scheduling event replay: " + e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private boolean isUserEvent(EventRecord event, String batchCorrelationId) {
        if (event.aggregateKind() != AggregateKind.USER) {
            logger.warn("Skipping event {} of aggregate {} with correlationId {} in batch {}",
                    event.eventId(), event.aggregateKind(), event.correlationId(), batchCorrelationId);
            return false;
        }
        return true;
    }

    void replay(EventRecord event) {
        try {
            User draft;
            try {
                draft = payloadReader.read(event.payload()).withVersion(event.version());
            } catch (InvalidUserPayloadException e) {
                logger.error("Unable to read the user from event {} with correlationId {}", event.eventId(), event.correlationId(), e);
                outcomeEmitter.failed(event.correlationId(), ErrorKind.INTERNAL, "Error unmarshalling event payload into User: " + e.getMessage());
                return;
            }
            User stored;
            try {
                stored = authStore.register(draft);
            } catch (PersistenceException e) {
                logger.error("Unable to register {} for correlationId {}", draft, event.correlationId(), e);
                outcomeEmitter.failed(event.correlationId(), e.getErrorKind(), "Error inserting user into database: " + e.getMessage());
                return;
            }
            outcomeEmitter.registered(event.correlationId(), stored);
        } catch (RuntimeException e) {
            logger.error("Unexpected error replaying event {} with correlationId {}", event.eventId(), event.correlationId(), e);
            outcomeEmitter.failed(event.correlationId(), ErrorKind.INTERNAL, "Error replaying event: " + e.getMessage());
        }
    }
}
