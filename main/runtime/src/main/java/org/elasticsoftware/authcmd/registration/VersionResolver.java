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

import org.elasticsoftware.authcmd.kafka.MessageHandler;
import org.elasticsoftware.authcmd.kafka.MessageSink;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.EventRecord;
import org.elasticsoftware.authcmd.protocol.VersionQuery;
import org.elasticsoftware.authcmd.store.AuthStore;
import org.elasticsoftware.authcmd.store.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;

/**
 * Turns a registration intent into a query to the event store for the events from the current
 * aggregate version on. The correlation id of the intent travels with the query.
 */
public class VersionResolver implements MessageHandler<EventRecord> {
    private static final Logger logger = LoggerFactory.getLogger(VersionResolver.class);
    private final AuthStore authStore;
    private final MessageSink<VersionQuery> querySink;
    private final OutcomeEmitter outcomeEmitter;
    private final Clock clock;

    public VersionResolver(AuthStore authStore,
                           MessageSink<VersionQuery> querySink,
                           OutcomeEmitter outcomeEmitter,
                           Clock clock) {
        this.authStore = authStore;
        this.querySink = querySink;
        this.outcomeEmitter = outcomeEmitter;
        this.clock = clock;
    }

    @Override
    public void handle(EventRecord intent) {
        long version;
        try {
            version = authStore.maxVersion();
        } catch (PersistenceException e) {
            logger.error("Unable to resolve the version for correlationId {}", intent.correlationId(), e);
            outcomeEmitter.failed(intent.correlationId(), e.getErrorKind(), "Error fetching max version: " + e.getMessage());
            return;
        }
        VersionQuery query = new VersionQuery(AggregateKind.USER, intent.correlationId(), version, timePartition());
        logger.debug("Querying events from version {} for correlationId {}", version, intent.correlationId());
        querySink.send(query);
    }

    int timePartition() {
        return Year.now(clock).getValue();
    }
}
