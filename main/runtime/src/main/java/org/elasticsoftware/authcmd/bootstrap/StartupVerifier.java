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

package org.elasticsoftware.authcmd.bootstrap;

import org.elasticsoftware.authcmd.store.AuthStore;
import org.elasticsoftware.authcmd.store.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaAdminOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the document store and the message bus before any message is consumed. The store is
 * retried, since it often comes up after the service, a missing topic is not.
 */
public class StartupVerifier {
    public static final String DOCUMENT_STORE = "document-store";
    public static final String MESSAGE_BUS = "message-bus";
    private static final Logger logger = LoggerFactory.getLogger(StartupVerifier.class);
    private final AuthStore authStore;
    private final KafkaAdminOperations kafkaAdmin;
    private final List<String> topics;
    private final int storeAttempts;
    private final Duration storeBackoff;

    public StartupVerifier(AuthStore authStore,
                           KafkaAdminOperations kafkaAdmin,
                           List<String> topics,
                           int storeAttempts,
                           Duration storeBackoff) {
        this.authStore = authStore;
        this.kafkaAdmin = kafkaAdmin;
        this.topics = topics;
        this.storeAttempts = storeAttempts;
        this.storeBackoff = storeBackoff;
    }

    /**
     * @throws StartupException when one of the dependencies is unavailable
     */
    public List<DependencyStatus> verify() {
        List<DependencyStatus> statuses = new ArrayList<>();
        statuses.add(verifyStore());
        statuses.add(verifyBus());
        statuses.forEach(status -> {
            if (status.available()) {
                logger.info(status.describe());
            } else {
                logger.error(status.describe());
            }
        });
        if (statuses.stream().anyMatch(status -> !status.available())) {
            throw new StartupException(statuses);
        }
        return statuses;
    }

    DependencyStatus verifyStore() {
        PersistenceException lastFailure = null;
        for (int attempt = 1; attempt <= storeAttempts; attempt++) {
            try {
                authStore.ensureIndexes();
                return DependencyStatus.available(DOCUMENT_STORE, attempt);
            } catch (PersistenceException e) {
                lastFailure = e;
                logger.warn("Attempt {} of {} to provision the document store failed: {}", attempt, storeAttempts, e.getMessage());
            }
            if (attempt < storeAttempts) {
                try {
                    Thread.sleep(storeBackoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return DependencyStatus.unavailable(DOCUMENT_STORE, attempt, e);
                }
            }
        }
        return DependencyStatus.unavailable(DOCUMENT_STORE, storeAttempts, lastFailure);
    }

    DependencyStatus verifyBus() {
        try {
            kafkaAdmin.describeTopics(topics.toArray(String[]::new));
            return DependencyStatus.available(MESSAGE_BUS, 1);
        } catch (RuntimeException e) {
            return DependencyStatus.unavailable(MESSAGE_BUS, 1, e);
        }
    }
}
