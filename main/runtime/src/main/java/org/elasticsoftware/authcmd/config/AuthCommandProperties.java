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

package org.elasticsoftware.authcmd.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration of the auth command service. Binding fails, and the service does not start,
 * when one of the required options is missing.
 */
@Validated
@ConfigurationProperties(prefix = "authcmd")
public record AuthCommandProperties(
        @Valid @NotNull Kafka kafka,
        @Valid @NotNull Mongo mongo,
        @Valid @DefaultValue Processing processing,
        @Valid @DefaultValue Startup startup
) {

    public record Kafka(
            @NotEmpty List<String> brokers,
            @NotBlank @DefaultValue("auth-command-service") String consumerGroup,
            @Valid @NotNull Topics topics
    ) {
        public String bootstrapServers() {
            return String.join(",", brokers);
        }
    }

    /**
     * @param eventConsumer topic with the user registration intent events
     * @param eventQueryProducer topic the version queries are sent to
     * @param eventQueryConsumer topic with the event store responses to the version queries
     * @param registrationResponse topic the registration outcomes are sent to
     */
    public record Topics(
            @NotBlank String eventConsumer,
            @NotBlank String eventQueryProducer,
            @NotBlank String eventQueryConsumer,
            @NotBlank String registrationResponse
    ) {
    }

    public record Mongo(
            @NotEmpty List<String> hosts,
            String username,
            String password,
            @NotBlank String database,
            @NotBlank String collection,
            @NotNull @DefaultValue("3000ms") Duration timeout
    ) {
    }

    /**
     * @param maxInFlight the maximum number of messages per topic that are being handled at the same time
     * @param workerThreads the number of threads handling messages
     * @param replayThreads the number of threads replaying the events of a response batch
     */
    public record Processing(
            @Positive @DefaultValue("64") int maxInFlight,
            @Positive @DefaultValue("16") int workerThreads,
            @Positive @DefaultValue("8") int replayThreads,
            @NotNull @DefaultValue("10s") Duration drainTimeout
    ) {
    }

    public record Startup(
            @Positive @DefaultValue("5") int storeAttempts,
            @NotNull @DefaultValue("2s") Duration storeBackoff
    ) {
    }
}
