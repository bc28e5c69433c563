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

package org.elasticsoftware.authcmd.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks the event store for all events of an aggregate newer than {@code version}.
 *
 * @param aggregateKind the aggregate to query
 * @param correlationId the correlation id of the intent event that caused this query
 * @param version the aggregate version known to this service when the query was issued
 * @param timePartition the time bucket (year) the event store should search
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionQuery(
        @JsonProperty("aggregateDiscriminator") @JsonAlias({"aggregateId", "aggregateID"}) AggregateKind aggregateKind,
        String correlationId,
        long version,
        int timePartition
) implements ProtocolMessage {
}
