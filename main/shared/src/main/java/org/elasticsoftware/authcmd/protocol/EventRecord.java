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

import java.util.UUID;

/**
 * A single event as stored by the event store. The payload is opaque at this level, for the
 * {@link AggregateKind#USER} aggregate it holds the serialized user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventRecord(
        @JsonProperty("aggregateDiscriminator") @JsonAlias({"aggregateId", "aggregateID"}) AggregateKind aggregateKind,
        String correlationId,
        long version,
        byte[] payload,
        UUID eventId
) implements ProtocolMessage {
}
