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
import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;

/**
 * Envelope for correlated responses. The event store answers a {@link VersionQuery} with a
 * response whose result is a JSON list of {@link EventRecord}s, this service answers a
 * registration with a response whose result is the registered user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseRecord(
        @JsonProperty("aggregateDiscriminator") @JsonAlias({"aggregateId", "aggregateID"}) AggregateKind aggregateKind,
        String correlationId,
        byte[] result,
        String error,
        ErrorKind errorKind
) implements ProtocolMessage {

    public ResponseRecord {
        if (errorKind == null) {
            errorKind = ErrorKind.NONE;
        }
    }

    public static ResponseRecord success(@Nonnull AggregateKind aggregateKind,
                                         @Nonnull String correlationId,
                                         @Nonnull byte[] result) {
        return new ResponseRecord(aggregateKind, correlationId, result, null, ErrorKind.NONE);
    }

    public static ResponseRecord failure(@Nonnull AggregateKind aggregateKind,
                                         @Nullable String correlationId,
                                         @Nonnull ErrorKind errorKind,
                                         @Nonnull String error) {
        return new ResponseRecord(aggregateKind, correlationId, null, error, errorKind);
    }

    public boolean hasError() {
        return errorKind != ErrorKind.NONE || (error != null && !error.isEmpty());
    }
}
