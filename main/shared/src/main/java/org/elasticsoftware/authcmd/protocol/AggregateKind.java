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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies the aggregate a message belongs to. Several aggregates share the same topics, the
 * kind travels on the wire as its numeric code.
 */
public enum AggregateKind {
    UNKNOWN(-1),
    USER(1);

    private final int code;

    AggregateKind(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    /**
     * Resolves a wire code. Codes that are not known to this service map to {@link #UNKNOWN} so
     * that the message can be recognized and skipped instead of failing deserialization.
     */
    @JsonCreator
    public static AggregateKind fromCode(int code) {
        for (AggregateKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
