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

package org.elasticsoftware.authcmd.users;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.UUID;

/**
 * Decodes the payload of a registration event into a draft {@link User}. The draft has no store
 * identity yet and carries the raw credential.
 */
public class UserPayloadReader {
    private final ObjectMapper objectMapper;

    public UserPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public User read(byte[] payload) throws InvalidUserPayloadException {
        if (payload == null || payload.length == 0) {
            throw new InvalidUserPayloadException("payload is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new InvalidUserPayloadException("payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidUserPayloadException("payload is not a JSON object");
        }
        return new User(
                null,
                readUuid(root),
                text(root, "email"),
                text(root, "firstName", "first_name"),
                text(root, "lastName", "last_name"),
                text(root, "username"),
                text(root, "password"),
                text(root, "role"),
                root.path("version").asLong(0L));
    }

    private static UUID readUuid(JsonNode root) throws InvalidUserPayloadException {
        String uuid = text(root, "uuid");
        if (uuid == null || uuid.isEmpty()) {
            return null;
        }
        try {
            return UUID.fromString(uuid);
        } catch (IllegalArgumentException e) {
            throw new InvalidUserPayloadException("uuid " + uuid + " is not a valid UUID", e);
        }
    }

    private static String text(JsonNode root, String... names) throws InvalidUserPayloadException {
        for (String name : names) {
            JsonNode value = root.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (!value.isValueNode()) {
                throw new InvalidUserPayloadException("field " + name + " must be a scalar value");
            }
            return value.asText();
        }
        return null;
    }
}
