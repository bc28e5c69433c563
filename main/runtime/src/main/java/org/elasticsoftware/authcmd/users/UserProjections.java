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

import org.bson.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The two representations of a {@link User}: the storage record, which holds the hashed
 * credential, and the external record that is sent to other services, which never does.
 */
public final class UserProjections {
    public static final String ID = "_id";
    public static final String UUID_FIELD = "uuid";
    public static final String EMAIL = "email";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String ROLE = "role";
    public static final String VERSION = "version";

    private UserProjections() {
        // Utility class
    }

    public static Document toStorageRecord(User user) {
        Document document = new Document();
        putIfPresent(document, ID, user.id());
        putIfPresent(document, UUID_FIELD, user.uuid() != null ? user.uuid().toString() : null);
        putIfPresent(document, EMAIL, user.email());
        putIfPresent(document, FIRST_NAME, user.firstName());
        putIfPresent(document, LAST_NAME, user.lastName());
        putIfPresent(document, USERNAME, user.username());
        putIfPresent(document, PASSWORD, user.password());
        putIfPresent(document, ROLE, user.role());
        document.put(VERSION, user.version());
        return document;
    }

    public static User fromStorageRecord(Document document) {
        Object uuid = document.get(UUID_FIELD);
        Number version = document.get(VERSION, Number.class);
        return new User(
                document.getObjectId(ID),
                uuid != null ? UUID.fromString(uuid.toString()) : null,
                document.getString(EMAIL),
                document.getString(FIRST_NAME),
                document.getString(LAST_NAME),
                document.getString(USERNAME),
                document.getString(PASSWORD),
                document.getString(ROLE),
                version != null ? version.longValue() : 0L);
    }

    public static Map<String, Object> toExternalRecord(User user) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(ID, user.id() != null ? user.id().toHexString() : null);
        record.put(UUID_FIELD, user.uuid() != null ? user.uuid().toString() : null);
        record.put(EMAIL, user.email());
        record.put(FIRST_NAME, user.firstName());
        record.put(LAST_NAME, user.lastName());
        record.put(USERNAME, user.username());
        record.put(ROLE, user.role());
        record.put(VERSION, user.version());
        return record;
    }

    private static void putIfPresent(Document document, String key, Object value) {
        if (value != null) {
            document.put(key, value);
        }
    }
}
