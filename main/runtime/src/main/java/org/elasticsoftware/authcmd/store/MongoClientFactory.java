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

package org.elasticsoftware.authcmd.store;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.elasticsoftware.authcmd.config.AuthCommandProperties;

import java.util.List;
import java.util.concurrent.TimeUnit;

public final class MongoClientFactory {
    private static final String AUTHENTICATION_DATABASE = "admin";

    private MongoClientFactory() {
        // Utility class
    }

    public static MongoClient create(AuthCommandProperties.Mongo properties) {
        return MongoClients.create(settings(properties));
    }

    static MongoClientSettings settings(AuthCommandProperties.Mongo properties) {
        long timeoutMillis = properties.timeout().toMillis();
        List<ServerAddress> addresses = properties.hosts().stream().map(MongoClientFactory::parseAddress).toList();
        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyToClusterSettings(cluster -> cluster
                        .hosts(addresses)
                        .serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        if (properties.username() != null && !properties.username().isBlank()) {
            char[] password = properties.password() != null ? properties.password().toCharArray() : new char[0];
            builder.credential(MongoCredential.createCredential(properties.username(), AUTHENTICATION_DATABASE, password));
        }
        return builder.build();
    }

    static ServerAddress parseAddress(String host) {
        String trimmed = host.trim();
        int separator = trimmed.lastIndexOf(':');
        if (separator > 0 && separator < trimmed.length() - 1 && !trimmed.endsWith("]")) {
            try {
                return new ServerAddress(trimmed.substring(0, separator), Integer.parseInt(trimmed.substring(separator + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid MongoDB host " + host, e);
            }
        }
        return new ServerAddress(trimmed);
    }
}
