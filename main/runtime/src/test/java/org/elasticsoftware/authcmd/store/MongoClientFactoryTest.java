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
import com.mongodb.ServerAddress;
import org.elasticsoftware.authcmd.config.AuthCommandProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MongoClientFactoryTest {

    @Test
    void testParseAddress() {
        assertEquals(new ServerAddress("mongo-0", 27018), MongoClientFactory.parseAddress("mongo-0:27018"));
        assertEquals(new ServerAddress("mongo-1", 27017), MongoClientFactory.parseAddress(" mongo-1 "));
        assertThrows(IllegalArgumentException.class, () -> MongoClientFactory.parseAddress("mongo-2:port"));
    }

    @Test
    void testSettings() {
        MongoClientSettings settings = MongoClientFactory.settings(new AuthCommandProperties.Mongo(
                List.of("mongo-0:27017", "mongo-1:27017"), "auth", "s3cret", "auth", "users", Duration.ofMillis(1500)));

        assertEquals(2, settings.getClusterSettings().getHosts().size());
        assertEquals(1500, settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
        assertEquals(1500, settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
        assertEquals("auth", settings.getCredential().getUserName());
        assertEquals("admin", settings.getCredential().getSource());
    }

    @Test
    void testSettingsWithoutCredentials() {
        MongoClientSettings settings = MongoClientFactory.settings(new AuthCommandProperties.Mongo(
                List.of("localhost"), "", "", "auth", "users", Duration.ofMillis(3000)));

        assertNull(settings.getCredential());
    }
}
