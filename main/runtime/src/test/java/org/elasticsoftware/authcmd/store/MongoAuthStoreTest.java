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

import org.bson.Document;
import org.elasticsoftware.authcmd.protocol.ErrorKind;
import org.elasticsoftware.authcmd.users.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MongoAuthStoreTest {
    private static final String COLLECTION = "users";
    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private MongoTemplate mongoTemplate;
    private MongoAuthStore authStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        authStore = new MongoAuthStore(mongoTemplate, COLLECTION, passwordEncoder);
    }

    @Test
    void testRegisterHashesCredential() throws PersistenceException {
        when(mongoTemplate.insert(any(Document.class), eq(COLLECTION))).thenAnswer(invocation -> invocation.getArgument(0));

        User stored = authStore.register(draft("alice", 5L));

        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(mongoTemplate).insert(captor.capture(), eq(COLLECTION));
        Document document = captor.getValue();
        assertNotNull(document.getObjectId("_id"));
        assertNotNull(document.getString("uuid"));
        assertNotEquals("secret", document.getString("password"));
        assertTrue(passwordEncoder.matches("secret", document.getString("password")));
        assertEquals(5L, document.get("version"));

        assertNull(stored.password());
        assertEquals(document.getObjectId("_id"), stored.id());
        assertEquals(document.getString("uuid"), stored.uuid().toString());
        assertEquals(5L, stored.version());
    }

    @Test
    void testDuplicateUsername() {
        when(mongoTemplate.insert(any(Document.class), eq(COLLECTION))).thenThrow(new DuplicateKeyException(
                "E11000 duplicate key error collection: auth.users index: username_index dup key: { username: \"bob\" }"));

        DuplicateUsernameException exception = assertThrows(DuplicateUsernameException.class, () -> authStore.register(draft("bob", 6L)));
        assertEquals(ErrorKind.DUPLICATE_USERNAME, exception.getErrorKind());
        assertEquals("bob", exception.getUsername());
    }

    @Test
    void testDuplicateVersionIsInternal() {
        when(mongoTemplate.insert(any(Document.class), eq(COLLECTION))).thenThrow(new DuplicateKeyException(
                "E11000 duplicate key error collection: auth.users index: version_index dup key: { version: 6 }"));

        PersistenceException exception = assertThrows(PersistenceException.class, () -> authStore.register(draft("carol", 6L)));
        assertFalse(exception instanceof DuplicateUsernameException);
        assertEquals(ErrorKind.INTERNAL, exception.getErrorKind());
    }

    @Test
    void testStoreFailureIsInternal() {
        when(mongoTemplate.insert(any(Document.class), eq(COLLECTION))).thenThrow(new DataAccessResourceFailureException("timeout"));

        PersistenceException exception = assertThrows(PersistenceException.class, () -> authStore.register(draft("dave", 7L)));
        assertEquals(ErrorKind.INTERNAL, exception.getErrorKind());
    }

    @Test
    void testRegisterWithoutUsernameOrPassword() {
        assertThrows(PersistenceException.class, () -> authStore.register(new User(null, null, null, null, null, null, "secret", null, 1L)));
        assertThrows(PersistenceException.class, () -> authStore.register(new User(null, null, null, null, null, "erin", null, null, 1L)));
        verify(mongoTemplate, never()).insert(any(Document.class), anyString());
    }

    @Test
    void testMaxVersionOfEmptyStore() throws PersistenceException {
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq(COLLECTION))).thenReturn(null);
        assertEquals(1L, authStore.maxVersion());
    }

    @Test
    void testMaxVersion() throws PersistenceException {
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq(COLLECTION))).thenReturn(new Document("version", 41L));
        assertEquals(41L, authStore.maxVersion());

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findOne(captor.capture(), eq(Document.class), eq(COLLECTION));
        assertEquals(1, captor.getValue().getLimit());
        assertEquals(new Document("version", -1), captor.getValue().getSortObject());
    }

    @Test
    void testMaxVersionStoreFailure() {
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq(COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("no server"));

        PersistenceException exception = assertThrows(PersistenceException.class, () -> authStore.maxVersion());
        assertEquals(ErrorKind.INTERNAL, exception.getErrorKind());
    }

    @Test
    void testEnsureIndexes() throws PersistenceException {
        IndexOperations indexOperations = mock(IndexOperations.class);
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOperations);

        authStore.ensureIndexes();

        ArgumentCaptor<Index> captor = ArgumentCaptor.forClass(Index.class);
        verify(indexOperations, times(2)).ensureIndex(captor.capture());
        List<Index> indexes = captor.getAllValues();
        assertEquals("username_index", indexes.get(0).getIndexOptions().get("name"));
        assertEquals(true, indexes.get(0).getIndexOptions().get("unique"));
        assertEquals(new Document("username", 1), indexes.get(0).getIndexKeys());
        assertEquals("version_index", indexes.get(1).getIndexOptions().get("name"));
        assertEquals(true, indexes.get(1).getIndexOptions().get("unique"));
        assertEquals(new Document("version", -1), indexes.get(1).getIndexKeys());
    }

    @Test
    void testEnsureIndexesFailure() {
        when(mongoTemplate.indexOps(COLLECTION)).thenThrow(new DataAccessResourceFailureException("no server"));
        assertThrows(PersistenceException.class, () -> authStore.ensureIndexes());
    }

    private static User draft(String username, long version) {
        return new User(null, null, username + "@example.com", "First", "Last", username, "secret", "user", version);
    }
}
