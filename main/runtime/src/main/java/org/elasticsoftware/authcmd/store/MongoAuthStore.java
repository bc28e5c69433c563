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
import org.bson.types.ObjectId;
import org.elasticsoftware.authcmd.protocol.ErrorKind;
import org.elasticsoftware.authcmd.users.User;
import org.elasticsoftware.authcmd.users.UserProjections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.UUID;

import static org.elasticsoftware.authcmd.users.UserProjections.USERNAME;
import static org.elasticsoftware.authcmd.users.UserProjections.VERSION;

public class MongoAuthStore implements AuthStore {
    public static final String USERNAME_INDEX = "username_index";
    public static final String VERSION_INDEX = "version_index";
    private static final Logger logger = LoggerFactory.getLogger(MongoAuthStore.class);
    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final PasswordEncoder passwordEncoder;

    public MongoAuthStore(MongoTemplate mongoTemplate, String collection, PasswordEncoder passwordEncoder) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void ensureIndexes() throws PersistenceException {
        try {
            IndexOperations indexOperations = mongoTemplate.indexOps(collection);
            indexOperations.ensureIndex(new Index().on(USERNAME, Sort.Direction.ASC).unique().named(USERNAME_INDEX));
            indexOperations.ensureIndex(new Index().on(VERSION, Sort.Direction.DESC).unique().named(VERSION_INDEX));
            logger.info("Indexes {} and {} present on collection {}", USERNAME_INDEX, VERSION_INDEX, collection);
        } catch (DataAccessException e) {
            throw new PersistenceException(ErrorKind.INTERNAL, "Unable to create indexes on collection " + collection, e);
        }
    }

    @Override
    public long maxVersion() throws PersistenceException {
        Query query = new Query(Criteria.where(VERSION).gt(0))
                .with(Sort.by(Sort.Direction.DESC, VERSION))
                .limit(1);
        query.fields().include(VERSION);
        Document latest;
        try {
            latest = mongoTemplate.findOne(query, Document.class, collection);
        } catch (DataAccessException e) {
            throw new PersistenceException(ErrorKind.INTERNAL, "Unable to read the max version from collection " + collection, e);
        }
        if (latest == null) {
            return 1L;
        }
        Object version = latest.get(VERSION);
        if (version instanceof Number number) {
            return number.longValue();
        }
        throw new PersistenceException(ErrorKind.INTERNAL, "Stored version " + version + " is not a number");
    }

    @Override
    public User register(User draft) throws PersistenceException {
        if (draft.username() == null || draft.username().isEmpty()) {
            throw new PersistenceException(ErrorKind.INTERNAL, "User has no username");
        }
        if (draft.password() == null) {
            throw new PersistenceException(ErrorKind.INTERNAL, "User " + draft.username() + " has no password");
        }
        User user = draft.withIdentity(ObjectId.get(), UUID.randomUUID())
                .withPassword(passwordEncoder.encode(draft.password()));
        try {
            mongoTemplate.insert(UserProjections.toStorageRecord(user), collection);
        } catch (DuplicateKeyException e) {
            if (violates(e, USERNAME_INDEX)) {
                throw new DuplicateUsernameException(user.username(), e);
            }
            throw new PersistenceException(ErrorKind.INTERNAL,
                    "Version " + user.version() + " of user " + user.username() + " is already stored", e);
        } catch (DataAccessException e) {
            throw new PersistenceException(ErrorKind.INTERNAL, "Unable to store user " + user.username(), e);
        }
        logger.debug("Stored {}", user);
        return user.withoutPassword();
    }

    private static boolean violates(Throwable exception, String indexName) {
        for (Throwable current = exception; current != null; current = current.getCause()) {
            if (current.getMessage() != null && current.getMessage().contains(indexName)) {
                return true;
            }
        }
        return false;
    }
}
