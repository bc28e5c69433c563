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

import org.elasticsoftware.authcmd.users.User;

/**
 * Durable store of the registered users.
 */
public interface AuthStore {
    /**
     * Creates the unique username index and the unique descending version index when they do not
     * exist yet.
     */
    void ensureIndexes() throws PersistenceException;

    /**
     * Returns the highest stored user version, or 1 when no user has been stored.
     *
     * @throws PersistenceException with {@link org.elasticsoftware.authcmd.protocol.ErrorKind#INTERNAL}
     *                              when the store cannot be read
     */
    long maxVersion() throws PersistenceException;

    /**
     * Stores the draft user with a new identity and a hashed credential.
     *
     * @return the stored user, without its credential
     * @throws DuplicateUsernameException when the username has been registered before
     * @throws PersistenceException       for any other failure, nothing is stored in that case
     */
    User register(User draft) throws PersistenceException;
}
