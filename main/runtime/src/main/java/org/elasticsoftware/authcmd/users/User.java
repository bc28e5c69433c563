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

import org.bson.types.ObjectId;

import java.util.UUID;

/**
 * The user aggregate as replayed from a registration event. The password is the raw credential
 * on a draft and the hashed credential once the user has been stored. It never leaves the
 * service, see {@link UserProjections#toExternalRecord(User)}.
 */
public record User(
        ObjectId id,
        UUID uuid,
        String email,
        String firstName,
        String lastName,
        String username,
        String password,
        String role,
        long version
) {

    public User withVersion(long newVersion) {
        return new User(id, uuid, email, firstName, lastName, username, password, role, newVersion);
    }

    public User withIdentity(ObjectId newId, UUID newUuid) {
        return new User(newId, newUuid, email, firstName, lastName, username, password, role, version);
    }

    public User withPassword(String newPassword) {
        return new User(id, uuid, email, firstName, lastName, username, newPassword, role, version);
    }

    public User withoutPassword() {
        return withPassword(null);
    }

    @Override
    public String toString() {
        // never print the credential
        return "User[id=" + id + ", uuid=" + uuid + ", username=" + username + ", role=" + role + ", version=" + version + "]";
    }
}
