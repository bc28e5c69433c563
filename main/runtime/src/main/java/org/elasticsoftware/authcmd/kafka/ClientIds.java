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

package org.elasticsoftware.authcmd.kafka;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class ClientIds {
    private ClientIds() {
        // Utility class
    }

    /**
     * Client id of a consumer or producer for the given topic. The host name keeps the id, and with
     * it the static group membership, unique per instance.
     */
    public static String forTopic(String topic) {
        return topic + "-" + getHostName();
    }

    static String getHostName() {
        // inside a container the HOSTNAME variable holds the container id
        String hostName = System.getenv("HOSTNAME");
        if (hostName == null || hostName.isEmpty()) {
            try {
                hostName = InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                hostName = "unknown";
            }
        }
        return hostName;
    }
}
