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

package org.elasticsoftware.authcmd.bootstrap;

import java.util.List;
import java.util.stream.Collectors;

public class StartupException extends RuntimeException {
    private final List<DependencyStatus> statuses;

    public StartupException(List<DependencyStatus> statuses) {
        super("Unable to start, " + statuses.stream()
                .filter(status -> !status.available())
                .map(DependencyStatus::describe)
                .collect(Collectors.joining("; ")));
        this.statuses = List.copyOf(statuses);
        statuses.stream()
                .filter(status -> !status.available() && status.failure() != null)
                .forEach(status -> addSuppressed(status.failure()));
    }

    public List<DependencyStatus> getStatuses() {
        return statuses;
    }
}
