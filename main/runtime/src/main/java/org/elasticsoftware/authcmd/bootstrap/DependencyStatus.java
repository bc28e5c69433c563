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

import jakarta.annotation.Nullable;

/**
 * Result of checking one external dependency at startup.
 *
 * @param dependency the name of the dependency
 * @param available  whether the dependency can be used
 * @param attempts   how many times the dependency was checked
 * @param failure    the error of the last failed attempt, if any
 */
public record DependencyStatus(String dependency, boolean available, int attempts, @Nullable Throwable failure) {

    public static DependencyStatus available(String dependency, int attempts) {
        return new DependencyStatus(dependency, true, attempts, null);
    }

    public static DependencyStatus unavailable(String dependency, int attempts, Throwable failure) {
        return new DependencyStatus(dependency, false, attempts, failure);
    }

    public String describe() {
        if (available) {
            return dependency + " available after " + attempts + " attempt(s)";
        }
        return dependency + " unavailable after " + attempts + " attempt(s): "
                + (failure != null ? failure.getMessage() : "unknown error");
    }
}
