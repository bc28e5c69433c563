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

package org.elasticsoftware.authcmd.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Logs the effective service configuration once the context is refreshed. Values of keys that
 * look like secrets are masked.
 */
public class EnvironmentPropertiesPrinter {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentPropertiesPrinter.class);
    private static final String MASK = "******";
    private final List<String> prefixes;

    public EnvironmentPropertiesPrinter(String... prefixes) {
        this.prefixes = Arrays.asList(prefixes);
    }

    @EventListener
    public void handleContextRefreshed(ContextRefreshedEvent event) {
        ConfigurableEnvironment env = (ConfigurableEnvironment) event.getApplicationContext().getEnvironment();
        logger.info("******* Environment Properties *******");
        env.getPropertySources()
                .stream()
                .filter(ps -> ps instanceof EnumerablePropertySource<?>)
                .flatMap(ps -> Arrays.stream(((EnumerablePropertySource<?>) ps).getPropertyNames()))
                .distinct()
                .filter(this::isPrinted)
                .sorted()
                .forEach(key -> logger.info("{}={}", key, isSecret(key) ? MASK : env.getProperty(key)));
        logger.info("**************************************");
    }

    boolean isPrinted(String key) {
        return prefixes.stream().anyMatch(key::startsWith);
    }

    static boolean isSecret(String key) {
        String lowerCaseKey = key.toLowerCase(Locale.ROOT);
        return lowerCaseKey.contains("password") || lowerCaseKey.contains("secret") || lowerCaseKey.contains("credential");
    }
}
