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

import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentPropertiesPrinterTest {

    @Test
    void testPrefixFilter() {
        EnvironmentPropertiesPrinter printer = new EnvironmentPropertiesPrinter("authcmd.", "spring.");
        assertTrue(printer.isPrinted("authcmd.mongo.hosts"));
        assertTrue(printer.isPrinted("spring.application.name"));
        assertFalse(printer.isPrinted("java.home"));
    }

    @Test
    void testSecretDetection() {
        assertTrue(EnvironmentPropertiesPrinter.isSecret("authcmd.mongo.password"));
        assertTrue(EnvironmentPropertiesPrinter.isSecret("authcmd.kafka.sasl-secret"));
        assertFalse(EnvironmentPropertiesPrinter.isSecret("authcmd.mongo.username"));
    }

    @Test
    void testPrintsOnRefresh() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources()
                    .addFirst(new MapPropertySource("test", Map.of("authcmd.mongo.password", "secret")));
            context.registerBean(EnvironmentPropertiesPrinter.class, () -> new EnvironmentPropertiesPrinter("authcmd."));
            assertDoesNotThrow(context::refresh);
        }
    }
}
