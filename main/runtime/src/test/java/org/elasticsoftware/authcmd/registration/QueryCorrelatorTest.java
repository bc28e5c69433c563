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

package org.elasticsoftware.authcmd.registration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.ErrorKind;
import org.elasticsoftware.authcmd.protocol.EventRecord;
import org.elasticsoftware.authcmd.protocol.ResponseRecord;
import org.elasticsoftware.authcmd.serialization.EventBatchCodec;
import org.elasticsoftware.authcmd.store.InMemoryAuthStore;
import org.elasticsoftware.authcmd.users.User;
import org.elasticsoftware.authcmd.users.UserPayloadReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class QueryCorrelatorTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventBatchCodec codec = new EventBatchCodec(objectMapper);
    private final List<ResponseRecord> outcomes = Collections.synchronizedList(new ArrayList<>());
    private InMemoryAuthStore authStore;
    private ExecutorService replayExecutor;
    private QueryCorrelator correlator;

    @BeforeEach
    void setUp() {
        authStore = new InMemoryAuthStore();
        replayExecutor = Executors.newFixedThreadPool(4);
        correlator = new QueryCorrelator(
                authStore,
                codec,
                new UserPayloadReader(objectMapper),
                new OutcomeEmitter(outcomes::add, objectMapper),
                replayExecutor);
    }

    @AfterEach
    void tearDown() {
        replayExecutor.shutdownNow();
    }

    @Test
    void testReplayRegistersUserWithEventVersion() throws IOException {
        correlator.handle(batch("q1", event("c-alice", 5L, userJson("alice"))));

        assertEquals(1, outcomes.size());
        ResponseRecord outcome = outcomes.get(0);
        assertEquals("c-alice", outcome.correlationId());
        assertEquals(AggregateKind.USER, outcome.aggregateKind());
        assertEquals(ErrorKind.NONE, outcome.errorKind());
        assertFalse(outcome.hasError());

        JsonNode result = objectMapper.readTree(outcome.result());
        assertEquals(5L, result.get("version").asLong());
        assertEquals("alice", result.get("username").asText());
        assertEquals("Alice", result.get("first_name").asText());
        assertTrue(result.hasNonNull("_id"));
        assertTrue(result.hasNonNull("uuid"));
        assertFalse(result.has("password"));

        List<User> users = authStore.getUsers();
        assertEquals(1, users.size());
        assertEquals(5L, users.get(0).version());
        assertEquals(result.get("uuid").asText(), users.get(0).uuid().toString());
    }

    @Test
    void testDuplicateUsernameInOneBatch() {
        correlator.handle(batch("q2",
                event("c-1", 6L, userJson("bob")),
                event("c-2", 7L, userJson("bob"))));

        assertEquals(2, outcomes.size());
        Map<String, ResponseRecord> byCorrelationId = outcomes.stream()
                .collect(Collectors.toMap(ResponseRecord::correlationId, Function.identity()));
        assertEquals(Set.of("c-1", "c-2"), byCorrelationId.keySet());
        Set<ErrorKind> errorKinds = outcomes.stream().map(ResponseRecord::errorKind).collect(Collectors.toSet());
        assertEquals(Set.of(ErrorKind.NONE, ErrorKind.DUPLICATE_USERNAME), errorKinds);
        assertEquals(1, authStore.getUsers().size());
    }

    @Test
    void testUndecodablePayloadDoesNotStopSiblings() {
        correlator.handle(batch("q3",
                event("c-bad", 8L, "not json"),
                event("c-carol", 9L, userJson("carol"))));

        assertEquals(2, outcomes.size());
        Map<String, ResponseRecord> byCorrelationId = outcomes.stream()
                .collect(Collectors.toMap(ResponseRecord::correlationId, Function.identity()));
        assertEquals(ErrorKind.INTERNAL, byCorrelationId.get("c-bad").errorKind());
        assertEquals(ErrorKind.NONE, byCorrelationId.get("c-carol").errorKind());
        assertEquals(1, authStore.getUsers().size());
    }

    @Test
    void testUndecodableBatch() {
        correlator.handle(ResponseRecord.success(AggregateKind.USER, "q4", "garbage".getBytes(UTF_8)));

        assertEquals(1, outcomes.size());
        assertEquals("q4", outcomes.get(0).correlationId());
        assertEquals(ErrorKind.INTERNAL, outcomes.get(0).errorKind());
        assertTrue(authStore.getUsers().isEmpty());
    }

    @Test
    void testEventStoreError() {
        correlator.handle(ResponseRecord.failure(AggregateKind.USER, "q5", ErrorKind.INTERNAL, "partition unavailable"));

        assertEquals(1, outcomes.size());
        assertEquals("q5", outcomes.get(0).correlationId());
        assertEquals(ErrorKind.INTERNAL, outcomes.get(0).errorKind());
        assertTrue(outcomes.get(0).error().contains("partition unavailable"));
        assertTrue(authStore.getUsers().isEmpty());
    }

    @Test
    void testEmptyBatch() {
        correlator.handle(batch("q6"));

        assertTrue(outcomes.isEmpty());
    }

    @Test
    void testOtherAggregateEventsAreSkipped() {
        correlator.handle(batch("q7",
                new EventRecord(AggregateKind.UNKNOWN, "c-other", 10L, userJson("dave").getBytes(UTF_8), UUID.randomUUID()),
                event("c-erin", 11L, userJson("erin"))));

        assertEquals(1, outcomes.size());
        assertEquals("c-erin", outcomes.get(0).correlationId());
    }

    @Test
    void testRejectedReplayYieldsInternalOutcome() {
        AtomicInteger submissions = new AtomicInteger();
        Executor rejectingAfterFirst = command -> {
            if (submissions.getAndIncrement() > 0) {
                throw new RejectedExecutionException("replay executor is shut down");
            }
            command.run();
        };
        QueryCorrelator shuttingDown = new QueryCorrelator(
                authStore,
                codec,
                new UserPayloadReader(objectMapper),
                new OutcomeEmitter(outcomes::add, objectMapper),
                rejectingAfterFirst);

        shuttingDown.handle(batch("q8",
                event("c-frank", 12L, userJson("frank")),
                event("c-grace", 13L, userJson("grace")),
                event("c-heidi", 14L, userJson("heidi"))));

        Map<String, ResponseRecord> byCorrelationId = outcomes.stream()
                .collect(Collectors.toMap(ResponseRecord::correlationId, Function.identity()));
        assertEquals(Set.of("c-frank", "c-grace", "c-heidi"), byCorrelationId.keySet());
        assertEquals(ErrorKind.NONE, byCorrelationId.get("c-frank").errorKind());
        assertEquals(ErrorKind.INTERNAL, byCorrelationId.get("c-grace").errorKind());
        assertEquals(ErrorKind.INTERNAL, byCorrelationId.get("c-heidi").errorKind());
        assertEquals(1, authStore.getUsers().size());
    }

    private ResponseRecord batch(String correlationId, EventRecord... events) {
        return ResponseRecord.success(AggregateKind.USER, correlationId, codec.encode(List.of(events)));
    }

    private static EventRecord event(String correlationId, long version, String payload) {
        return new EventRecord(AggregateKind.USER, correlationId, version, payload.getBytes(UTF_8), UUID.randomUUID());
    }

    private static String userJson(String username) {
        String firstName = Character.toUpperCase(username.charAt(0)) + username.substring(1);
        return "{\"email\":\"" + username + "@example.com\",\"first_name\":\"" + firstName
                + "\",\"username\":\"" + username + "\",\"password\":\"secret\",\"role\":\"user\"}";
    }
}
