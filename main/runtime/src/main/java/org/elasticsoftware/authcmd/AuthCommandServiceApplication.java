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

package org.elasticsoftware.authcmd;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.elasticsoftware.authcmd.bootstrap.FatalErrorHandler;
import org.elasticsoftware.authcmd.bootstrap.StartupVerifier;
import org.elasticsoftware.authcmd.config.AuthCommandProperties;
import org.elasticsoftware.authcmd.kafka.ClientIds;
import org.elasticsoftware.authcmd.kafka.CustomKafkaConsumerFactory;
import org.elasticsoftware.authcmd.kafka.KafkaMessageSink;
import org.elasticsoftware.authcmd.kafka.TopicConsumer;
import org.elasticsoftware.authcmd.kafka.WorkerPool;
import org.elasticsoftware.authcmd.protocol.AggregateKind;
import org.elasticsoftware.authcmd.protocol.EventRecord;
import org.elasticsoftware.authcmd.protocol.ResponseRecord;
import org.elasticsoftware.authcmd.protocol.VersionQuery;
import org.elasticsoftware.authcmd.registration.OutcomeEmitter;
import org.elasticsoftware.authcmd.registration.QueryCorrelator;
import org.elasticsoftware.authcmd.registration.VersionResolver;
import org.elasticsoftware.authcmd.serialization.EventBatchCodec;
import org.elasticsoftware.authcmd.serialization.ProtocolMessageSerde;
import org.elasticsoftware.authcmd.store.AuthStore;
import org.elasticsoftware.authcmd.store.MongoAuthStore;
import org.elasticsoftware.authcmd.store.MongoClientFactory;
import org.elasticsoftware.authcmd.users.UserPayloadReader;
import org.elasticsoftware.authcmd.util.EnvironmentPropertiesPrinter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.DependsOn;
import org.springframework.context.annotation.PropertySource;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@SpringBootApplication(exclude = {
        KafkaAutoConfiguration.class,
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class})
@EnableConfigurationProperties(AuthCommandProperties.class)
@PropertySource("classpath:auth-command-service.properties")
public class AuthCommandServiceApplication {
    private static final int BCRYPT_STRENGTH = 10;

    public static void main(String[] args) {
        SpringApplication.run(AuthCommandServiceApplication.class, args);
    }

    @Bean(name = "authCommandEventRecordSerde")
    public ProtocolMessageSerde<EventRecord> eventRecordSerde(ObjectMapper objectMapper) {
        return new ProtocolMessageSerde<>(objectMapper, EventRecord.class);
    }

    @Bean(name = "authCommandVersionQuerySerde")
    public ProtocolMessageSerde<VersionQuery> versionQuerySerde(ObjectMapper objectMapper) {
        return new ProtocolMessageSerde<>(objectMapper, VersionQuery.class);
    }

    @Bean(name = "authCommandResponseRecordSerde")
    public ProtocolMessageSerde<ResponseRecord> responseRecordSerde(ObjectMapper objectMapper) {
        return new ProtocolMessageSerde<>(objectMapper, ResponseRecord.class);
    }

    @Bean(name = "authCommandEventBatchCodec")
    public EventBatchCodec eventBatchCodec(ObjectMapper objectMapper) {
        return new EventBatchCodec(objectMapper);
    }

    @Bean(name = "authCommandKafkaAdmin")
    public KafkaAdmin kafkaAdmin(AuthCommandProperties properties) {
        KafkaAdmin kafkaAdmin = new KafkaAdmin(Map.of(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, properties.kafka().bootstrapServers()));
        kafkaAdmin.setOperationTimeout(10);
        kafkaAdmin.setFatalIfBrokerNotAvailable(false);
        return kafkaAdmin;
    }

    @Bean(name = "authCommandConsumerFactory")
    public ConsumerFactory<String, byte[]> consumerFactory(AuthCommandProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.kafka().bootstrapServers());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, "read_committed");
        return new CustomKafkaConsumerFactory<>(props, new StringDeserializer(), new ByteArrayDeserializer());
    }

    @Bean(name = "authCommandVersionQueryProducerFactory")
    public ProducerFactory<String, VersionQuery> versionQueryProducerFactory(
            AuthCommandProperties properties,
            @Qualifier("authCommandVersionQuerySerde") ProtocolMessageSerde<VersionQuery> serde) {
        return new DefaultKafkaProducerFactory<>(
                producerProperties(properties, properties.kafka().topics().eventQueryProducer()),
                new StringSerializer(),
                serde.serializer());
    }

    @Bean(name = "authCommandResponseProducerFactory")
    public ProducerFactory<String, ResponseRecord> responseProducerFactory(
            AuthCommandProperties properties,
            @Qualifier("authCommandResponseRecordSerde") ProtocolMessageSerde<ResponseRecord> serde) {
        return new DefaultKafkaProducerFactory<>(
                producerProperties(properties, properties.kafka().topics().registrationResponse()),
                new StringSerializer(),
                serde.serializer());
    }

    private static Map<String, Object> producerProperties(AuthCommandProperties properties, String topic) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.kafka().bootstrapServers());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, ClientIds.forTopic(topic));
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return props;
    }

    @Bean(name = "authCommandMongoClient", destroyMethod = "close")
    public MongoClient mongoClient(AuthCommandProperties properties) {
        return MongoClientFactory.create(properties.mongo());
    }

    @Bean(name = "authCommandMongoTemplate")
    public MongoTemplate mongoTemplate(@Qualifier("authCommandMongoClient") MongoClient mongoClient,
                                      AuthCommandProperties properties) {
        return new MongoTemplate(mongoClient, properties.mongo().database());
    }

    @Bean(name = "authCommandPasswordEncoder")
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    @Bean(name = "authCommandAuthStore")
    public AuthStore authStore(@Qualifier("authCommandMongoTemplate") MongoTemplate mongoTemplate,
                               @Qualifier("authCommandPasswordEncoder") PasswordEncoder passwordEncoder,
                               AuthCommandProperties properties) {
        return new MongoAuthStore(mongoTemplate, properties.mongo().collection(), passwordEncoder);
    }

    @Bean(name = "authCommandStartupVerifier", initMethod = "verify")
    public StartupVerifier startupVerifier(@Qualifier("authCommandAuthStore") AuthStore authStore,
                                           @Qualifier("authCommandKafkaAdmin") KafkaAdmin kafkaAdmin,
                                           AuthCommandProperties properties) {
        AuthCommandProperties.Topics topics = properties.kafka().topics();
        return new StartupVerifier(
                authStore,
                kafkaAdmin,
                List.of(topics.eventConsumer(), topics.eventQueryProducer(), topics.eventQueryConsumer(), topics.registrationResponse()),
                properties.startup().storeAttempts(),
                properties.startup().storeBackoff());
    }

    @Bean(name = "authCommandFatalErrorHandler")
    public FatalErrorHandler fatalErrorHandler() {
        return new FatalErrorHandler();
    }

    // closed before the sinks and the store it feeds, after the consumers that submit to it
    @DependsOn("authCommandReplayExecutor")
    @Bean(name = "authCommandWorkerPool", destroyMethod = "close")
    public WorkerPool workerPool(AuthCommandProperties properties) {
        return new WorkerPool("worker", properties.processing().workerThreads(), properties.processing().drainTimeout());
    }

    @DependsOn({"authCommandAuthStore", "authCommandVersionQuerySink", "authCommandResponseSink"})
    @Bean(name = "authCommandReplayExecutor", destroyMethod = "close")
    public WorkerPool replayExecutor(AuthCommandProperties properties) {
        return new WorkerPool("replay", properties.processing().replayThreads(), properties.processing().drainTimeout());
    }

    @Bean(name = "authCommandVersionQuerySink", destroyMethod = "close")
    public KafkaMessageSink<VersionQuery> versionQuerySink(
            @Qualifier("authCommandVersionQueryProducerFactory") ProducerFactory<String, VersionQuery> producerFactory,
            AuthCommandProperties properties,
            ApplicationEventPublisher eventPublisher) {
        return new KafkaMessageSink<>(producerFactory, properties.kafka().topics().eventQueryProducer(), eventPublisher);
    }

    @Bean(name = "authCommandResponseSink", destroyMethod = "close")
    public KafkaMessageSink<ResponseRecord> responseSink(
            @Qualifier("authCommandResponseProducerFactory") ProducerFactory<String, ResponseRecord> producerFactory,
            AuthCommandProperties properties,
            ApplicationEventPublisher eventPublisher) {
        return new KafkaMessageSink<>(producerFactory, properties.kafka().topics().registrationResponse(), eventPublisher);
    }

    @Bean(name = "authCommandOutcomeEmitter")
    public OutcomeEmitter outcomeEmitter(@Qualifier("authCommandResponseSink") KafkaMessageSink<ResponseRecord> responseSink,
                                         ObjectMapper objectMapper) {
        return new OutcomeEmitter(responseSink, objectMapper);
    }

    @Bean(name = "authCommandClock")
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "authCommandVersionResolver")
    public VersionResolver versionResolver(@Qualifier("authCommandAuthStore") AuthStore authStore,
                                           @Qualifier("authCommandVersionQuerySink") KafkaMessageSink<VersionQuery> querySink,
                                           @Qualifier("authCommandOutcomeEmitter") OutcomeEmitter outcomeEmitter,
                                           @Qualifier("authCommandClock") Clock clock) {
        return new VersionResolver(authStore, querySink, outcomeEmitter, clock);
    }

    @Bean(name = "authCommandQueryCorrelator")
    public QueryCorrelator queryCorrelator(@Qualifier("authCommandAuthStore") AuthStore authStore,
                                           @Qualifier("authCommandEventBatchCodec") EventBatchCodec eventBatchCodec,
                                           @Qualifier("authCommandOutcomeEmitter") OutcomeEmitter outcomeEmitter,
                                           @Qualifier("authCommandReplayExecutor") WorkerPool replayExecutor,
                                           ObjectMapper objectMapper) {
        return new QueryCorrelator(authStore, eventBatchCodec, new UserPayloadReader(objectMapper), outcomeEmitter, replayExecutor);
    }

    @DependsOn("authCommandStartupVerifier")
    @Bean(name = "authCommandIntentConsumer", initMethod = "start", destroyMethod = "close")
    public TopicConsumer<EventRecord> intentConsumer(
            @Qualifier("authCommandConsumerFactory") ConsumerFactory<String, byte[]> consumerFactory,
            @Qualifier("authCommandEventRecordSerde") ProtocolMessageSerde<EventRecord> serde,
            @Qualifier("authCommandVersionResolver") VersionResolver versionResolver,
            @Qualifier("authCommandWorkerPool") WorkerPool workerPool,
            AuthCommandProperties properties,
            ApplicationEventPublisher eventPublisher) {
        return new TopicConsumer<>(
                consumerFactory,
                properties.kafka().topics().eventConsumer(),
                properties.kafka().consumerGroup(),
                serde.deserializer(),
                AggregateKind.USER,
                versionResolver,
                workerPool,
                properties.processing().maxInFlight(),
                eventPublisher);
    }

    @DependsOn("authCommandStartupVerifier")
    @Bean(name = "authCommandQueryResponseConsumer", initMethod = "start", destroyMethod = "close")
    public TopicConsumer<ResponseRecord> queryResponseConsumer(
            @Qualifier("authCommandConsumerFactory") ConsumerFactory<String, byte[]> consumerFactory,
            @Qualifier("authCommandResponseRecordSerde") ProtocolMessageSerde<ResponseRecord> serde,
            @Qualifier("authCommandQueryCorrelator") QueryCorrelator queryCorrelator,
            @Qualifier("authCommandWorkerPool") WorkerPool workerPool,
            AuthCommandProperties properties,
            ApplicationEventPublisher eventPublisher) {
        return new TopicConsumer<>(
                consumerFactory,
                properties.kafka().topics().eventQueryConsumer(),
                properties.kafka().consumerGroup(),
                serde.deserializer(),
                AggregateKind.USER,
                queryCorrelator,
                workerPool,
                properties.processing().maxInFlight(),
                eventPublisher);
    }

    @Bean(name = "environmentPropertiesPrinter")
    public EnvironmentPropertiesPrinter environmentPropertiesPrinter() {
        return new EnvironmentPropertiesPrinter("authcmd.");
    }
}
