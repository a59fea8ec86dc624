package com.flagship.group_access.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.group_access.access.GroupAccessPlatform;
import com.flagship.group_access.lifecycle.LifecycleScheduler;
import com.flagship.group_access.payment.IngestionResult;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentIngestionService;
import com.flagship.group_access.payment.PaymentKind;
import com.flagship.group_access.payment.PaymentSource;
import com.flagship.group_access.reconciliation.TransactionLedgerClient;
import com.flagship.group_access.subscription.event.GracePeriodStartedEvent;
import com.flagship.group_access.user.UserProfile;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows reach Kafka on the right topic, keyed by member.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxKafkaPublishingTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("group_access_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean stays on but only runs when the test calls it
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("access.worker.enabled", () -> "false");
    }

    @MockBean
    private GroupAccessPlatform platform;

    @MockBean
    private TransactionLedgerClient ledgerClient;

    @Autowired
    private OutboxPublisher outboxPublisher;
    @Autowired
    private OutboxService outboxService;
    @Autowired
    private PaymentIngestionService ingestionService;
    @Autowired
    private LifecycleScheduler lifecycleScheduler;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.payments:payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.member-notifications:member-notifications}")
    private String memberNotificationsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM access_grant_tasks");
        jdbcTemplate.update("DELETE FROM payments");
        jdbcTemplate.update("DELETE FROM subscriptions");
        jdbcTemplate.update("DELETE FROM users");

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(paymentsTopic, memberNotificationsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private List<ConsumerRecord<String, String>> pollFor(String topic, String key, String eventType) {
        List<ConsumerRecord<String, String>> matched = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 15_000;
        while (matched.isEmpty() && System.currentTimeMillis() < deadline) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));
            for (ConsumerRecord<String, String> record : records) {
                if (record.topic().equals(topic) && key.equals(record.key()) && record.value().contains(eventType)) {
                    matched.add(record);
                }
            }
        }
        return matched;
    }

    @Test
    @DisplayName("An accepted payment is published to the payments topic and marked published")
    void paymentAcceptedPublished() throws Exception {
        Payment payment = Payment.create(701L, "ch_kafka_" + UUID.randomUUID(), null, 250, "XTR",
                PaymentKind.ONE_TIME, Instant.now(), null, "plan-30d", PaymentSource.LIVE);
        IngestionResult result = ingestionService.ingest(UserProfile.idOnly(701L), payment);

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollFor(paymentsTopic, "701", "PaymentAccepted");
        assertEquals(1, records.size());
        JsonNode body = objectMapper.readTree(records.get(0).value());
        assertEquals(701L, body.get("userId").asLong());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
                OutboxEvent.AGGREGATE_PAYMENT, result.getPayment().getId());
        assertTrue(events.get(0).isPublished());
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("A grace notice goes to the member-notifications topic")
    void graceNoticePublished() {
        Instant expiresAt = Instant.parse("2025-01-01T00:00:00Z");
        Payment payment = Payment.create(702L, "ch_kafka_" + UUID.randomUUID(), null, 250, "XTR",
                PaymentKind.RECURRING_RENEWAL, expiresAt.minus(Duration.ofDays(30)), expiresAt,
                "plan-30d", PaymentSource.LIVE);
        ingestionService.ingest(UserProfile.idOnly(702L), payment);
        lifecycleScheduler.sweep(Instant.parse("2025-01-02T00:00:00Z"));

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records =
                pollFor(memberNotificationsTopic, "702", GracePeriodStartedEvent.EVENT_TYPE);
        assertEquals(1, records.size());
        assertTrue(records.get(0).value().contains("\"graceUntil\":\"2025-01-03T00:00:00Z\""));
    }
}
