package com.flagship.group_access.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.group_access.access.GroupAccessPlatform;
import com.flagship.group_access.lifecycle.LifecycleScheduler;
import com.flagship.group_access.payment.Payment;
import com.flagship.group_access.payment.PaymentIngestionService;
import com.flagship.group_access.payment.PaymentKind;
import com.flagship.group_access.payment.PaymentSource;
import com.flagship.group_access.reconciliation.TransactionLedgerClient;
import com.flagship.group_access.subscription.event.GracePeriodStartedEvent;
import com.flagship.group_access.user.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox persistence: events are written with the state change, fetched for publishing,
 * and retired or retried.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("group_access_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // Publisher off; events stay in the table for inspection
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("access.worker.enabled", () -> "false");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
    }

    @MockBean
    private GroupAccessPlatform platform;

    @MockBean
    private TransactionLedgerClient ledgerClient;

    @Autowired
    private OutboxService outboxService;
    @Autowired
    private PaymentIngestionService ingestionService;
    @Autowired
    private LifecycleScheduler lifecycleScheduler;
    @Autowired
    private TransactionTemplate transactionTemplate;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM access_grant_tasks");
        jdbcTemplate.update("DELETE FROM payments");
        jdbcTemplate.update("DELETE FROM subscriptions");
        jdbcTemplate.update("DELETE FROM users");
    }

    private static GracePeriodStartedEvent graceEvent(long userId) {
        return new GracePeriodStartedEvent(UUID.randomUUID(), userId, UUID.randomUUID(),
                Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-01-03T00:00:00Z"),
                Instant.parse("2025-01-01T06:00:00Z"));
    }

    private OutboxEvent saveInTransaction(GracePeriodStartedEvent event) {
        return transactionTemplate.execute(status ->
                outboxService.saveEvent(OutboxEvent.AGGREGATE_SUBSCRIPTION, event.getSubscriptionId(), event));
    }

    @Test
    @DisplayName("A saved event is keyed by user and carries the event as JSON")
    void saveEvent() throws Exception {
        GracePeriodStartedEvent domainEvent = graceEvent(501L);

        OutboxEvent event = saveInTransaction(domainEvent);

        assertEquals(OutboxEvent.AGGREGATE_SUBSCRIPTION, event.getAggregateType());
        assertEquals(domainEvent.getSubscriptionId(), event.getAggregateId());
        assertEquals(GracePeriodStartedEvent.EVENT_TYPE, event.getEventType());
        assertEquals("501", event.getPartitionKey());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(501L, payload.get("userId").asLong());
        assertEquals(domainEvent.getEventId().toString(), payload.get("eventId").asText());
        assertEquals("2025-01-03T00:00:00Z", payload.get("graceUntil").asText());
    }

    @Test
    @DisplayName("Saving outside a transaction is rejected")
    void saveRequiresTransaction() {
        GracePeriodStartedEvent domainEvent = graceEvent(502L);

        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent(OutboxEvent.AGGREGATE_SUBSCRIPTION, domainEvent.getSubscriptionId(), domainEvent));
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Published events leave the queue")
    void markPublished() {
        OutboxEvent first = saveInTransaction(graceEvent(503L));
        OutboxEvent second = saveInTransaction(graceEvent(503L));

        outboxService.markPublished(first.getId());

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10, 5);
        assertEquals(1, pending.size());
        assertEquals(second.getId(), pending.get(0).getId());
        assertEquals(1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Failures are counted and an event past the retry limit is no longer fetched")
    void markFailed() {
        OutboxEvent event = saveInTransaction(graceEvent(504L));

        outboxService.markFailed(event.getId(), "broker unavailable");
        outboxService.markFailed(event.getId(), "broker unavailable");

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10, 5);
        assertEquals(1, pending.size());
        assertEquals(2, pending.get(0).getRetryCount());
        assertEquals("broker unavailable", pending.get(0).getLastError());

        assertTrue(outboxService.findUnpublishedEvents(10, 2).isEmpty());
    }

    @Test
    @DisplayName("Events for one user come back in write order")
    void ordering() {
        saveInTransaction(graceEvent(505L));
        saveInTransaction(graceEvent(505L));
        saveInTransaction(graceEvent(505L));

        List<OutboxEvent> events = outboxService.getEventsForUser(GracePeriodStartedEvent.EVENT_TYPE, 505L);

        assertEquals(3, events.size());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertTrue(events.get(1).getSequenceNumber() < events.get(2).getSequenceNumber());
    }

    @Test
    @DisplayName("Entering grace queues exactly one GracePeriodStarted event")
    void graceTransitionQueuesEvent() {
        Instant expiresAt = Instant.parse("2025-01-01T00:00:00Z");
        Payment payment = Payment.create(506L, "ch_outbox_" + UUID.randomUUID(), null, 250, "XTR",
                PaymentKind.RECURRING_RENEWAL, expiresAt.minusSeconds(86_400L * 30), expiresAt,
                "plan-30d", PaymentSource.LIVE);
        ingestionService.ingest(UserProfile.idOnly(506L), payment);

        lifecycleScheduler.sweep(Instant.parse("2025-01-02T00:00:00Z"));
        lifecycleScheduler.sweep(Instant.parse("2025-01-02T01:00:00Z"));

        List<OutboxEvent> events = outboxService.getEventsForUser(GracePeriodStartedEvent.EVENT_TYPE, 506L);
        assertEquals(1, events.size());
        assertEquals(OutboxEvent.AGGREGATE_SUBSCRIPTION, events.get(0).getAggregateType());
    }
}
