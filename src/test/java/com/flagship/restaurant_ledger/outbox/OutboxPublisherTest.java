package com.flagship.restaurant_ledger.outbox;

import com.flagship.restaurant_ledger.event.MovementCreatedEvent;
import com.flagship.restaurant_ledger.ledger.FinancialMovement;
import com.flagship.restaurant_ledger.ledger.LedgerService;
import com.flagship.restaurant_ledger.ledger.dto.CreateMovementRequest;
import com.flagship.restaurant_ledger.observability.CorrelationContext;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relay of outbox events to Kafka.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Keep the scheduled relay out of the way; tests trigger it by hand
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("ledger.cache.enabled", () -> "false");
        registry.add("recurrence.scheduler.enabled", () -> "false");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Value("${kafka.topic.backoffice:backoffice-events}")
    private String backofficeTopic;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private Long userId;
    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        userId = jdbcTemplate.queryForObject(
                "INSERT INTO users (full_name, role) VALUES ('Pat Publisher', 'admin') RETURNING id", Long.class);

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(backofficeTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ConsumerRecord<String, String>> consumeRecordsWithKey(String key, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (matching.isEmpty() && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            });
        }
        return matching;
    }

    @Test
    @DisplayName("Recorded movements reach Kafka keyed by movement id and are marked published")
    void testPublishesMovementEvents() {
        printTestHeader("Publish Movement Event");

        FinancialMovement movement = ledgerService.create(CreateMovementRequest.builder()
                .type("REVENUE")
                .value(new BigDecimal("25.00"))
                .description("Counter sale")
                .paymentStatus("Paid")
                .build(), userId);
        String key = String.valueOf(movement.getId());

        List<OutboxEvent> pending = outboxService.getEventsForAggregate("FinancialMovement", key);
        assertEquals(1, pending.size());
        assertFalse(pending.get(0).isPublished());

        outboxPublisher.publishPendingEvents();

        List<OutboxEvent> after = outboxService.getEventsForAggregate("FinancialMovement", key);
        assertTrue(after.get(0).isPublished());

        List<ConsumerRecord<String, String>> records = consumeRecordsWithKey(key, 10000);
        System.out.println("Records received: " + records.size());
        assertEquals(1, records.size());
        assertTrue(records.get(0).value().contains(MovementCreatedEvent.EVENT_TYPE));
        printSuccess("Event relayed and marked published");
    }

    @Test
    @DisplayName("The request's correlation id is stored on the outbox row and sent as a record header")
    void testCorrelationIdTravelsWithEvent() {
        printTestHeader("Correlation Header");

        FinancialMovement movement;
        CorrelationContext.begin("corr-7781");
        try {
            movement = ledgerService.create(CreateMovementRequest.builder()
                    .type("EXPENSE")
                    .value(new BigDecimal("310.00"))
                    .description("Gas refill")
                    .paymentStatus("Pending")
                    .build(), userId);
        } finally {
            CorrelationContext.end();
        }
        String key = String.valueOf(movement.getId());

        List<OutboxEvent> stored = outboxService.getEventsForAggregate("FinancialMovement", key);
        assertEquals("corr-7781", stored.get(0).getCorrelationId());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = consumeRecordsWithKey(key, 10000);
        assertEquals(1, records.size());
        Header header = records.get(0).headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(header);
        assertEquals("corr-7781", new String(header.value(), StandardCharsets.UTF_8));
        printSuccess("Correlation id relayed as header");
    }

    @Test
    @DisplayName("A leased event is not handed to a second publisher until its lease expires")
    void testLeasedEventsAreNotClaimedTwice() {
        printTestHeader("Claim Lease");

        UUID eventId = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, payload, retry_count)
                VALUES (?, 'FinancialMovement', 'lease-1', 'financial_movement.created', CAST('{}' AS jsonb), 0)
                """, eventId);

        List<OutboxEvent> first = outboxService.claimBatch(1000, maxRetries, Duration.ofMinutes(5));
        assertTrue(first.stream().anyMatch(event -> event.getId().equals(eventId)));

        List<OutboxEvent> second = outboxService.claimBatch(1000, maxRetries, Duration.ofMinutes(5));
        assertTrue(second.stream().noneMatch(event -> event.getId().equals(eventId)));

        outboxPublisher.publishPendingEvents();
        assertFalse(outboxService.getEventsForAggregate("FinancialMovement", "lease-1").get(0).isPublished());

        jdbcTemplate.update(
                "UPDATE outbox_events SET claimed_until = CURRENT_TIMESTAMP - INTERVAL '1 minute' WHERE id = ?",
                eventId);
        outboxPublisher.publishPendingEvents();
        assertTrue(outboxService.getEventsForAggregate("FinancialMovement", "lease-1").get(0).isPublished());
        printSuccess("Lease kept the event to one publisher and expiry released it");
    }

    @Test
    @DisplayName("Events past the retry limit are left unpublished")
    void testDeadLetteredEventsAreSkipped() {
        printTestHeader("Dead Letter");

        UUID eventId = UUID.randomUUID();
        jdbcTemplate.update("""
                INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, payload, retry_count)
                VALUES (?, 'FinancialMovement', 'dead-1', 'financial_movement.created', CAST('{}' AS jsonb), ?)
                """, eventId, maxRetries);

        outboxPublisher.publishPendingEvents();

        List<OutboxEvent> events = outboxService.getEventsForAggregate("FinancialMovement", "dead-1");
        assertEquals(1, events.size());
        assertFalse(events.get(0).isPublished());
        assertTrue(outboxService.countDeadLettered(maxRetries) >= 1);
        printSuccess("Dead-lettered event left alone");
    }
}
