package com.flagship.restaurant_ledger.outbox;

import com.flagship.restaurant_ledger.common.tx.TransactionContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDBC access to {@code outbox_events}.
 */
@Repository
public class OutboxEventRepository {

    private static final String EVENT_COLUMNS = """
            id, aggregate_type, aggregate_id, event_type, payload::text AS payload, correlation_id,
            created_at, published_at, retry_count, last_error, sequence_number
            """;

    private static final Comparator<OutboxEvent> RELAY_ORDER = Comparator
            .comparing(OutboxEvent::getCreatedAt)
            .thenComparing(OutboxEvent::getSequenceNumber);

    private static final RowMapper<OutboxEvent> EVENT_MAPPER = (rs, rowNum) -> OutboxEvent.builder()
            .id(rs.getObject("id", UUID.class))
            .aggregateType(rs.getString("aggregate_type"))
            .aggregateId(rs.getString("aggregate_id"))
            .eventType(rs.getString("event_type"))
            .payload(rs.getString("payload"))
            .correlationId(rs.getString("correlation_id"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .publishedAt(toInstant(rs.getTimestamp("published_at")))
            .retryCount(rs.getInt("retry_count"))
            .lastError(rs.getString("last_error"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .build();

    public void insert(OutboxEvent event, TransactionContext tx) {
        tx.jdbc().update("""
                INSERT INTO outbox_events (
                    id, aggregate_type, aggregate_id, event_type, payload, correlation_id, created_at, retry_count
                ) VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?, ?, 0)
                """,
                event.getId(), event.getAggregateType(), event.getAggregateId(), event.getEventType(),
                event.getPayload(), event.getCorrelationId(), Timestamp.from(event.getCreatedAt()));
    }

    /**
     * Leases up to {@code limit} relayable events to the caller, oldest first.
     * A leased row is invisible to other publishers until it is marked
     * published or failed, or the lease runs out. Dead letters are never leased.
     */
    public List<OutboxEvent> claimRelayable(int limit, int maxRetries, Duration lease, TransactionContext tx) {
        List<OutboxEvent> claimed = tx.jdbc().query("""
                UPDATE outbox_events
                SET claimed_until = CURRENT_TIMESTAMP + (? * INTERVAL '1 second')
                WHERE id IN (
                    SELECT id
                    FROM outbox_events
                    WHERE published_at IS NULL AND retry_count < ?
                      AND (claimed_until IS NULL OR claimed_until < CURRENT_TIMESTAMP)
                    ORDER BY created_at ASC, sequence_number ASC
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED
                )
                RETURNING """ + EVENT_COLUMNS, EVENT_MAPPER, lease.toSeconds(), maxRetries, limit);
        return claimed.stream()
                .sorted(RELAY_ORDER)
                .collect(Collectors.toList());
    }

    public List<OutboxEvent> findByAggregate(String aggregateType, String aggregateId, TransactionContext tx) {
        return tx.jdbc().query("SELECT " + EVENT_COLUMNS + """
                FROM outbox_events
                WHERE aggregate_type = ? AND aggregate_id = ?
                ORDER BY sequence_number ASC
                """, EVENT_MAPPER, aggregateType, aggregateId);
    }

    public int markPublished(UUID id, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE outbox_events
                SET published_at = CURRENT_TIMESTAMP, last_error = NULL, claimed_until = NULL
                WHERE id = ?
                """, id);
    }

    public int markFailed(UUID id, String error, TransactionContext tx) {
        return tx.jdbc().update("""
                UPDATE outbox_events
                SET retry_count = retry_count + 1, last_error = ?, claimed_until = NULL
                WHERE id = ?
                """, error, id);
    }

    /**
     * Unpublished events per event type, e.g. {@code purchase.created -> 3}.
     */
    public Map<String, Long> countUnpublishedByEventType(TransactionContext tx) {
        Map<String, Long> counts = new LinkedHashMap<>();
        tx.jdbc().query("""
                SELECT event_type, COUNT(*) AS pending
                FROM outbox_events
                WHERE published_at IS NULL
                GROUP BY event_type
                ORDER BY event_type
                """, rs -> {
            counts.put(rs.getString("event_type"), rs.getLong("pending"));
        });
        return counts;
    }

    public long countDeadLettered(int maxRetries, TransactionContext tx) {
        Long count = tx.jdbc().queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE published_at IS NULL AND retry_count >= ?",
                Long.class, maxRetries);
        return count == null ? 0 : count;
    }

    public Optional<Instant> findOldestUnpublishedCreatedAt(TransactionContext tx) {
        Timestamp oldest = tx.jdbc().queryForObject(
                "SELECT MIN(created_at) FROM outbox_events WHERE published_at IS NULL", Timestamp.class);
        return Optional.ofNullable(toInstant(oldest));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
