package com.flagship.restaurant_ledger.outbox;

import com.flagship.restaurant_ledger.event.LedgerEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of {@code outbox_events}: a back-office event waiting to be relayed
 * to Kafka, or already relayed when {@code publishedAt} is set.
 */
@Value
@Builder
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Wraps a serialized domain event; the sequence number is assigned on insert.
     */
    public static OutboxEvent pending(LedgerEvent event, String payload, String correlationId) {
        return OutboxEvent.builder()
                .id(event.getEventId())
                .aggregateType(event.getAggregateType())
                .aggregateId(event.getAggregateId())
                .eventType(event.getEventType())
                .payload(payload)
                .correlationId(correlationId)
                .createdAt(event.getOccurredAt())
                .build();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
