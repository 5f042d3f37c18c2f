package com.flagship.restaurant_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.event.EventPublisher;
import com.flagship.restaurant_ledger.event.LedgerEvent;
import com.flagship.restaurant_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Outbox-backed {@link EventPublisher}.
 *
 * Business flows publish from post-commit callbacks, so an event is only
 * recorded for changes that actually committed. The row is written in its
 * own transaction, stamped with the request's correlation id, and relayed to
 * Kafka later by {@link OutboxPublisher}. A failure to record is logged and
 * dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService implements EventPublisher {

    private final OutboxEventRepository repository;
    private final TransactionRunner transactionRunner;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(LedgerEvent event) {
        try {
            OutboxEvent row = OutboxEvent.pending(event, toJson(event), CorrelationContext.current());
            transactionRunner.inNewTransaction(tx -> {
                repository.insert(row, tx);
                return row.getId();
            });
            log.debug("Outbox <- {} {}:{}", event.getEventType(), event.getAggregateType(), event.getAggregateId());
        } catch (RuntimeException e) {
            log.warn("Dropped event {} for {} {}: {}",
                    event.getEventType(), event.getAggregateType(), event.getAggregateId(), e.getMessage());
        }
    }

    /**
     * Leases a batch for relay. The lease is committed before any send, so a
     * concurrent publisher skips these rows until they are marked or the lease
     * expires.
     */
    public List<OutboxEvent> claimBatch(int limit, int maxRetries, Duration lease) {
        return transactionRunner.inNewTransaction(tx -> repository.claimRelayable(limit, maxRetries, lease, tx));
    }

    public void markPublished(UUID eventId) {
        transactionRunner.inNewTransaction(tx -> repository.markPublished(eventId, tx));
    }

    public void markFailed(UUID eventId, String errorMessage) {
        transactionRunner.inNewTransaction(tx -> repository.markFailed(eventId, errorMessage, tx));
    }

    public List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateId) {
        return transactionRunner.readOnly(tx -> repository.findByAggregate(aggregateType, aggregateId, tx));
    }

    public Map<String, Long> backlogByEventType() {
        return transactionRunner.readOnly(repository::countUnpublishedByEventType);
    }

    public long countUnpublished() {
        return backlogByEventType().values().stream().mapToLong(Long::longValue).sum();
    }

    public long countDeadLettered(int maxRetries) {
        return transactionRunner.readOnly(tx -> repository.countDeadLettered(maxRetries, tx));
    }

    public Optional<Instant> findOldestUnpublishedCreatedAt() {
        return transactionRunner.readOnly(repository::findOldestUnpublishedCreatedAt);
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType(), e);
        }
    }
}
