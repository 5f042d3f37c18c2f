package com.flagship.restaurant_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger, purchase, settlement and recurrence operations.
 *
 * Metrics exposed:
 * - ledger.movements.created{type}: movements recorded
 * - ledger.operations{operation, outcome}: top-level operation outcomes
 * - ledger.operation.latency{operation}: operation duration
 * - ledger.cache{result}: cache hits and misses
 * - recurrence.movements{result}: generated, skipped and failed rules
 * - ledger.backlog{kind}: pending payables and unreconciled paid movements
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer settlementTimer;
    private final AtomicLong pendingPayables = new AtomicLong();
    private final AtomicLong unreconciledPaid = new AtomicLong();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.settlementTimer = Timer.builder("ledger.settlement.duration")
                .description("Time taken to book revenue, CMV and fees for an order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        registry.gauge("ledger.backlog", Tags.of("kind", "pending_payables"), pendingPayables);
        registry.gauge("ledger.backlog", Tags.of("kind", "unreconciled_paid"), unreconciledPaid);
    }

    public void updateBacklog(long payables, long unreconciled) {
        pendingPayables.set(payables);
        unreconciledPaid.set(unreconciled);
    }

    public long pendingPayables() {
        return pendingPayables.get();
    }

    public void recordMovementCreated(String type) {
        registry.counter("ledger.movements.created", "type", sanitizeTag(type)).increment();
    }

    /**
     * Records the outcome of a top-level operation, e.g. ("purchase.delete", "INSUFFICIENT_STOCK").
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeSettlement(Supplier<T> operation) {
        return settlementTimer.record(operation);
    }

    public void recordCacheHit() {
        registry.counter("ledger.cache", "result", "hit").increment();
    }

    public void recordCacheMiss() {
        registry.counter("ledger.cache", "result", "miss").increment();
    }

    public void recordRecurrence(int generated, int skipped, int failed) {
        registry.counter("recurrence.movements", "result", "generated").increment(generated);
        registry.counter("recurrence.movements", "result", "skipped").increment(skipped);
        registry.counter("recurrence.movements", "result", "failed").increment(failed);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
