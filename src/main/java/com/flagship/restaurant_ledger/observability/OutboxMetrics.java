package com.flagship.restaurant_ledger.observability;

import com.flagship.restaurant_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Relay counters and backlog gauges for the back-office outbox.
 *
 * Backlog is reported per event type ({@code backoffice.outbox.pending{event_type}}).
 * All gauges read values cached by {@link #refresh()}, which the
 * {@link MetricsScheduler} drives.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry registry;
    private final Clock clock;
    private final int maxRetries;

    private final MultiGauge pendingByType;
    private final AtomicLong pendingTotal = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    public OutboxMetrics(OutboxService outboxService,
                         MeterRegistry registry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.registry = registry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        this.pendingByType = MultiGauge.builder("backoffice.outbox.pending")
                .description("Unpublished outbox events per event type")
                .register(registry);
        Gauge.builder("backoffice.outbox.oldest_pending", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event")
                .baseUnit("seconds")
                .register(registry);
        Gauge.builder("backoffice.outbox.dead_letters", deadLetters, AtomicLong::get)
                .description("Events no longer retried after max-retries failures")
                .register(registry);
    }

    public void refresh() {
        try {
            Map<String, Long> backlog = outboxService.backlogByEventType();
            pendingByType.register(backlog.entrySet().stream()
                    .map(entry -> MultiGauge.Row.of(Tags.of("event_type", entry.getKey()), entry.getValue()))
                    .collect(Collectors.toList()), true);
            pendingTotal.set(backlog.values().stream().mapToLong(Long::longValue).sum());

            oldestPendingSeconds.set(outboxService.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            deadLetters.set(outboxService.countDeadLettered(maxRetries));
        } catch (RuntimeException e) {
            log.warn("Outbox gauges not refreshed: {}", e.getMessage());
        }
    }

    /**
     * Backlog as of the last refresh.
     */
    public long pendingTotal() {
        return pendingTotal.get();
    }

    public long deadLetters() {
        return deadLetters.get();
    }

    public void recordRelayed(String eventType) {
        registry.counter("backoffice.outbox.relayed", "event_type", eventType, "result", "sent").increment();
    }

    public void recordRelayFailed(String eventType) {
        registry.counter("backoffice.outbox.relayed", "event_type", eventType, "result", "failed").increment();
    }
}
