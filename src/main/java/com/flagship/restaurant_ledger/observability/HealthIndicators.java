package com.flagship.restaurant_ledger.observability;

import com.flagship.restaurant_ledger.cache.LedgerCache;
import com.flagship.restaurant_ledger.outbox.OutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator health contributors for the back-office ledger.
 */
public class HealthIndicators {

    /**
     * DOWN once the relay has fallen far behind or events are dead-lettered
     * past the tolerated count; WARNING in between.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxService outboxService;
        private final long warnBacklog;
        private final long downBacklog;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxService outboxService,
                                     @Value("${outbox.health.warn-backlog:1000}") long warnBacklog,
                                     @Value("${outbox.health.down-backlog:10000}") long downBacklog,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxService = outboxService;
            this.warnBacklog = warnBacklog;
            this.downBacklog = downBacklog;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            Map<String, Long> backlog;
            long deadLetters;
            try {
                backlog = outboxService.backlogByEventType();
                deadLetters = outboxService.countDeadLettered(maxRetries);
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }

            long pending = backlog.values().stream().mapToLong(Long::longValue).sum();
            Health.Builder builder;
            if (pending >= downBacklog) {
                builder = Health.down();
            } else if (pending >= warnBacklog || deadLetters > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", pending)
                    .withDetail("pendingByEventType", backlog)
                    .withDetail("deadLetters", deadLetters)
                    .build();
        }
    }

    /**
     * The cache is optional, so an unreachable Redis reports DEGRADED, never DOWN.
     */
    @Component("ledgerCacheHealth")
    public static class LedgerCacheHealthIndicator implements HealthIndicator {

        private final LedgerCache ledgerCache;

        public LedgerCacheHealthIndicator(LedgerCache ledgerCache) {
            this.ledgerCache = ledgerCache;
        }

        @Override
        public Health health() {
            LedgerCache.Status status = ledgerCache.status();
            Health.Builder builder = status == LedgerCache.Status.UP ? Health.up() : Health.status(status.name());
            if (status == LedgerCache.Status.DEGRADED) {
                builder.withDetail("note", "Ledger reads fall back to the database");
            }
            return builder.build();
        }
    }
}
