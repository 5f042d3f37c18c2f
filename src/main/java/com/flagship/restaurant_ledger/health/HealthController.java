package com.flagship.restaurant_ledger.health;

import com.flagship.restaurant_ledger.cache.LedgerCache;
import com.flagship.restaurant_ledger.observability.LedgerMetrics;
import com.flagship.restaurant_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain health endpoint for load balancers. Only the database decides
 * UP/DOWN; cache and backlog figures are informational.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerCache ledgerCache;
    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = pingDatabase();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("timestamp", clock.instant().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("cache", ledgerCache.status().name());
        body.put("outbox_pending", outboxMetrics.pendingTotal());
        body.put("outbox_dead_letters", outboxMetrics.deadLetters());
        body.put("pending_payables", ledgerMetrics.pendingPayables());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean pingDatabase() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
