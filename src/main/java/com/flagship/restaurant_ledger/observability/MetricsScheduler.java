package com.flagship.restaurant_ledger.observability;

import com.flagship.restaurant_ledger.common.tx.TransactionRunner;
import com.flagship.restaurant_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes every gauge backed by a database query, so Prometheus scrapes
 * only ever read cached values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refresh();
        refreshLedgerBacklog();
    }

    void refreshLedgerBacklog() {
        try {
            LedgerStore.LedgerBacklog backlog = transactionRunner.readOnly(ledgerStore::countBacklog);
            ledgerMetrics.updateBacklog(backlog.pendingPayables(), backlog.unreconciledPaid());
        } catch (RuntimeException e) {
            log.warn("Ledger backlog gauges not refreshed: {}", e.getMessage());
        }
    }
}
