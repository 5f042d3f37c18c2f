package com.flagship.restaurant_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Paid movements split by reconciliation state.
 */
@Value
@Builder
public class ReconciliationReport {
    long totalCount;
    long reconciledCount;
    long unreconciledCount;
    BigDecimal totalAmount;
    BigDecimal reconciledAmount;
    BigDecimal unreconciledAmount;
    List<FinancialMovement> movements;
}
