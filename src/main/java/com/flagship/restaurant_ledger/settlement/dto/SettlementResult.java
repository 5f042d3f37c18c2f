package com.flagship.restaurant_ledger.settlement.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Movements booked for an order. {@code cmvId} and {@code feeId} are null
 * when there was no cost or no fee.
 */
@Value
@Builder
public class SettlementResult {
    Long orderId;
    Long revenueId;
    Long cmvId;
    Long feeId;
    BigDecimal totalCmv;
    BigDecimal feeAmount;
    boolean alreadySettled;
}
