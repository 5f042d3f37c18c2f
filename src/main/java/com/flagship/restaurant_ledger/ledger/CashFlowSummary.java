package com.flagship.restaurant_ledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Paid totals per movement type over a period, with derived profit figures.
 */
@Value
@Builder
@Jacksonized
public class CashFlowSummary {
    CashFlowPeriod period;
    BigDecimal totalRevenue;
    BigDecimal totalExpense;
    BigDecimal totalCmv;
    BigDecimal totalTax;
    BigDecimal grossProfit;
    BigDecimal netProfit;
    BigDecimal cashFlow;
    /** Pending EXPENSE + TAX in the period; null unless requested. */
    BigDecimal pendingAmount;

    public static CashFlowSummary of(CashFlowPeriod period,
                                     Map<MovementType, BigDecimal> paidTotals,
                                     BigDecimal pendingAmount) {
        BigDecimal revenue = paidTotals.getOrDefault(MovementType.REVENUE, BigDecimal.ZERO);
        BigDecimal expense = paidTotals.getOrDefault(MovementType.EXPENSE, BigDecimal.ZERO);
        BigDecimal cmv = paidTotals.getOrDefault(MovementType.CMV, BigDecimal.ZERO);
        BigDecimal tax = paidTotals.getOrDefault(MovementType.TAX, BigDecimal.ZERO);

        BigDecimal grossProfit = revenue.subtract(cmv);
        BigDecimal netProfit = grossProfit.subtract(expense).subtract(tax);

        return CashFlowSummary.builder()
                .period(period)
                .totalRevenue(revenue)
                .totalExpense(expense)
                .totalCmv(cmv)
                .totalTax(tax)
                .grossProfit(grossProfit)
                .netProfit(netProfit)
                .cashFlow(revenue.subtract(expense).subtract(cmv).subtract(tax))
                .pendingAmount(pendingAmount)
                .build();
    }
}
