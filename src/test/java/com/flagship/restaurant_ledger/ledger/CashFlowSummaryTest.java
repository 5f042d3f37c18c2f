package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Derived cash-flow figures and reporting windows.
 */
class CashFlowSummaryTest {

    @Test
    @DisplayName("Profit and cash flow are derived from paid totals")
    void testDerivedFigures() {
        Map<MovementType, BigDecimal> totals = new EnumMap<>(MovementType.class);
        totals.put(MovementType.REVENUE, new BigDecimal("1000.00"));
        totals.put(MovementType.CMV, new BigDecimal("300.00"));
        totals.put(MovementType.EXPENSE, new BigDecimal("200.00"));
        totals.put(MovementType.TAX, new BigDecimal("50.00"));

        CashFlowSummary summary = CashFlowSummary.of(CashFlowPeriod.THIS_MONTH, totals, null);

        assertEquals(new BigDecimal("700.00"), summary.getGrossProfit());
        assertEquals(new BigDecimal("450.00"), summary.getNetProfit());
        assertEquals(new BigDecimal("450.00"), summary.getCashFlow());
        assertNull(summary.getPendingAmount());
    }

    @Test
    @DisplayName("Missing types count as zero")
    void testMissingTypes() {
        Map<MovementType, BigDecimal> totals = new EnumMap<>(MovementType.class);
        totals.put(MovementType.REVENUE, new BigDecimal("80.00"));

        CashFlowSummary summary = CashFlowSummary.of(CashFlowPeriod.ALL, totals, new BigDecimal("15.00"));

        assertEquals(0, BigDecimal.ZERO.compareTo(summary.getTotalExpense()));
        assertEquals(new BigDecimal("80.00"), summary.getCashFlow());
        assertEquals(new BigDecimal("15.00"), summary.getPendingAmount());
    }

    @Test
    @DisplayName("Periods parse case-insensitively and default to this month")
    void testPeriodParsing() {
        assertEquals(CashFlowPeriod.THIS_MONTH, CashFlowPeriod.parse(null));
        assertEquals(CashFlowPeriod.LAST_30_DAYS, CashFlowPeriod.parse("LAST_30_DAYS"));
        assertEquals(CashFlowPeriod.ALL, CashFlowPeriod.parse("all"));

        LedgerException exception = assertThrows(LedgerException.class, () -> CashFlowPeriod.parse("last_year"));
        assertEquals(ErrorCode.INVALID_PERIOD, exception.getErrorCode());
    }

    @Test
    @DisplayName("Last month in January is December of the previous year")
    void testLastMonthAcrossYear() {
        LocalDate today = LocalDate.of(2026, 1, 15);

        assertEquals(LocalDateTime.of(2025, 12, 1, 0, 0), CashFlowPeriod.LAST_MONTH.startFrom(today));
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 0), CashFlowPeriod.LAST_MONTH.endFrom(today));
    }

    @Test
    @DisplayName("Window bounds for the other periods")
    void testWindows() {
        LocalDate today = LocalDate.of(2026, 10, 17);

        assertEquals(LocalDateTime.of(2026, 10, 1, 0, 0), CashFlowPeriod.THIS_MONTH.startFrom(today));
        assertEquals(LocalDateTime.of(2026, 11, 1, 0, 0), CashFlowPeriod.THIS_MONTH.endFrom(today));
        assertEquals(LocalDateTime.of(2026, 9, 17, 0, 0), CashFlowPeriod.LAST_30_DAYS.startFrom(today));
        assertNull(CashFlowPeriod.LAST_30_DAYS.endFrom(today));
        assertNull(CashFlowPeriod.ALL.startFrom(today));
        assertNull(CashFlowPeriod.ALL.endFrom(today));
    }
}
