package com.flagship.restaurant_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reporting windows for the cash-flow summary. Ranges are half-open
 * {@code [start, end)}; a null bound is unbounded.
 */
public enum CashFlowPeriod {
    THIS_MONTH("this_month"),
    LAST_MONTH("last_month"),
    LAST_30_DAYS("last_30_days"),
    ALL("all");

    private final String value;

    CashFlowPeriod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CashFlowPeriod parse(String value) {
        if (value == null || value.isBlank()) {
            return THIS_MONTH;
        }
        for (CashFlowPeriod period : values()) {
            if (period.value.equalsIgnoreCase(value.trim())) {
                return period;
            }
        }
        throw new LedgerException(ErrorCode.INVALID_PERIOD,
                "Invalid period: " + value + ". Expected this_month, last_month, last_30_days or all");
    }

    public LocalDateTime startFrom(LocalDate today) {
        switch (this) {
            case THIS_MONTH:
                return today.withDayOfMonth(1).atStartOfDay();
            case LAST_MONTH:
                return today.withDayOfMonth(1).minusMonths(1).atStartOfDay();
            case LAST_30_DAYS:
                return today.minusDays(30).atStartOfDay();
            default:
                return null;
        }
    }

    public LocalDateTime endFrom(LocalDate today) {
        switch (this) {
            case THIS_MONTH:
                return today.withDayOfMonth(1).plusMonths(1).atStartOfDay();
            case LAST_MONTH:
                return today.withDayOfMonth(1).atStartOfDay();
            default:
                return null;
        }
    }
}
