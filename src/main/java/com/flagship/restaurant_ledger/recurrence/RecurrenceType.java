package com.flagship.restaurant_ledger.recurrence;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;

import java.util.Locale;

/**
 * How often a rule falls due, and what its recurrence day means: day of
 * month, ISO day of week (1 = Monday) or day of year.
 */
public enum RecurrenceType {
    MONTHLY(1, 31),
    WEEKLY(1, 7),
    YEARLY(1, 365);

    private final int minDay;
    private final int maxDay;

    RecurrenceType(int minDay, int maxDay) {
        this.minDay = minDay;
        this.maxDay = maxDay;
    }

    public boolean isValidDay(Integer day) {
        return day != null && day >= minDay && day <= maxDay;
    }

    public static RecurrenceType parse(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (RecurrenceType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new LedgerException(ErrorCode.INVALID_RECURRENCE_TYPE,
                "Invalid recurrence type: " + value + ". Expected MONTHLY, WEEKLY or YEARLY");
    }

    public void requireValidDay(Integer day) {
        if (!isValidDay(day)) {
            throw new LedgerException(ErrorCode.INVALID_RECURRENCE_DAY,
                    "Recurrence day for " + name() + " must be between " + minDay + " and " + maxDay + ": " + day);
        }
    }
}
