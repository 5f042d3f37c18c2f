package com.flagship.restaurant_ledger.ledger;

import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;

import java.util.Locale;

/**
 * Kind of money movement. The direction of cash is implied by the type:
 * REVENUE is inflow, the others are outflow.
 */
public enum MovementType {
    REVENUE,
    EXPENSE,
    CMV,
    TAX;

    public static MovementType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_TYPE, "Movement type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerException(ErrorCode.INVALID_TYPE,
                    "Invalid movement type: " + value + ". Expected REVENUE, EXPENSE, CMV or TAX");
        }
    }
}
