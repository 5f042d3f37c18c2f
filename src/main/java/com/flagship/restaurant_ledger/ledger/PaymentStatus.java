package com.flagship.restaurant_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;
import com.flagship.restaurant_ledger.common.exception.LedgerException;

/**
 * Payment state shared by movements and purchase invoices.
 * A PAID record always carries the date it was paid.
 */
public enum PaymentStatus {
    PENDING("Pending"),
    PAID("Paid");

    private final String label;

    PaymentStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PaymentStatus parse(String value) {
        if (value != null) {
            for (PaymentStatus status : values()) {
                if (status.label.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new LedgerException(ErrorCode.INVALID_STATUS,
                "Invalid payment status: " + value + ". Expected Pending or Paid");
    }

    /**
     * Parses an optional status, falling back to PENDING when absent.
     */
    public static PaymentStatus parseOrPending(String value) {
        return value == null || value.isBlank() ? PENDING : parse(value);
    }
}
