package com.flagship.restaurant_ledger.common.exception;

import lombok.Getter;

/**
 * Business failure carrying a closed {@link ErrorCode}.
 * Thrown inside a transaction it rolls the whole operation back.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;
    private final transient Object details;

    public LedgerException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage(), null);
    }

    public LedgerException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public LedgerException(ErrorCode errorCode, String message, Object details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
    }

    public static LedgerException notFound(String what, Object id) {
        return new LedgerException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }
}
