package com.flagship.restaurant_ledger.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.restaurant_ledger.common.exception.ErrorCode;

/**
 * Response envelope shared by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult<T>(
        boolean success,
        ErrorCode errorCode,
        String message,
        T data,
        Object details
) {

    public static <T> OperationResult<T> ok(T data) {
        return new OperationResult<>(true, null, null, data, null);
    }

    public static <T> OperationResult<T> ok(T data, String message) {
        return new OperationResult<>(true, null, message, data, null);
    }

    public static <T> OperationResult<T> failure(ErrorCode errorCode, String message, Object details) {
        return new OperationResult<>(false, errorCode, message, null, details);
    }
}
