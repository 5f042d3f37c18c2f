package com.flagship.restaurant_ledger.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds returned by back-office operations.
 * The HTTP status is only consulted by {@link GlobalExceptionHandler}.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Validation
    INVALID_VALUE(HttpStatus.BAD_REQUEST, "Value must be greater than zero"),
    INVALID_TYPE(HttpStatus.BAD_REQUEST, "Invalid movement type"),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "Invalid payment status"),
    INVALID_DATE(HttpStatus.BAD_REQUEST, "Invalid date format"),
    INVALID_DESCRIPTION(HttpStatus.BAD_REQUEST, "Description is required"),
    INVALID_PERIOD(HttpStatus.BAD_REQUEST, "Invalid period"),
    INVALID_ITEM(HttpStatus.BAD_REQUEST, "Invalid invoice item"),
    INVALID_ITEMS(HttpStatus.BAD_REQUEST, "Invoice must contain at least one item"),
    INVALID_INVOICE_NUMBER(HttpStatus.BAD_REQUEST, "Invoice number is required"),
    INVALID_SUPPLIER_NAME(HttpStatus.BAD_REQUEST, "Supplier name is required"),
    INVALID_UNIT_PRICE(HttpStatus.BAD_REQUEST, "Unit price must be greater than zero"),
    INVALID_TOTAL_PRICE(HttpStatus.BAD_REQUEST, "Total price must be greater than zero"),
    INVALID_NAME(HttpStatus.BAD_REQUEST, "Name is required"),
    INVALID_RECURRENCE_TYPE(HttpStatus.BAD_REQUEST, "Invalid recurrence type"),
    INVALID_RECURRENCE_DAY(HttpStatus.BAD_REQUEST, "Invalid recurrence day"),

    // Stock
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Ingredient not found"),
    STOCK_UPDATE_ERROR(HttpStatus.CONFLICT, "Stock could not be updated"),
    STOCK_REVERSAL_ERROR(HttpStatus.CONFLICT, "Stock could not be reversed"),
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock to reverse the invoice"),

    // Access and state
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "Permission denied"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    NO_UPDATES(HttpStatus.BAD_REQUEST, "No fields to update"),
    SYNC_ERROR(HttpStatus.CONFLICT, "Linked record could not be synchronized"),

    // Infrastructure
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "A database error occurred"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");

    private final HttpStatus status;
    private final String defaultMessage;
}
