package com.flagship.restaurant_ledger.common.exception;

import com.flagship.restaurant_ledger.common.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to the {@link OperationResult} envelope.
 *
 * This is the only place where an {@link ErrorCode} becomes an HTTP status.
 * Database and unexpected failures are logged in full and returned with a
 * generic message.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<OperationResult<Void>> handleLedgerException(LedgerException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("Operation failed: code={}, message={}", code, e.getMessage(), e);
            return respond(code, code.getDefaultMessage(), null);
        }
        log.warn("Operation rejected: code={}, message={}", code, e.getMessage());
        return respond(code, e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<OperationResult<Void>> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(ErrorCode.PERMISSION_DENIED,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    /**
     * Request body constraints carry the name of their {@link ErrorCode} as the
     * message. The first failing field decides the code; every failing field is
     * listed in the details.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<OperationResult<Void>> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), toErrorCode(error).getDefaultMessage());
        }
        FieldError first = e.getBindingResult().getFieldError();
        ErrorCode code = first == null ? ErrorCode.INVALID_VALUE : toErrorCode(first);
        log.warn("Request body rejected: code={}, fields={}", code, fields.keySet());
        return respond(code, first == null ? code.getDefaultMessage() : fields.get(first.getField()), fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<OperationResult<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(OperationResult.failure(ErrorCode.INVALID_VALUE, "Malformed request body", null));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<OperationResult<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(OperationResult.failure(ErrorCode.INVALID_VALUE,
                        "Invalid value for parameter '" + e.getName() + "'", null));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<OperationResult<Void>> handleDataAccess(DataAccessException e) {
        log.error("Database error", e);
        return respond(ErrorCode.DATABASE_ERROR, ErrorCode.DATABASE_ERROR.getDefaultMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OperationResult<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getDefaultMessage(), null);
    }

    private ResponseEntity<OperationResult<Void>> respond(ErrorCode code, String message, Object details) {
        return ResponseEntity.status(code.getStatus())
                .body(OperationResult.failure(code, message, details));
    }

    private static ErrorCode toErrorCode(FieldError error) {
        String name = error.getDefaultMessage();
        if (name != null) {
            for (ErrorCode code : ErrorCode.values()) {
                if (code.name().equals(name)) {
                    return code;
                }
            }
        }
        return ErrorCode.INVALID_VALUE;
    }
}
