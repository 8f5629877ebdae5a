package com.flagship.quota_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger and framework exceptions to typed {@link ApiError} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ApiError> handleQuotaExceeded(QuotaExceededException e) {
        log.info("Booking rejected: {}", e.getMessage());
        return toResponse(e);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable: {}", e.getMessage(), e);
        return toResponse(e);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        log.warn("Request rejected ({}): {}", e.getKind().getCode(), e.getMessage());
        return toResponse(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        log.warn("Validation failed: {}", errors);

        ApiError error = ApiError.builder()
            .error(ErrorKind.INVALID_REQUEST.getCode())
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(ErrorKind.INVALID_REQUEST.getStatus()).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(ErrorKind.INVALID_REQUEST.getStatus())
            .body(ApiError.of(ErrorKind.INVALID_REQUEST, "Request body is missing or malformed"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return ResponseEntity.status(ErrorKind.INVALID_REQUEST.getStatus())
            .body(ApiError.of(ErrorKind.INVALID_REQUEST,
                "Required parameter '" + e.getParameterName() + "' is missing"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException e) {
        log.error("Persistence failure", e);
        return ResponseEntity.status(ErrorKind.STORE_UNAVAILABLE.getStatus())
            .body(ApiError.of(ErrorKind.STORE_UNAVAILABLE, "Usage store is unavailable, the operation was not applied"));
    }

    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ApiError> handleTransactionFailure(TransactionException e) {
        log.error("Transaction could not be opened or completed", e);
        return ResponseEntity.status(ErrorKind.STORE_UNAVAILABLE.getStatus())
            .body(ApiError.of(ErrorKind.STORE_UNAVAILABLE, "Usage store is unavailable, the operation was not applied"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(ErrorKind.INTERNAL_ERROR.getStatus())
            .body(ApiError.of(ErrorKind.INTERNAL_ERROR, "An unexpected error occurred"));
    }

    private ResponseEntity<ApiError> toResponse(LedgerException e) {
        ApiError error = ApiError.builder()
            .error(e.getKind().getCode())
            .message(e.getMessage())
            .details(e.getDetails())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(e.getKind().getStatus()).body(error);
    }
}
