package com.flagship.quota_ledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Typed rejection reasons returned to callers in the {@code error} field.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    INVALID_REQUEST("invalid_request", HttpStatus.BAD_REQUEST),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    QUOTA_EXCEEDED("quota_exceeded", HttpStatus.PAYMENT_REQUIRED),
    STORE_UNAVAILABLE("store_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;
}
