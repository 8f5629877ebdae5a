package com.flagship.quota_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body shared by every rejection path, including the authentication filter.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;

    public static ApiError of(ErrorKind kind, String message) {
        return ApiError.builder()
            .error(kind.getCode())
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
