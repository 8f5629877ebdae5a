package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;

/**
 * Consumed seconds to book. {@code recorded_at} accepts epoch seconds or ISO-8601
 * and is informational only.
 */
@Value
public class BookUsageRequest {

    @NotBlank(message = "user_key is required")
    @Size(max = 255, message = "user_key must be at most 255 characters")
    @JsonProperty("user_key")
    String userKey;

    @NotNull(message = "seconds is required")
    @Positive(message = "seconds must be a positive integer")
    @JsonProperty("seconds")
    Long seconds;

    @JsonProperty("plan")
    String plan;

    @JsonProperty("recorded_at")
    Instant recordedAt;
}
