package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class FetchUsageRequest {

    @NotBlank(message = "user_key is required")
    @Size(max = 255, message = "user_key must be at most 255 characters")
    @JsonProperty("user_key")
    String userKey;

    @JsonProperty("plan")
    String plan;
}
