package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A verified top-up purchase to credit.
 */
@Value
public class CreditTopUpRequest {

    @NotBlank(message = "user_key is required")
    @Size(max = 255, message = "user_key must be at most 255 characters")
    @JsonProperty("user_key")
    String userKey;

    @NotNull(message = "seconds is required")
    @Positive(message = "seconds must be a positive integer")
    @JsonProperty("seconds")
    @JsonAlias("seconds_credited")
    Long seconds;

    @NotBlank(message = "transaction_id is required")
    @Size(max = 255, message = "transaction_id must be at most 255 characters")
    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("product_id")
    String productId;

    @DecimalMin(value = "0.00", message = "price_paid cannot be negative")
    @JsonProperty("price_paid")
    BigDecimal pricePaid;

    @Pattern(regexp = "^[A-Z]{3}$", message = "currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;
}
