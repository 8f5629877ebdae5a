package com.flagship.quota_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.quota_ledger.purchase.PurchaseEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One credited purchase in the audit history.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PurchaseResponse {

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("seconds_credited")
    long secondsCredited;

    @JsonProperty("product_id")
    String productId;

    @JsonProperty("price_paid")
    BigDecimal pricePaid;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("credited_at")
    Instant creditedAt;

    public static PurchaseResponse from(PurchaseEntry entry) {
        return PurchaseResponse.builder()
            .transactionId(entry.getTransactionId())
            .secondsCredited(entry.getSecondsCredited())
            .productId(entry.getProductId())
            .pricePaid(entry.getPricePaid())
            .currency(entry.getCurrency())
            .creditedAt(entry.getCreditedAt())
            .build();
    }
}
