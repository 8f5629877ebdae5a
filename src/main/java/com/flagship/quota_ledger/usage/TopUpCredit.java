package com.flagship.quota_ledger.usage;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A purchased top-up to apply, as verified upstream by the purchase platform.
 */
@Value
@Builder
public class TopUpCredit {
    String userKey;
    long seconds;
    String transactionId;
    String productId;
    BigDecimal pricePaid;
    String currency;
}
