package com.flagship.quota_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A credited top-up purchase.
 *
 * Created once per transaction id and never changed afterwards.
 * Price and currency are kept for audit only and play no part in quota math.
 */
@Value
public class PurchaseEntry {
    String transactionId;
    String userKey;
    long secondsCredited;
    String productId;
    BigDecimal pricePaid;
    String currency;
    Instant creditedAt;
}
