package com.flagship.quota_ledger.usage;

import lombok.Value;

/**
 * Outcome of a credit call. A replayed transaction id is a success with
 * {@code alreadyCredited} set and the balance as it currently stands.
 */
@Value
public class CreditResult {
    String transactionId;
    long secondsCredited;
    long newTopupBalance;
    boolean alreadyCredited;

    static CreditResult credited(String transactionId, long secondsCredited, long newTopupBalance) {
        return new CreditResult(transactionId, secondsCredited, newTopupBalance, false);
    }

    static CreditResult alreadyCredited(String transactionId, long secondsCredited, long currentTopupBalance) {
        return new CreditResult(transactionId, secondsCredited, currentTopupBalance, true);
    }
}
