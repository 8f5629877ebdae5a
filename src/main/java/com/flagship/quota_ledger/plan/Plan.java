package com.flagship.quota_ledger.plan;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Subscription plans and their monthly allowance in seconds.
 */
@Getter
@RequiredArgsConstructor
public enum Plan {
    FREE("free", 1_800),          // 30 minutes
    STANDARD("standard", 7_200),  // 120 minutes
    PREMIUM("premium", 36_000),   // 600 minutes
    OWN_KEY("own_key", 600_000);  // 10,000 minutes

    private final String id;
    private final long monthlyAllowanceSeconds;
}
