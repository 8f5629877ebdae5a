package com.flagship.quota_ledger.usage.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.quota_ledger.usage.UsageRecord;
import lombok.Builder;
import lombok.Value;

/**
 * Current quota of a user as shown to the client.
 */
@Value
@Builder
public class UsageResponse {

    @JsonProperty("plan")
    String plan;

    @JsonProperty("period")
    String period;

    @JsonProperty("seconds_used")
    long secondsUsed;

    @JsonProperty("subscription_limit_seconds")
    long subscriptionLimitSeconds;

    @JsonProperty("topup_balance_seconds")
    long topupBalanceSeconds;

    @JsonProperty("limit_seconds")
    long limitSeconds;

    @JsonProperty("remaining_seconds")
    long remainingSeconds;

    public static UsageResponse from(UsageRecord record) {
        return UsageResponse.builder()
            .plan(record.getPlan())
            .period(record.getPeriod().toString())
            .secondsUsed(record.getSecondsUsed())
            .subscriptionLimitSeconds(record.getSubscriptionLimitSeconds())
            .topupBalanceSeconds(record.getTopupBalanceSeconds())
            .limitSeconds(record.totalLimitSeconds())
            .remainingSeconds(record.totalAvailableSeconds())
            .build();
    }
}
