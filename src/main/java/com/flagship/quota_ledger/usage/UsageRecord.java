package com.flagship.quota_ledger.usage;

import com.flagship.quota_ledger.period.PeriodKey;
import com.flagship.quota_ledger.plan.Plan;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Usage aggregate of one user in one billing period.
 *
 * Invariants:
 * - secondsUsed and topupBalanceSeconds are never negative
 * - a booking never pushes secondsUsed past subscriptionLimitSeconds
 * - totalAvailable() is never negative, even after a plan downgrade
 */
@Value
@With
public class UsageRecord {
    String userKey;
    PeriodKey period;
    String plan;
    long subscriptionLimitSeconds;
    long secondsUsed;
    long topupBalanceSeconds;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A fresh record for a period: nothing used, allowance from the plan,
     * top-up balance carried over from the previous period.
     */
    public static UsageRecord open(String userKey, PeriodKey period, Plan plan,
                                   long carriedTopupSeconds, Instant now) {
        if (carriedTopupSeconds < 0) {
            throw new IllegalArgumentException("Carried top-up balance cannot be negative");
        }
        return new UsageRecord(userKey, period, plan.getId(), plan.getMonthlyAllowanceSeconds(),
            0, carriedTopupSeconds, 0, now, now);
    }

    /**
     * Allowance still unused this period. Zero when a downgrade left usage above the limit.
     */
    public long subscriptionRemainingSeconds() {
        return Math.max(0, subscriptionLimitSeconds - secondsUsed);
    }

    public long totalAvailableSeconds() {
        return subscriptionRemainingSeconds() + topupBalanceSeconds;
    }

    /**
     * Combined ceiling shown to clients as {@code limit_seconds}.
     */
    public long totalLimitSeconds() {
        return subscriptionLimitSeconds + topupBalanceSeconds;
    }

    public boolean canAbsorb(long seconds) {
        return seconds <= totalAvailableSeconds();
    }

    /**
     * Applies a booking: the top-up balance is drawn first, the remainder
     * is charged against the subscription allowance.
     *
     * @throws IllegalArgumentException if seconds is not positive
     * @throws IllegalStateException if the record cannot absorb the booking
     */
    public UsageRecord deduct(long seconds, Instant now) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Seconds to book must be positive");
        }
        if (!canAbsorb(seconds)) {
            throw new IllegalStateException(String.format(
                "Cannot book %ds against %ds available", seconds, totalAvailableSeconds()));
        }
        long fromTopup = Math.min(seconds, topupBalanceSeconds);
        long fromSubscription = seconds - fromTopup;
        return new UsageRecord(userKey, period, plan, subscriptionLimitSeconds,
            secondsUsed + fromSubscription, topupBalanceSeconds - fromTopup,
            version + 1, createdAt, now);
    }
}
