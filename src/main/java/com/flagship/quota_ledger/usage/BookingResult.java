package com.flagship.quota_ledger.usage;

import com.flagship.quota_ledger.period.PeriodKey;
import lombok.Value;

/**
 * Outcome of a committed booking.
 */
@Value
public class BookingResult {
    PeriodKey period;
    long secondsBooked;
    long secondsUsed;
    long topupUsed;
    long subscriptionUsed;
    long topupBalanceSeconds;
    long remainingSeconds;

    static BookingResult of(UsageRecord before, UsageRecord after, long secondsBooked) {
        return new BookingResult(
            after.getPeriod(),
            secondsBooked,
            after.getSecondsUsed(),
            before.getTopupBalanceSeconds() - after.getTopupBalanceSeconds(),
            after.getSecondsUsed() - before.getSecondsUsed(),
            after.getTopupBalanceSeconds(),
            after.totalAvailableSeconds()
        );
    }
}
