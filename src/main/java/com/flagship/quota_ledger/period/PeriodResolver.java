package com.flagship.quota_ledger.period;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Computes billing periods from the server clock.
 *
 * The period is recomputed on every request and never held as process state,
 * so a request arriving just after midnight UTC on the first of the month
 * lands in the new period on every instance.
 */
@Component
public class PeriodResolver {

    private final Clock clock;

    public PeriodResolver(Clock clock) {
        this.clock = clock;
    }

    public PeriodKey currentPeriod() {
        return currentPeriod(clock.instant());
    }

    public PeriodKey currentPeriod(Instant now) {
        return PeriodKey.of(YearMonth.from(now.atZone(ZoneOffset.UTC)));
    }

    public PeriodKey previousPeriod(PeriodKey period) {
        return period.previous();
    }

    public Instant now() {
        return clock.instant();
    }
}
