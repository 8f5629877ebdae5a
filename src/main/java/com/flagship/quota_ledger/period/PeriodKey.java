package com.flagship.quota_ledger.period;

import lombok.EqualsAndHashCode;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A calendar-month billing period, rendered as {@code YYYY-MM}.
 */
@EqualsAndHashCode
public final class PeriodKey implements Comparable<PeriodKey> {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");

    private final YearMonth yearMonth;

    private PeriodKey(YearMonth yearMonth) {
        this.yearMonth = Objects.requireNonNull(yearMonth, "yearMonth");
    }

    public static PeriodKey of(YearMonth yearMonth) {
        return new PeriodKey(yearMonth);
    }

    public static PeriodKey of(int year, int month) {
        return new PeriodKey(YearMonth.of(year, month));
    }

    /**
     * @throws IllegalArgumentException if the value is not {@code YYYY-MM}
     */
    public static PeriodKey parse(String value) {
        try {
            return new PeriodKey(YearMonth.parse(value, FORMAT));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid period key: " + value, e);
        }
    }

    public PeriodKey previous() {
        return new PeriodKey(yearMonth.minusMonths(1));
    }

    public YearMonth toYearMonth() {
        return yearMonth;
    }

    @Override
    public int compareTo(PeriodKey other) {
        return yearMonth.compareTo(other.yearMonth);
    }

    @Override
    public String toString() {
        return yearMonth.format(FORMAT);
    }
}
