package com.flagship.quota_ledger.period;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class PeriodKeyTest {

    @Test
    @DisplayName("Renders as zero-padded YYYY-MM")
    void rendersYearAndMonth() {
        assertEquals("2025-02", PeriodKey.of(2025, 2).toString());
        assertEquals("2024-12", PeriodKey.of(YearMonth.of(2024, 12)).toString());
    }

    @Test
    @DisplayName("Parses its own rendering")
    void parsesRendering() {
        PeriodKey period = PeriodKey.parse("2025-11");

        assertEquals(PeriodKey.of(2025, 11), period);
        assertEquals(YearMonth.of(2025, 11), period.toYearMonth());
    }

    @Test
    @DisplayName("Rejects malformed period keys")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> PeriodKey.parse("2025-13"));
        assertThrows(IllegalArgumentException.class, () -> PeriodKey.parse("2025/01"));
        assertThrows(IllegalArgumentException.class, () -> PeriodKey.parse(null));
    }

    @Test
    @DisplayName("Previous of January is December of the year before")
    void previousCrossesYearBoundary() {
        assertEquals(PeriodKey.of(2024, 12), PeriodKey.of(2025, 1).previous());
        assertEquals(PeriodKey.of(2025, 1), PeriodKey.of(2025, 2).previous());
    }

    @Test
    @DisplayName("Orders chronologically")
    void ordersChronologically() {
        assertTrue(PeriodKey.of(2024, 12).compareTo(PeriodKey.of(2025, 1)) < 0);
        assertEquals(0, PeriodKey.of(2025, 1).compareTo(PeriodKey.parse("2025-01")));
    }
}
