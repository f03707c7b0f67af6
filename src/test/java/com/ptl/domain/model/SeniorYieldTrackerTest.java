package com.ptl.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SeniorYieldTrackerTest {

    private static final LocalDate START = LocalDate.of(2026, 1, 1);

    @Test
    void accrue_shouldOnlyStampTheDateOnFirstRefresh() {
        SeniorYieldTracker tracker = SeniorYieldTracker.empty()
                .withTotalAssets(BigInteger.valueOf(3600))
                .accrue(START, 1000);

        assertEquals(START, tracker.getLastUpdatedDate());
        assertEquals(BigInteger.ZERO, tracker.getUnpaidYield());
    }

    @Test
    void accrue_shouldAddDailyYieldOnA360DayYear() {
        SeniorYieldTracker tracker = new SeniorYieldTracker(BigInteger.valueOf(3600), BigInteger.ZERO, START);

        // 3600 * 10% * 10 / 360
        SeniorYieldTracker accrued = tracker.accrue(START.plusDays(10), 1000);
        assertEquals(BigInteger.TEN, accrued.getUnpaidYield());
        assertEquals(START.plusDays(10), accrued.getLastUpdatedDate());

        // Same day again accrues nothing
        assertSame(accrued, accrued.accrue(START.plusDays(10), 1000));
    }

    @Test
    void payYield_shouldReduceUnpaidYield() {
        SeniorYieldTracker tracker = new SeniorYieldTracker(BigInteger.valueOf(3600), BigInteger.TEN, START);
        assertEquals(BigInteger.valueOf(4), tracker.payYield(BigInteger.valueOf(6)).getUnpaidYield());
    }
}
