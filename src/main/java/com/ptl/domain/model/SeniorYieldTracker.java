package com.ptl.domain.model;

import com.ptl.domain.math.FixedPointMath;
import lombok.Value;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Daily-accrued senior yield entitlement for the fixed senior yield policy.
 * unpaidYield grows only through accrual and shrinks only when profit pays it.
 */
@Value
public class SeniorYieldTracker {
    BigInteger totalAssets;
    BigInteger unpaidYield;
    LocalDate lastUpdatedDate;  // null until the first refresh

    public SeniorYieldTracker(BigInteger totalAssets, BigInteger unpaidYield, LocalDate lastUpdatedDate) {
        this.totalAssets = FixedPointMath.checked(totalAssets, "tracker.totalAssets");
        this.unpaidYield = FixedPointMath.checked(unpaidYield, "tracker.unpaidYield");
        this.lastUpdatedDate = lastUpdatedDate;
    }

    public static SeniorYieldTracker empty() {
        return new SeniorYieldTracker(BigInteger.ZERO, BigInteger.ZERO, null);
    }

    /**
     * Accrues yield on totalAssets for the whole days elapsed since the last update.
     */
    public SeniorYieldTracker accrue(LocalDate asOf, int fixedYieldBps) {
        if (lastUpdatedDate == null) {
            return new SeniorYieldTracker(totalAssets, unpaidYield, asOf);
        }
        if (!asOf.isAfter(lastUpdatedDate)) {
            return this;
        }
        long daysDiff = ChronoUnit.DAYS.between(lastUpdatedDate, asOf);
        BigInteger accrued = totalAssets
                .multiply(BigInteger.valueOf(fixedYieldBps))
                .multiply(BigInteger.valueOf(daysDiff))
                .divide(BigInteger.valueOf(FixedPointMath.DAYS_IN_A_YEAR).multiply(FixedPointMath.BPS_FACTOR));
        return new SeniorYieldTracker(totalAssets, unpaidYield.add(accrued), asOf);
    }

    public SeniorYieldTracker payYield(BigInteger paid) {
        return new SeniorYieldTracker(totalAssets, unpaidYield.subtract(paid), lastUpdatedDate);
    }

    public SeniorYieldTracker withTotalAssets(BigInteger newTotalAssets) {
        return new SeniorYieldTracker(newTotalAssets, unpaidYield, lastUpdatedDate);
    }
}
