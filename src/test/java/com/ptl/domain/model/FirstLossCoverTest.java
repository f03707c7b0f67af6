package com.ptl.domain.model;

import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FirstLossCoverTest {

    static FirstLossCover cover(String name, int rateBps, long cap, int multiplierBps, long min, long max) {
        return new FirstLossCover(name, FirstLossCoverConfig.builder()
                .coverRatePerLossBps(rateBps)
                .coverCapPerLoss(BigInteger.valueOf(cap))
                .riskYieldMultiplierBps(multiplierBps)
                .minLiquidity(BigInteger.valueOf(min))
                .maxLiquidity(BigInteger.valueOf(max))
                .build());
    }

    @Test
    void calcLossCover_shouldBeBoundedByRateCapAndAssets() {
        FirstLossCover cover = cover("borrower", 5000, 30, 0, 0, 0);
        cover.deposit("p1", BigInteger.valueOf(100));

        assertEquals(BigInteger.valueOf(20), cover.calcLossCover(BigInteger.valueOf(40)));
        assertEquals(BigInteger.valueOf(30), cover.calcLossCover(BigInteger.valueOf(400)));

        FirstLossCover small = cover("small", 10000, 1000, 0, 0, 0);
        small.deposit("p1", BigInteger.valueOf(25));
        assertEquals(BigInteger.valueOf(25), small.calcLossCover(BigInteger.valueOf(400)));
    }

    @Test
    void lossAndRecovery_shouldTrackCoveredLoss() {
        FirstLossCover cover = cover("borrower", 10000, 1000, 0, 0, 0);
        cover.deposit("p1", BigInteger.valueOf(100));

        cover.applyLossCover(BigInteger.valueOf(60));
        assertEquals(BigInteger.valueOf(40), cover.getTotalAssets());
        assertEquals(BigInteger.valueOf(60), cover.getCoveredLoss());
        assertEquals(BigInteger.valueOf(60), cover.calcLossRecovery(BigInteger.valueOf(500)));

        cover.applyLossRecovery(BigInteger.valueOf(25));
        assertEquals(BigInteger.valueOf(65), cover.getTotalAssets());
        assertEquals(BigInteger.valueOf(35), cover.getCoveredLoss());
    }

    @Test
    void depositAndRedeem_shouldPriceSharesOnCoverAssets() {
        FirstLossCover cover = cover("affiliate", 10000, 1000, 15000, 0, 0);
        assertEquals(BigInteger.valueOf(100), cover.deposit("p1", BigInteger.valueOf(100)));

        cover.applyProfit(BigInteger.valueOf(100));
        assertEquals(BigInteger.valueOf(50), cover.deposit("p2", BigInteger.valueOf(100)));
        assertEquals(BigInteger.valueOf(450), cover.weight());

        assertEquals(BigInteger.valueOf(200), cover.redeem("p1", BigInteger.valueOf(100)));
        assertEquals(BigInteger.ZERO, cover.sharesOf("p1"));
        assertEquals(BigInteger.valueOf(100), cover.getTotalAssets());
    }

    @Test
    void liquidityLimits_shouldBeEnforced() {
        FirstLossCover cover = cover("capped", 10000, 1000, 0, 40, 100);
        cover.deposit("p1", BigInteger.valueOf(80));

        assertThrows(ConstraintBlockedException.class, () -> cover.deposit("p2", BigInteger.valueOf(21)));
        assertThrows(PreconditionViolationException.class, () -> cover.redeem("p1", BigInteger.valueOf(41)));
        assertThrows(PreconditionViolationException.class, () -> cover.redeem("p2", BigInteger.ONE));
        assertEquals(BigInteger.valueOf(40), cover.redeem("p1", BigInteger.valueOf(40)));
    }
}
