package com.ptl.domain.policy;

import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RiskAdjustedTranchesPolicyTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    private final RiskAdjustedTranchesPolicy policy = new RiskAdjustedTranchesPolicy(2000);

    @Test
    void splitProfit_shouldMoveTheRiskAdjustmentToJunior() {
        ProfitSplit split = policy.splitProfit(BigInteger.valueOf(100), assets(800, 200), TODAY);

        assertEquals(BigInteger.valueOf(64), split.seniorProfit());
        assertEquals(BigInteger.valueOf(36), split.juniorProfit());
    }

    @Test
    void splitProfit_shouldGiveRoundingResidueToJunior() {
        ProfitSplit split = policy.splitProfit(BigInteger.valueOf(7), assets(1, 2), TODAY);

        // raw = 7 * 1 / 3 = 2, adjustment = 0
        assertEquals(BigInteger.TWO, split.seniorProfit());
        assertEquals(BigInteger.valueOf(5), split.juniorProfit());
    }

    @Test
    void splitProfit_shouldRejectAnEmptyPool() {
        assertThrows(PreconditionViolationException.class,
                () -> policy.splitProfit(BigInteger.TEN, TrancheAssets.ZERO, TODAY));
    }

    @Test
    void distributeLoss_shouldHitJuniorBeforeSenior() {
        LossDistribution distribution = policy.distributeLoss(BigInteger.valueOf(250), assets(800, 200));

        assertEquals(assets(750, 0), distribution.newAssets());
        assertEquals(new TrancheLosses(BigInteger.valueOf(50), BigInteger.valueOf(200)), distribution.lossDelta());

        LossDistribution juniorOnly = policy.distributeLoss(BigInteger.valueOf(150), assets(800, 200));
        assertEquals(assets(800, 50), juniorOnly.newAssets());
        assertEquals(BigInteger.ZERO, juniorOnly.lossDelta().getSeniorLoss());
    }

    @Test
    void distributeLoss_shouldRejectLossBeyondTotalAssets() {
        assertThrows(PreconditionViolationException.class,
                () -> policy.distributeLoss(BigInteger.valueOf(1001), assets(800, 200)));
    }

    @Test
    void distributeLossRecovery_shouldRepaySeniorFirstAndReturnTheLeftover() {
        TrancheLosses losses = new TrancheLosses(BigInteger.valueOf(50), BigInteger.valueOf(200));

        RecoveryDistribution partial = policy.distributeLossRecovery(BigInteger.valueOf(120), assets(750, 0), losses);
        assertEquals(assets(800, 70), partial.newAssets());
        assertEquals(new TrancheLosses(BigInteger.ZERO, BigInteger.valueOf(130)), partial.newLosses());
        assertEquals(BigInteger.ZERO, partial.remainingRecovery());

        RecoveryDistribution full = policy.distributeLossRecovery(BigInteger.valueOf(300), assets(750, 0), losses);
        assertEquals(assets(800, 200), full.newAssets());
        assertEquals(TrancheLosses.ZERO, full.newLosses());
        assertEquals(BigInteger.valueOf(50), full.remainingRecovery());
    }

    private static TrancheAssets assets(long senior, long junior) {
        return new TrancheAssets(BigInteger.valueOf(senior), BigInteger.valueOf(junior));
    }
}
