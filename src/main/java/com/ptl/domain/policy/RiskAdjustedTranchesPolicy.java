package com.ptl.domain.policy;

import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.TrancheAssets;

import java.math.BigInteger;
import java.time.LocalDate;

/**
 * Senior gets its asset-proportional share of profit minus a risk adjustment that moves to junior.
 * Stateless.
 */
public class RiskAdjustedTranchesPolicy extends BaseTranchesPolicy {

    private final int riskAdjustmentBps;

    public RiskAdjustedTranchesPolicy(int riskAdjustmentBps) {
        if (riskAdjustmentBps < 0 || riskAdjustmentBps > 10_000) {
            throw new IllegalArgumentException("riskAdjustmentBps must be within 0-10000");
        }
        this.riskAdjustmentBps = riskAdjustmentBps;
    }

    public int getRiskAdjustmentBps() {
        return riskAdjustmentBps;
    }

    @Override
    public ProfitSplit splitProfit(BigInteger profit, TrancheAssets assets, LocalDate asOf) {
        BigInteger totalAssets = assets.total();
        if (totalAssets.signum() == 0) {
            throw new PreconditionViolationException("Cannot split profit while the pool holds no tranche assets");
        }
        BigInteger raw = FixedPointMath.mulDiv(profit, assets.getSeniorAssets(), totalAssets);
        BigInteger seniorProfit = raw.subtract(FixedPointMath.applyBps(raw, riskAdjustmentBps));
        return new ProfitSplit(seniorProfit, profit.subtract(seniorProfit));
    }
}
