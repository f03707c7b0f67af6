package com.ptl.domain.policy;

import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.FirstLossCover;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes how first-loss covers share junior-bound profit, absorb loss (list order)
 * and take back recovery (reverse list order). Pure: results are committed by the caller.
 */
public class FirstLossCoverAllocator {

    public record ProfitAllocation(BigInteger juniorProfit, List<BigInteger> coverProfits) {
    }

    public record LossAllocation(List<BigInteger> coveredAmounts, BigInteger remainingLoss) {
    }

    public record RecoveryAllocation(List<BigInteger> recoveredAmounts, BigInteger remainingRecovery) {
    }

    /**
     * Each cover's share is floored independently, so rounding residue stays with junior.
     */
    public ProfitAllocation allocateProfit(BigInteger nonSeniorProfit, BigInteger juniorAssets,
                                           List<FirstLossCover> covers) {
        List<BigInteger> weights = new ArrayList<>(covers.size());
        BigInteger totalWeight = juniorAssets;
        for (FirstLossCover cover : covers) {
            BigInteger weight = cover.weight();
            weights.add(weight);
            totalWeight = totalWeight.add(weight);
        }

        List<BigInteger> shares = new ArrayList<>(covers.size());
        BigInteger juniorProfit = nonSeniorProfit;
        for (BigInteger weight : weights) {
            BigInteger share = totalWeight.signum() == 0
                    ? BigInteger.ZERO
                    : FixedPointMath.mulDiv(nonSeniorProfit, weight, totalWeight);
            shares.add(share);
            juniorProfit = juniorProfit.subtract(share);
        }
        return new ProfitAllocation(juniorProfit, Collections.unmodifiableList(shares));
    }

    public LossAllocation allocateLoss(BigInteger loss, List<FirstLossCover> covers) {
        List<BigInteger> covered = new ArrayList<>(covers.size());
        BigInteger remaining = loss;
        for (FirstLossCover cover : covers) {
            BigInteger amount = remaining.signum() == 0 ? BigInteger.ZERO : cover.calcLossCover(remaining);
            covered.add(amount);
            remaining = remaining.subtract(amount);
        }
        return new LossAllocation(Collections.unmodifiableList(covered), remaining);
    }

    public RecoveryAllocation allocateRecovery(BigInteger recovery, List<FirstLossCover> covers) {
        BigInteger[] recovered = new BigInteger[covers.size()];
        BigInteger remaining = recovery;
        for (int i = covers.size() - 1; i >= 0; i--) {
            BigInteger amount = remaining.signum() == 0 ? BigInteger.ZERO : covers.get(i).calcLossRecovery(remaining);
            recovered[i] = amount;
            remaining = remaining.subtract(amount);
        }
        return new RecoveryAllocation(List.of(recovered), remaining);
    }
}
