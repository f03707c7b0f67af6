package com.ptl.domain.policy;

import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;

import java.math.BigInteger;

/**
 * Loss and recovery split shared by every policy variant.
 */
public abstract class BaseTranchesPolicy implements TranchesPolicy {

    @Override
    public final LossDistribution distributeLoss(BigInteger loss, TrancheAssets assets) {
        BigInteger juniorLoss = FixedPointMath.min(assets.getJuniorAssets(), loss);
        BigInteger seniorLoss = loss.subtract(juniorLoss);
        if (seniorLoss.compareTo(assets.getSeniorAssets()) > 0) {
            throw new PreconditionViolationException(
                    "Loss of " + loss + " exceeds the total tranche assets " + assets.total());
        }
        TrancheAssets newAssets = new TrancheAssets(
                assets.getSeniorAssets().subtract(seniorLoss),
                assets.getJuniorAssets().subtract(juniorLoss));
        return new LossDistribution(newAssets, new TrancheLosses(seniorLoss, juniorLoss));
    }

    @Override
    public final RecoveryDistribution distributeLossRecovery(BigInteger recovery, TrancheAssets assets,
                                                             TrancheLosses losses) {
        BigInteger seniorRecovery = FixedPointMath.min(recovery, losses.getSeniorLoss());
        BigInteger remaining = recovery.subtract(seniorRecovery);
        BigInteger juniorRecovery = FixedPointMath.min(remaining, losses.getJuniorLoss());
        remaining = remaining.subtract(juniorRecovery);

        TrancheAssets newAssets = new TrancheAssets(
                assets.getSeniorAssets().add(seniorRecovery),
                assets.getJuniorAssets().add(juniorRecovery));
        TrancheLosses newLosses = new TrancheLosses(
                losses.getSeniorLoss().subtract(seniorRecovery),
                losses.getJuniorLoss().subtract(juniorRecovery));
        return new RecoveryDistribution(remaining, newAssets, newLosses);
    }
}
