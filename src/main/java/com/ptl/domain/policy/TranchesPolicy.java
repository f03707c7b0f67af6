package com.ptl.domain.policy;

import com.ptl.domain.model.SeniorYieldTracker;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Splits profit, loss and loss recovery between the senior and junior tranches.
 * One variant is selected per pool; variants are never mixed at runtime.
 */
public interface TranchesPolicy {

    /**
     * Pure split of a profit amount. Must not change policy state.
     * @param profit Pool profit after fees
     * @param assets Tranche assets before the profit
     * @param asOf Business date used for any time-based accrual
     */
    ProfitSplit splitProfit(BigInteger profit, TrancheAssets assets, LocalDate asOf);

    /**
     * Commits policy state after a split returned by {@link #splitProfit} was applied.
     */
    default void onProfitDistributed(ProfitSplit split, TrancheAssets newAssets, LocalDate asOf) {
    }

    /**
     * Resyncs policy state after tranche assets changed outside profit distribution.
     */
    default void refreshYieldTracker(TrancheAssets assets, LocalDate asOf) {
    }

    default Optional<SeniorYieldTracker> getSeniorYieldTracker() {
        return Optional.empty();
    }

    /**
     * Junior absorbs first; any remainder hits senior.
     */
    LossDistribution distributeLoss(BigInteger loss, TrancheAssets assets);

    /**
     * Senior recovers first up to its loss, then junior; the leftover is returned.
     */
    RecoveryDistribution distributeLossRecovery(BigInteger recovery, TrancheAssets assets, TrancheLosses losses);
}
