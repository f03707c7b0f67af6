package com.ptl.domain.policy;

import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.SeniorYieldTracker;
import com.ptl.domain.model.TrancheAssets;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Senior earns a fixed yield accrued daily on its assets; junior takes whatever profit is left.
 * Carries the senior yield tracker, refreshed lazily at the start of each operation.
 */
@Slf4j
public class FixedSeniorYieldTranchesPolicy extends BaseTranchesPolicy {

    private final int fixedSeniorYieldBps;
    private SeniorYieldTracker tracker = SeniorYieldTracker.empty();

    public FixedSeniorYieldTranchesPolicy(int fixedSeniorYieldBps) {
        if (fixedSeniorYieldBps < 0) {
            throw new IllegalArgumentException("fixedSeniorYieldBps must be non-negative");
        }
        this.fixedSeniorYieldBps = fixedSeniorYieldBps;
    }

    public int getFixedSeniorYieldBps() {
        return fixedSeniorYieldBps;
    }

    @Override
    public ProfitSplit splitProfit(BigInteger profit, TrancheAssets assets, LocalDate asOf) {
        SeniorYieldTracker refreshed = tracker.accrue(asOf, fixedSeniorYieldBps);
        BigInteger seniorProfit = FixedPointMath.min(profit, refreshed.getUnpaidYield());
        return new ProfitSplit(seniorProfit, profit.subtract(seniorProfit));
    }

    @Override
    public void onProfitDistributed(ProfitSplit split, TrancheAssets newAssets, LocalDate asOf) {
        tracker = tracker.accrue(asOf, fixedSeniorYieldBps)
                .payYield(split.seniorProfit())
                .withTotalAssets(newAssets.getSeniorAssets());
        log.debug("Senior yield tracker after profit: {}", tracker);
    }

    @Override
    public void refreshYieldTracker(TrancheAssets assets, LocalDate asOf) {
        tracker = tracker.accrue(asOf, fixedSeniorYieldBps).withTotalAssets(assets.getSeniorAssets());
        log.debug("Senior yield tracker refreshed: {}", tracker);
    }

    @Override
    public Optional<SeniorYieldTracker> getSeniorYieldTracker() {
        return Optional.of(tracker);
    }
}
