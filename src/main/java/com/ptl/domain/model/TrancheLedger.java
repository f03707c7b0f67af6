package com.ptl.domain.model;

import lombok.Getter;

import java.math.BigInteger;
import java.util.List;

/**
 * Shared tranche asset/loss ledger and the ordered first-loss-cover list.
 * Written only by the PnL distributor, the epoch manager and the deposit flow.
 * Not thread-safe: callers run on a single writer (the ledger verticle's context).
 */
@Getter
public class TrancheLedger {
    private TrancheAssets assets = TrancheAssets.ZERO;
    private TrancheLosses losses = TrancheLosses.ZERO;
    private final List<FirstLossCover> firstLossCovers;

    public TrancheLedger(List<FirstLossCover> firstLossCovers) {
        this.firstLossCovers = List.copyOf(firstLossCovers);
    }

    public void updateAssets(TrancheAssets newAssets) {
        this.assets = newAssets;
    }

    public void update(TrancheAssets newAssets, TrancheLosses newLosses) {
        this.assets = newAssets;
        this.losses = newLosses;
    }

    public FirstLossCover getFirstLossCover(int index) {
        return firstLossCovers.get(index);
    }

    /**
     * Unrecovered loss across tranches and covers; the upper bound of any recovery.
     */
    public BigInteger outstandingLoss() {
        BigInteger total = losses.total();
        for (FirstLossCover cover : firstLossCovers) {
            total = total.add(cover.getCoveredLoss());
        }
        return total;
    }
}
