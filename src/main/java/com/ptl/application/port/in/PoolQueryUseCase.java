package com.ptl.application.port.in;

import com.ptl.application.port.out.FeeCollector.AccruedIncomes;
import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.SeniorYieldTracker;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLosses;
import com.ptl.domain.model.TrancheType;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Input port for reading the pool's ledger state.
 */
public interface PoolQueryUseCase {

    PoolSnapshot snapshot();

    record PoolSnapshot(
            long currentEpochId,
            TrancheAssets assets,
            TrancheLosses losses,
            Map<TrancheType, TrancheSnapshot> tranches,
            List<CoverSnapshot> firstLossCovers,
            SeniorYieldTracker seniorYieldTracker,
            BigInteger availableLiquidity,
            BigInteger redemptionReservation,
            AccruedIncomes accruedIncomes
    ) {}

    record TrancheSnapshot(
            BigInteger totalSupply,
            BigInteger price,
            List<EpochInfo> unprocessedEpochs
    ) {}

    record CoverSnapshot(
            String name,
            BigInteger totalAssets,
            BigInteger coveredLoss,
            BigInteger totalShares,
            BigInteger weight
    ) {}
}
