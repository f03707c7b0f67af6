package com.ptl.application.port.in;

import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.TrancheType;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Input port for closing redemption epochs.
 */
public interface EpochSettlementUseCase {

    /**
     * Prices both tranches, fills pending redemption epochs from the available liquidity
     * and advances the epoch counter.
     * @throws com.ptl.domain.exception.ConstraintBlockedException if demand is pending but no liquidity is available
     */
    EpochCloseResult closeEpoch();

    long currentEpochId();

    List<EpochInfo> unprocessedEpochs(TrancheType tranche);

    record EpochCloseResult(
            long closedEpochId,
            long nextEpochId,
            Map<TrancheType, TrancheCloseSummary> tranches,
            BigInteger unmetDemand
    ) {}

    record TrancheCloseSummary(
            BigInteger price,
            int epochsTouched,
            BigInteger sharesProcessed,
            BigInteger amountProcessed
    ) {}
}
