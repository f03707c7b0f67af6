package com.ptl.application.service;

import com.ptl.application.port.in.PoolQueryUseCase;
import com.ptl.application.port.out.FeeCollector;
import com.ptl.application.port.out.LiquidityReserve;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.EpochCounter;
import com.ptl.domain.model.FirstLossCover;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.policy.TranchesPolicy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class PoolQueryService implements PoolQueryUseCase {

    private final TrancheLedger ledger;
    private final TranchesPolicy tranchesPolicy;
    private final LiquidityReserve reserve;
    private final FeeCollector feeCollector;
    private final Map<TrancheType, TrancheVaultService> vaults;
    private final EpochCounter epochCounter;

    public PoolQueryService(
            TrancheLedger ledger,
            TranchesPolicy tranchesPolicy,
            LiquidityReserve reserve,
            FeeCollector feeCollector,
            Map<TrancheType, TrancheVaultService> vaults,
            EpochCounter epochCounter
    ) {
        this.ledger = ledger;
        this.tranchesPolicy = tranchesPolicy;
        this.reserve = reserve;
        this.feeCollector = feeCollector;
        this.vaults = new EnumMap<>(vaults);
        this.epochCounter = epochCounter;
    }

    @Override
    public PoolSnapshot snapshot() {
        TrancheAssets assets = ledger.getAssets();

        Map<TrancheType, TrancheSnapshot> tranches = new EnumMap<>(TrancheType.class);
        for (Map.Entry<TrancheType, TrancheVaultService> entry : vaults.entrySet()) {
            TrancheVaultService vault = entry.getValue();
            tranches.put(entry.getKey(), new TrancheSnapshot(
                    vault.totalSupply(),
                    FixedPointMath.price(assets.get(entry.getKey()), vault.totalSupply()),
                    vault.unprocessedEpochs()));
        }

        List<CoverSnapshot> covers = new ArrayList<>();
        for (FirstLossCover cover : ledger.getFirstLossCovers()) {
            covers.add(new CoverSnapshot(cover.getName(), cover.getTotalAssets(), cover.getCoveredLoss(),
                    cover.getTotalShares(), cover.weight()));
        }

        return new PoolSnapshot(
                epochCounter.current(),
                assets,
                ledger.getLosses(),
                tranches,
                covers,
                tranchesPolicy.getSeniorYieldTracker().orElse(null),
                reserve.getAvailableReservation(),
                reserve.getRedemptionReservation(),
                feeCollector.getAccruedIncomes());
    }
}
