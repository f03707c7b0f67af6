package com.ptl.config;

import com.ptl.adapter.out.fee.PoolFeeManager;
import com.ptl.adapter.out.memory.InMemoryPoolSafe;
import com.ptl.adapter.out.memory.InMemoryTrancheShareLedger;
import com.ptl.adapter.out.memory.InMemoryUnderlyingToken;
import com.ptl.application.port.in.EpochSettlementUseCase;
import com.ptl.application.port.in.FirstLossCoverUseCase;
import com.ptl.application.port.in.PnlDistributionUseCase;
import com.ptl.application.port.in.PoolQueryUseCase;
import com.ptl.application.port.in.RedemptionUseCase;
import com.ptl.application.port.in.TrancheDepositUseCase;
import com.ptl.application.service.EpochManager;
import com.ptl.application.service.FirstLossCoverService;
import com.ptl.application.service.LenderService;
import com.ptl.application.service.PnlDistributor;
import com.ptl.application.service.PoolQueryService;
import com.ptl.application.service.TrancheVaultService;
import com.ptl.domain.model.EpochCounter;
import com.ptl.domain.model.FirstLossCover;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.policy.FirstLossCoverAllocator;
import com.ptl.domain.policy.FixedSeniorYieldTranchesPolicy;
import com.ptl.domain.policy.RiskAdjustedTranchesPolicy;
import com.ptl.domain.policy.TranchesPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires one pool: in-memory collaborators, the shared ledger and the use cases on top.
 */
@Slf4j
@Getter
public class PoolAssembly {

    private final InMemoryUnderlyingToken token;
    private final InMemoryPoolSafe poolSafe;
    private final PoolFeeManager feeManager;
    private final TrancheLedger trancheLedger;
    private final TranchesPolicy tranchesPolicy;
    private final EpochCounter epochCounter;
    private final Map<TrancheType, TrancheVaultService> vaults;

    private final PnlDistributionUseCase pnlDistributionUseCase;
    private final EpochSettlementUseCase epochSettlementUseCase;
    private final LenderService lenderService;
    private final FirstLossCoverUseCase firstLossCoverUseCase;
    private final PoolQueryUseCase poolQueryUseCase;

    public PoolAssembly(PoolConfig config, Clock clock) {
        PoolConfig.PoolSettings pool = config.pool();

        // Output adapters
        token = new InMemoryUnderlyingToken();
        config.openingBalances().forEach(token::mint);
        poolSafe = new InMemoryPoolSafe(token);
        feeManager = new PoolFeeManager(config.fees().protocolFeeBps(),
                config.fees().poolOwnerRewardBps(), config.fees().eaRewardBps());

        // Domain state
        List<FirstLossCover> covers = new ArrayList<>();
        for (PoolConfig.CoverSettings cover : config.firstLossCovers()) {
            covers.add(new FirstLossCover(cover.name(), cover.toCoverConfig()));
        }
        trancheLedger = new TrancheLedger(covers);
        tranchesPolicy = createPolicy(pool);
        epochCounter = new EpochCounter();

        Map<TrancheType, TrancheVaultService> vaultMap = new EnumMap<>(TrancheType.class);
        for (TrancheType tranche : TrancheType.values()) {
            vaultMap.put(tranche, new TrancheVaultService(tranche, new InMemoryTrancheShareLedger(tranche),
                    token, poolSafe, epochCounter));
        }
        vaults = Collections.unmodifiableMap(vaultMap);

        // Application services (use cases)
        pnlDistributionUseCase = new PnlDistributor(trancheLedger, tranchesPolicy,
                new FirstLossCoverAllocator(), feeManager, clock);
        epochSettlementUseCase = new EpochManager(trancheLedger, tranchesPolicy, poolSafe, vaults, epochCounter,
                pool.maxSeniorJuniorRatioBps(), pool.flexWindowEpochs(), clock);
        lenderService = new LenderService(trancheLedger, tranchesPolicy, poolSafe, vaults,
                new LenderService.DepositLimits(pool.minDepositAmount(), pool.liquidityCap(),
                        pool.maxSeniorJuniorRatioBps()),
                clock);
        firstLossCoverUseCase = new FirstLossCoverService(trancheLedger, token);
        poolQueryUseCase = new PoolQueryService(trancheLedger, tranchesPolicy, poolSafe, feeManager, vaults,
                epochCounter);

        log.info("Pool wired: policy={}, covers={}, flexWindow={}", pool.tranchesPolicy(),
                covers.size(), pool.flexWindowEpochs());
    }

    public TrancheDepositUseCase getTrancheDepositUseCase() {
        return lenderService;
    }

    public RedemptionUseCase getRedemptionUseCase() {
        return lenderService;
    }

    private static TranchesPolicy createPolicy(PoolConfig.PoolSettings pool) {
        switch (pool.tranchesPolicy()) {
            case FIXED_SENIOR_YIELD:
                return new FixedSeniorYieldTranchesPolicy(pool.fixedSeniorYieldBps());
            case RISK_ADJUSTED:
            default:
                return new RiskAdjustedTranchesPolicy(pool.riskAdjustmentBps());
        }
    }

    public BigInteger balanceOf(String account) {
        return token.balanceOf(account);
    }
}
