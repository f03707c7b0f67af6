package com.ptl.application.service;

import com.ptl.application.port.in.PnlDistributionUseCase;
import com.ptl.application.port.out.FeeCollector;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.FirstLossCover;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheLosses;
import com.ptl.domain.policy.FirstLossCoverAllocator;
import com.ptl.domain.policy.FirstLossCoverAllocator.LossAllocation;
import com.ptl.domain.policy.FirstLossCoverAllocator.ProfitAllocation;
import com.ptl.domain.policy.FirstLossCoverAllocator.RecoveryAllocation;
import com.ptl.domain.policy.LossDistribution;
import com.ptl.domain.policy.ProfitSplit;
import com.ptl.domain.policy.RecoveryDistribution;
import com.ptl.domain.policy.TranchesPolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Pool ledger side of the waterfall: fees, tranche split, first-loss covers.
 * Every operation computes and validates all new figures before the first write.
 */
@Slf4j
public class PnlDistributor implements PnlDistributionUseCase {

    private final TrancheLedger ledger;
    private final TranchesPolicy tranchesPolicy;
    private final FirstLossCoverAllocator coverAllocator;
    private final FeeCollector feeCollector;
    private final Clock clock;

    public PnlDistributor(
            TrancheLedger ledger,
            TranchesPolicy tranchesPolicy,
            FirstLossCoverAllocator coverAllocator,
            FeeCollector feeCollector,
            Clock clock
    ) {
        this.ledger = ledger;
        this.tranchesPolicy = tranchesPolicy;
        this.coverAllocator = coverAllocator;
        this.feeCollector = feeCollector;
        this.clock = clock;
    }

    @Override
    public ProfitDistributionResult distributeProfit(BigInteger profit) {
        FixedPointMath.requirePositive(profit, "profit");
        LocalDate today = LocalDate.now(clock);
        List<FirstLossCover> covers = ledger.getFirstLossCovers();

        // Step 1: Fees come off the top
        BigInteger poolProfit = feeCollector.calcPoolProfit(profit);
        if (poolProfit.signum() == 0) {
            poolProfit = commitFees(profit, poolProfit);
            log.info("Profit {} fully consumed by fees", profit);
            return new ProfitDistributionResult(profit, poolProfit, BigInteger.ZERO, BigInteger.ZERO,
                    Collections.nCopies(covers.size(), BigInteger.ZERO));
        }

        // Step 2: Senior/junior split
        TrancheAssets assets = ledger.getAssets();
        ProfitSplit split = tranchesPolicy.splitProfit(poolProfit, assets, today);

        // Step 3: Junior-bound profit shared with the covers
        ProfitAllocation allocation = coverAllocator.allocateProfit(
                split.juniorProfit(), assets.getJuniorAssets(), covers);

        // Step 4: Validate every new figure
        TrancheAssets newAssets = new TrancheAssets(
                assets.getSeniorAssets().add(split.seniorProfit()),
                assets.getJuniorAssets().add(allocation.juniorProfit()));
        for (int i = 0; i < covers.size(); i++) {
            FirstLossCover cover = covers.get(i);
            FixedPointMath.checked(cover.getTotalAssets().add(allocation.coverProfits().get(i)),
                    cover.getName() + ".totalAssets");
        }

        // Step 5: Commit
        commitFees(profit, poolProfit);
        for (int i = 0; i < covers.size(); i++) {
            BigInteger share = allocation.coverProfits().get(i);
            if (share.signum() > 0) {
                covers.get(i).applyProfit(share);
                log.debug("First loss cover {} earned {}", covers.get(i).getName(), share);
            }
        }
        ledger.updateAssets(newAssets);
        tranchesPolicy.onProfitDistributed(split, newAssets, today);

        log.info("Profit {} distributed: poolProfit={}, senior={}, junior={}, covers={}",
                profit, poolProfit, split.seniorProfit(), allocation.juniorProfit(), allocation.coverProfits());
        return new ProfitDistributionResult(profit, poolProfit, split.seniorProfit(),
                allocation.juniorProfit(), allocation.coverProfits());
    }

    /**
     * Accrues the fees and checks the collector settled on the pool profit the split was priced with.
     */
    private BigInteger commitFees(BigInteger profit, BigInteger expectedPoolProfit) {
        BigInteger committed = feeCollector.distributePoolFees(profit);
        if (!expectedPoolProfit.equals(committed)) {
            throw new IllegalStateException("Fee collector committed pool profit " + committed
                    + " but previewed " + expectedPoolProfit + " for profit " + profit);
        }
        return committed;
    }

    @Override
    public LossDistributionResult distributeLoss(BigInteger loss) {
        FixedPointMath.requirePositive(loss, "loss");
        LocalDate today = LocalDate.now(clock);
        List<FirstLossCover> covers = ledger.getFirstLossCovers();

        // Step 1: Covers absorb in priority order
        LossAllocation allocation = coverAllocator.allocateLoss(loss, covers);
        for (int i = 0; i < covers.size(); i++) {
            FirstLossCover cover = covers.get(i);
            FixedPointMath.checked(cover.getCoveredLoss().add(allocation.coveredAmounts().get(i)),
                    cover.getName() + ".coveredLoss");
        }

        // Step 2: Whatever is left hits junior, then senior
        TrancheAssets assets = ledger.getAssets();
        LossDistribution distribution = allocation.remainingLoss().signum() == 0
                ? new LossDistribution(assets, TrancheLosses.ZERO)
                : tranchesPolicy.distributeLoss(allocation.remainingLoss(), assets);
        TrancheLosses newLosses = ledger.getLosses().plus(distribution.lossDelta());

        // Step 3: Commit
        for (int i = 0; i < covers.size(); i++) {
            BigInteger covered = allocation.coveredAmounts().get(i);
            if (covered.signum() > 0) {
                covers.get(i).applyLossCover(covered);
                log.debug("First loss cover {} absorbed {}", covers.get(i).getName(), covered);
            }
        }
        ledger.update(distribution.newAssets(), newLosses);
        tranchesPolicy.refreshYieldTracker(distribution.newAssets(), today);

        log.info("Loss {} distributed: covers={}, junior={}, senior={}", loss, allocation.coveredAmounts(),
                distribution.lossDelta().getJuniorLoss(), distribution.lossDelta().getSeniorLoss());
        return new LossDistributionResult(loss, allocation.coveredAmounts(),
                distribution.lossDelta().getJuniorLoss(), distribution.lossDelta().getSeniorLoss());
    }

    @Override
    public RecoveryDistributionResult distributeLossRecovery(BigInteger recovery) {
        FixedPointMath.requirePositive(recovery, "recovery");
        BigInteger outstanding = ledger.outstandingLoss();
        if (recovery.compareTo(outstanding) > 0) {
            throw new PreconditionViolationException(
                    "Recovery of " + recovery + " exceeds the outstanding loss of " + outstanding);
        }
        LocalDate today = LocalDate.now(clock);
        List<FirstLossCover> covers = ledger.getFirstLossCovers();

        // Step 1: Senior, then junior
        TrancheAssets assets = ledger.getAssets();
        TrancheLosses losses = ledger.getLosses();
        RecoveryDistribution distribution = tranchesPolicy.distributeLossRecovery(recovery, assets, losses);

        // Step 2: Leftover back to the covers, last cover first
        RecoveryAllocation allocation = coverAllocator.allocateRecovery(distribution.remainingRecovery(), covers);
        for (int i = 0; i < covers.size(); i++) {
            FirstLossCover cover = covers.get(i);
            FixedPointMath.checked(cover.getTotalAssets().add(allocation.recoveredAmounts().get(i)),
                    cover.getName() + ".totalAssets");
        }

        // Step 3: Commit
        ledger.update(distribution.newAssets(), distribution.newLosses());
        for (int i = covers.size() - 1; i >= 0; i--) {
            BigInteger recovered = allocation.recoveredAmounts().get(i);
            if (recovered.signum() > 0) {
                covers.get(i).applyLossRecovery(recovered);
                log.debug("First loss cover {} recovered {}", covers.get(i).getName(), recovered);
            }
        }
        tranchesPolicy.refreshYieldTracker(distribution.newAssets(), today);

        BigInteger seniorRecovery = distribution.newAssets().getSeniorAssets().subtract(assets.getSeniorAssets());
        BigInteger juniorRecovery = distribution.newAssets().getJuniorAssets().subtract(assets.getJuniorAssets());
        log.info("Recovery {} distributed: senior={}, junior={}, covers={}",
                recovery, seniorRecovery, juniorRecovery, allocation.recoveredAmounts());
        return new RecoveryDistributionResult(recovery, seniorRecovery, juniorRecovery,
                allocation.recoveredAmounts());
    }
}
