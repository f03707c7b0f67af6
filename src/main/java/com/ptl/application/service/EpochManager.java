package com.ptl.application.service;

import com.ptl.application.port.in.EpochSettlementUseCase;
import com.ptl.application.port.out.LiquidityReserve;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.EpochCounter;
import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.EpochSettlement;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.policy.TranchesPolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closes redemption epochs.
 *
 * Liquidity goes to mature senior epochs first, then mature junior epochs (capped so the
 * senior:junior ratio still holds afterwards), then, with a flex window, the immature epochs
 * by the same rules. Within a tranche older epochs are exhausted before newer ones get any fill.
 */
@Slf4j
public class EpochManager implements EpochSettlementUseCase {

    private final TrancheLedger ledger;
    private final TranchesPolicy tranchesPolicy;
    private final LiquidityReserve reserve;
    private final Map<TrancheType, TrancheVaultService> vaults;
    private final EpochCounter epochCounter;
    private final int maxSeniorJuniorRatioBps;
    private final int flexWindowEpochs;
    private final Clock clock;

    public EpochManager(
            TrancheLedger ledger,
            TranchesPolicy tranchesPolicy,
            LiquidityReserve reserve,
            Map<TrancheType, TrancheVaultService> vaults,
            EpochCounter epochCounter,
            int maxSeniorJuniorRatioBps,
            int flexWindowEpochs,
            Clock clock
    ) {
        if (maxSeniorJuniorRatioBps <= 0) {
            throw new IllegalArgumentException("maxSeniorJuniorRatioBps must be positive");
        }
        if (flexWindowEpochs < 0) {
            throw new IllegalArgumentException("flexWindowEpochs must not be negative");
        }
        this.ledger = ledger;
        this.tranchesPolicy = tranchesPolicy;
        this.reserve = reserve;
        this.vaults = new EnumMap<>(vaults);
        this.epochCounter = epochCounter;
        this.maxSeniorJuniorRatioBps = maxSeniorJuniorRatioBps;
        this.flexWindowEpochs = flexWindowEpochs;
        this.clock = clock;
    }

    @Override
    public long currentEpochId() {
        return epochCounter.current();
    }

    @Override
    public List<EpochInfo> unprocessedEpochs(TrancheType tranche) {
        return vault(tranche).unprocessedEpochs();
    }

    @Override
    public EpochCloseResult closeEpoch() {
        long epochId = epochCounter.current();
        TrancheVaultService seniorVault = vault(TrancheType.SENIOR);
        TrancheVaultService juniorVault = vault(TrancheType.JUNIOR);

        // Step 1: Pending demand against available liquidity
        List<EpochInfo> seniorPending = seniorVault.unprocessedEpochs();
        List<EpochInfo> juniorPending = juniorVault.unprocessedEpochs();
        BigInteger available = reserve.getAvailableReservation();
        boolean hasDemand = !seniorPending.isEmpty() || !juniorPending.isEmpty();
        if (hasDemand && available.signum() == 0) {
            throw new ConstraintBlockedException(
                    "No liquidity available to settle redemptions of epoch " + epochId);
        }

        // Step 2: Price both tranches
        TrancheAssets assets = ledger.getAssets();
        TrancheWork senior = new TrancheWork(TrancheType.SENIOR,
                FixedPointMath.price(assets.getSeniorAssets(), seniorVault.totalSupply()));
        TrancheWork junior = new TrancheWork(TrancheType.JUNIOR,
                FixedPointMath.price(assets.getJuniorAssets(), juniorVault.totalSupply()));

        // Step 3: Partition into mature and immature epochs
        long matureCutoff = epochId - flexWindowEpochs;
        List<EpochInfo> seniorMature = matureEpochs(seniorPending, matureCutoff);
        List<EpochInfo> juniorMature = matureEpochs(juniorPending, matureCutoff);

        // Step 4: Fill mature epochs, then the rest of each queue with whatever is left.
        // The second pass walks the whole queue again so a junior epoch held back by the
        // ratio cap is served before any newer one once senior redemptions free up room.
        available = available.subtract(fill(senior, seniorMature, available, null));
        available = available.subtract(fill(junior, juniorMature, available,
                maxJuniorRedeemable(assets, senior, junior)));
        if (flexWindowEpochs > 0 && available.signum() > 0) {
            available = available.subtract(fill(senior, seniorPending, available, null));
            available = available.subtract(fill(junior, juniorPending, available,
                    maxJuniorRedeemable(assets, senior, junior)));
        }

        // Step 5: Validate the outcome before touching anything
        TrancheAssets newAssets = new TrancheAssets(
                assets.getSeniorAssets().subtract(senior.amountProcessed),
                assets.getJuniorAssets().subtract(junior.amountProcessed));
        BigInteger totalAmount = senior.amountProcessed.add(junior.amountProcessed);
        if (totalAmount.compareTo(reserve.totalBalance()) > 0) {
            throw new PreconditionViolationException(
                    "Settlement of " + totalAmount + " exceeds the funds held by the pool safe");
        }
        EpochSettlement seniorSettlement = senior.toSettlement();
        EpochSettlement juniorSettlement = junior.toSettlement();
        BigInteger unmetDemand = senior.unmetDemand(seniorPending).add(junior.unmetDemand(juniorPending));

        // Step 6: Commit
        seniorVault.processEpochs(seniorSettlement);
        juniorVault.processEpochs(juniorSettlement);
        ledger.updateAssets(newAssets);
        tranchesPolicy.refreshYieldTracker(newAssets, LocalDate.now(clock));
        reserve.setRedemptionReservation(unmetDemand);
        long nextEpochId = epochCounter.advance();

        log.info("Epoch {} closed: senior shares={} amount={}, junior shares={} amount={}, unmet demand={}",
                epochId, senior.sharesProcessed, senior.amountProcessed,
                junior.sharesProcessed, junior.amountProcessed, unmetDemand);

        Map<TrancheType, TrancheCloseSummary> summaries = new EnumMap<>(TrancheType.class);
        summaries.put(TrancheType.SENIOR, senior.summary());
        summaries.put(TrancheType.JUNIOR, junior.summary());
        return new EpochCloseResult(epochId, nextEpochId, summaries, unmetDemand);
    }

    /**
     * Fills epochs oldest first until liquidity or the cap runs out.
     * Fulfilled epochs are skipped; a partial fill ends the pass.
     * @param cap Max amount for this pass, null when uncapped
     * @return Amount consumed
     */
    private BigInteger fill(TrancheWork work, List<EpochInfo> epochs, BigInteger available, BigInteger cap) {
        if (work.price.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger budget = cap == null ? available : FixedPointMath.min(available, cap);
        BigInteger consumed = BigInteger.ZERO;
        for (EpochInfo pending : epochs) {
            BigInteger left = budget.subtract(consumed);
            if (left.signum() == 0) {
                break;
            }
            EpochInfo epoch = work.latest(pending);
            if (epoch.getRemainingShares().signum() == 0) {
                // Already fulfilled in an earlier pass of this close
                continue;
            }
            BigInteger affordable = FixedPointMath.mulDiv(left, FixedPointMath.PRICE_SCALE, work.price);
            BigInteger shares = FixedPointMath.min(epoch.getRemainingShares(), affordable);
            if (shares.signum() == 0) {
                // Newer epochs must not be filled ahead of this one
                break;
            }
            BigInteger amount = FixedPointMath.mulDiv(shares, work.price, FixedPointMath.PRICE_SCALE);
            work.record(epoch.process(shares, amount), shares, amount);
            consumed = consumed.add(amount);
            log.debug("{} epoch {} filled {} shares for {}", work.tranche, epoch.getEpochId(), shares, amount);
            if (shares.compareTo(epoch.getRemainingShares()) < 0) {
                break;
            }
        }
        return consumed;
    }

    /**
     * Junior assets that can leave without pushing senior over the ratio cap,
     * given the redemptions already settled in this close.
     */
    private BigInteger maxJuniorRedeemable(TrancheAssets assets, TrancheWork senior, TrancheWork junior) {
        BigInteger seniorAfter = assets.getSeniorAssets().subtract(senior.amountProcessed);
        BigInteger juniorAfter = assets.getJuniorAssets().subtract(junior.amountProcessed);
        BigInteger minJuniorAssets = FixedPointMath.mulDivUp(seniorAfter, FixedPointMath.BPS_FACTOR,
                BigInteger.valueOf(maxSeniorJuniorRatioBps));
        return FixedPointMath.max(BigInteger.ZERO, juniorAfter.subtract(minJuniorAssets));
    }

    /**
     * Leading epochs of the queue old enough to settle without the flex window.
     */
    private static List<EpochInfo> matureEpochs(List<EpochInfo> pending, long matureCutoff) {
        List<EpochInfo> mature = new ArrayList<>();
        for (EpochInfo epoch : pending) {
            if (epoch.getEpochId() > matureCutoff) {
                break;
            }
            mature.add(epoch);
        }
        return mature;
    }

    private TrancheVaultService vault(TrancheType tranche) {
        TrancheVaultService vault = vaults.get(tranche);
        if (vault == null) {
            throw new PreconditionViolationException("No vault registered for tranche " + tranche);
        }
        return vault;
    }

    /**
     * Working state of one tranche while an epoch is being closed.
     */
    private static final class TrancheWork {
        private final TrancheType tranche;
        private final BigInteger price;
        private final Map<Long, EpochInfo> touched = new LinkedHashMap<>();
        private BigInteger sharesProcessed = BigInteger.ZERO;
        private BigInteger amountProcessed = BigInteger.ZERO;

        private TrancheWork(TrancheType tranche, BigInteger price) {
            this.tranche = tranche;
            this.price = price;
        }

        private EpochInfo latest(EpochInfo epoch) {
            return touched.getOrDefault(epoch.getEpochId(), epoch);
        }

        private void record(EpochInfo updated, BigInteger shares, BigInteger amount) {
            touched.put(updated.getEpochId(), updated);
            sharesProcessed = sharesProcessed.add(shares);
            amountProcessed = amountProcessed.add(amount);
        }

        private EpochSettlement toSettlement() {
            return new EpochSettlement(tranche, List.copyOf(touched.values()), sharesProcessed, amountProcessed);
        }

        private BigInteger unmetDemand(List<EpochInfo> pending) {
            BigInteger shares = BigInteger.ZERO;
            for (EpochInfo epoch : pending) {
                shares = shares.add(latest(epoch).getRemainingShares());
            }
            return FixedPointMath.mulDiv(shares, price, FixedPointMath.PRICE_SCALE);
        }

        private TrancheCloseSummary summary() {
            return new TrancheCloseSummary(price, touched.size(), sharesProcessed, amountProcessed);
        }
    }
}
