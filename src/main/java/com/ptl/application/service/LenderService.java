package com.ptl.application.service;

import com.ptl.application.port.in.RedemptionUseCase;
import com.ptl.application.port.in.TrancheDepositUseCase;
import com.ptl.application.port.out.LiquidityReserve;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.TrancheAssets;
import com.ptl.domain.model.TrancheLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.model.WithdrawableAmount;
import com.ptl.domain.policy.TranchesPolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lender entry point: deposits into a tranche and the redemption flow of its vault.
 */
@Slf4j
public class LenderService implements TrancheDepositUseCase, RedemptionUseCase {

    private final TrancheLedger ledger;
    private final TranchesPolicy tranchesPolicy;
    private final LiquidityReserve reserve;
    private final Map<TrancheType, TrancheVaultService> vaults;
    private final DepositLimits limits;
    private final Clock clock;

    /**
     * @param liquidityCap Max total tranche assets, 0 for no cap
     */
    public record DepositLimits(BigInteger minDepositAmount, BigInteger liquidityCap, int maxSeniorJuniorRatioBps) {
    }

    public LenderService(
            TrancheLedger ledger,
            TranchesPolicy tranchesPolicy,
            LiquidityReserve reserve,
            Map<TrancheType, TrancheVaultService> vaults,
            DepositLimits limits,
            Clock clock
    ) {
        this.ledger = ledger;
        this.tranchesPolicy = tranchesPolicy;
        this.reserve = reserve;
        this.vaults = new EnumMap<>(vaults);
        this.limits = limits;
        this.clock = clock;
    }

    @Override
    public BigInteger deposit(TrancheType tranche, String lender, BigInteger assets) {
        FixedPointMath.requirePositive(assets, "assets");
        TrancheVaultService vault = vault(tranche);

        // Step 1: Deposit limits
        if (assets.compareTo(limits.minDepositAmount()) < 0) {
            throw new PreconditionViolationException(
                    "Deposit of " + assets + " is below the minimum of " + limits.minDepositAmount());
        }
        TrancheAssets current = ledger.getAssets();
        TrancheAssets newAssets = current.with(tranche, current.get(tranche).add(assets));
        if (limits.liquidityCap().signum() > 0 && newAssets.total().compareTo(limits.liquidityCap()) > 0) {
            throw new ConstraintBlockedException("Deposit would exceed the pool liquidity cap of " + limits.liquidityCap());
        }

        // Step 2: Senior cannot outgrow junior beyond the ratio cap
        if (tranche == TrancheType.SENIOR && exceedsRatio(newAssets)) {
            throw new ConstraintBlockedException("Senior deposit would breach the max senior:junior ratio");
        }

        // Step 3: Price the shares
        BigInteger shares = vault.convertToShares(assets, current.get(tranche));
        if (shares.signum() == 0) {
            throw new PreconditionViolationException("Deposit of " + assets + " mints zero shares");
        }
        FixedPointMath.checked(vault.totalSupply().add(shares), tranche + ".totalSupply");

        // Step 4: Commit; funds move first so a short balance leaves nothing behind
        reserve.deposit(lender, assets);
        vault.mintShares(lender, shares);
        tranchesPolicy.refreshYieldTracker(newAssets, LocalDate.now(clock));
        ledger.updateAssets(newAssets);

        log.info("{} deposit: lender={}, assets={}, shares={}", tranche, lender, assets, shares);
        return shares;
    }

    @Override
    public void addRedemptionRequest(TrancheType tranche, String lender, BigInteger shares) {
        vault(tranche).addRedemptionRequest(lender, shares);
    }

    @Override
    public void cancelRedemptionRequest(TrancheType tranche, String lender, BigInteger shares) {
        vault(tranche).cancelRedemptionRequest(lender, shares);
    }

    @Override
    public BigInteger cancellableRedemptionShares(TrancheType tranche, String lender) {
        return vault(tranche).cancellableRedemptionShares(lender);
    }

    @Override
    public WithdrawableAmount withdrawableAssets(TrancheType tranche, String lender) {
        return vault(tranche).withdrawableAssets(lender);
    }

    @Override
    public BigInteger disburse(TrancheType tranche, String lender) {
        return vault(tranche).disburse(lender);
    }

    private boolean exceedsRatio(TrancheAssets assets) {
        BigInteger seniorScaled = assets.getSeniorAssets().multiply(FixedPointMath.BPS_FACTOR);
        BigInteger juniorCapacity = assets.getJuniorAssets().multiply(BigInteger.valueOf(limits.maxSeniorJuniorRatioBps()));
        return seniorScaled.compareTo(juniorCapacity) > 0;
    }

    private TrancheVaultService vault(TrancheType tranche) {
        TrancheVaultService vault = vaults.get(tranche);
        if (vault == null) {
            throw new PreconditionViolationException("No vault registered for tranche " + tranche);
        }
        return vault;
    }
}
