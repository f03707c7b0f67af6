package com.ptl.application.service;

import com.ptl.application.port.out.LiquidityReserve;
import com.ptl.application.port.out.TrancheShareLedger;
import com.ptl.application.port.out.UnderlyingToken;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import com.ptl.domain.model.EpochCounter;
import com.ptl.domain.model.EpochInfo;
import com.ptl.domain.model.EpochSettlement;
import com.ptl.domain.model.RedemptionLedger;
import com.ptl.domain.model.TrancheType;
import com.ptl.domain.model.WithdrawableAmount;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * Vault of one tranche: share minting, the redemption book, escrow of requested shares
 * and payout of settled redemptions.
 *
 * Escrowed shares and settled funds both sit under the vault's own account.
 */
@Slf4j
public class TrancheVaultService {

    private final TrancheType tranche;
    private final RedemptionLedger redemptionLedger;
    private final TrancheShareLedger shareLedger;
    private final UnderlyingToken token;
    private final LiquidityReserve reserve;
    private final EpochCounter epochCounter;
    private final String vaultAccount;

    public TrancheVaultService(
            TrancheType tranche,
            TrancheShareLedger shareLedger,
            UnderlyingToken token,
            LiquidityReserve reserve,
            EpochCounter epochCounter
    ) {
        this.tranche = tranche;
        this.redemptionLedger = new RedemptionLedger(tranche);
        this.shareLedger = shareLedger;
        this.token = token;
        this.reserve = reserve;
        this.epochCounter = epochCounter;
        this.vaultAccount = "vault:" + tranche.getValue();
    }

    public TrancheType getTranche() {
        return tranche;
    }

    public String getVaultAccount() {
        return vaultAccount;
    }

    public BigInteger totalSupply() {
        return shareLedger.totalSupply();
    }

    public BigInteger balanceOf(String lender) {
        return shareLedger.balanceOf(lender);
    }

    /**
     * Shares minted for a deposit at the tranche's current price; 1:1 while nothing is minted.
     */
    public BigInteger convertToShares(BigInteger assets, BigInteger trancheAssets) {
        BigInteger supply = shareLedger.totalSupply();
        if (supply.signum() == 0) {
            return assets;
        }
        if (trancheAssets.signum() == 0) {
            throw new PreconditionViolationException(
                    tranche + " tranche has " + supply + " shares outstanding but no assets");
        }
        return FixedPointMath.mulDiv(assets, supply, trancheAssets);
    }

    public void mintShares(String lender, BigInteger shares) {
        shareLedger.mint(lender, shares);
    }

    public void addRedemptionRequest(String lender, BigInteger shares) {
        FixedPointMath.requirePositive(shares, "shares");
        BigInteger balance = shareLedger.balanceOf(lender);
        if (balance.compareTo(shares) < 0) {
            throw new PreconditionViolationException(
                    "Lender " + lender + " holds " + balance + " " + tranche + " shares, cannot redeem " + shares);
        }
        long epochId = epochCounter.current();
        redemptionLedger.addRequest(lender, shares, epochId);
        shareLedger.transfer(lender, vaultAccount, shares);
        log.info("{} redemption request: lender={}, shares={}, epoch={}", tranche, lender, shares, epochId);
    }

    public void cancelRedemptionRequest(String lender, BigInteger shares) {
        long epochId = epochCounter.current();
        redemptionLedger.cancelRequest(lender, shares, epochId);
        shareLedger.transfer(vaultAccount, lender, shares);
        log.info("{} redemption cancelled: lender={}, shares={}, epoch={}", tranche, lender, shares, epochId);
    }

    public BigInteger cancellableRedemptionShares(String lender) {
        return redemptionLedger.cancellableShares(lender, epochCounter.current());
    }

    public List<EpochInfo> unprocessedEpochs() {
        return redemptionLedger.unprocessedEpochs();
    }

    /**
     * Applies one epoch close to this vault: epoch aggregates, share burn, funds into the vault account.
     */
    public void processEpochs(EpochSettlement settlement) {
        if (settlement.isEmpty()) {
            return;
        }
        redemptionLedger.applySettlement(settlement);
        shareLedger.burn(vaultAccount, settlement.getSharesProcessed());
        reserve.withdraw(vaultAccount, settlement.getAmountProcessed());
        log.info("{} vault settled {} epochs: shares={}, amount={}", tranche,
                settlement.getEpochsProcessed().size(), settlement.getSharesProcessed(),
                settlement.getAmountProcessed());
    }

    public WithdrawableAmount withdrawableAssets(String lender) {
        return redemptionLedger.computeWithdrawable(lender);
    }

    public BigInteger disburse(String lender) {
        WithdrawableAmount withdrawable = redemptionLedger.computeWithdrawable(lender);
        if (withdrawable.amount().signum() > 0) {
            token.transfer(vaultAccount, lender, withdrawable.amount());
        }
        redemptionLedger.commitCursor(lender, withdrawable.nextCursor());
        log.info("{} disbursed {} to lender {} for {} shares", tranche, withdrawable.amount(), lender,
                withdrawable.shares());
        return withdrawable.amount();
    }

    RedemptionLedger getRedemptionLedger() {
        return redemptionLedger;
    }
}
