package com.ptl.application.service;

import com.ptl.application.port.in.FirstLossCoverUseCase;
import com.ptl.application.port.out.UnderlyingToken;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.model.FirstLossCover;
import com.ptl.domain.model.TrancheLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * Provider deposits and redemptions of first-loss-cover capital.
 * Each cover keeps its capital under its own "flc:" account of the underlying token.
 */
@Slf4j
public class FirstLossCoverService implements FirstLossCoverUseCase {

    private final TrancheLedger ledger;
    private final UnderlyingToken token;

    public FirstLossCoverService(TrancheLedger ledger, UnderlyingToken token) {
        this.ledger = ledger;
        this.token = token;
    }

    public static String coverAccount(FirstLossCover cover) {
        return "flc:" + cover.getName();
    }

    @Override
    public BigInteger depositCover(int coverIndex, String provider, BigInteger assets) {
        FirstLossCover cover = cover(coverIndex);
        cover.previewDeposit(assets);
        BigInteger providerBalance = token.balanceOf(provider);
        if (providerBalance.compareTo(assets) < 0) {
            throw new PreconditionViolationException(
                    "Provider " + provider + " holds " + providerBalance + ", cannot deposit " + assets);
        }

        token.transfer(provider, coverAccount(cover), assets);
        BigInteger shares = cover.deposit(provider, assets);
        log.info("First loss cover {} deposit: provider={}, assets={}, shares={}",
                cover.getName(), provider, assets, shares);
        return shares;
    }

    @Override
    public BigInteger redeemCover(int coverIndex, String provider, BigInteger shares) {
        FirstLossCover cover = cover(coverIndex);
        BigInteger assets = cover.previewRedeem(provider, shares);
        BigInteger held = token.balanceOf(coverAccount(cover));
        if (held.compareTo(assets) < 0) {
            throw new ConstraintBlockedException(
                    "First loss cover " + cover.getName() + " holds " + held + ", cannot pay out " + assets);
        }

        cover.redeem(provider, shares);
        token.transfer(coverAccount(cover), provider, assets);
        log.info("First loss cover {} redemption: provider={}, shares={}, assets={}",
                cover.getName(), provider, shares, assets);
        return assets;
    }

    private FirstLossCover cover(int coverIndex) {
        List<FirstLossCover> covers = ledger.getFirstLossCovers();
        if (coverIndex < 0 || coverIndex >= covers.size()) {
            throw new PreconditionViolationException("Unknown first loss cover index " + coverIndex);
        }
        return covers.get(coverIndex);
    }
}
