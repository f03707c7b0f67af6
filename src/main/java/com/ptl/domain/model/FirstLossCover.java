package com.ptl.domain.model;

import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A reserve that absorbs loss ahead of the tranches and earns a weighted share of junior-bound profit.
 * Entity - identified by its name; its position in the cover list is the loss-absorption priority.
 * The calc* methods are pure, the apply* methods commit an amount already computed.
 */
@Getter
public class FirstLossCover {
    private final String name;
    private final FirstLossCoverConfig config;
    private BigInteger totalAssets = BigInteger.ZERO;
    private BigInteger coveredLoss = BigInteger.ZERO;
    private BigInteger totalShares = BigInteger.ZERO;
    private final Map<String, BigInteger> providerShares = new HashMap<>();

    public FirstLossCover(String name, FirstLossCoverConfig config) {
        this.name = name;
        this.config = config;
    }

    public Map<String, BigInteger> getProviderShares() {
        return Collections.unmodifiableMap(providerShares);
    }

    public BigInteger sharesOf(String provider) {
        return providerShares.getOrDefault(provider, BigInteger.ZERO);
    }

    public BigInteger assetsOf(String provider) {
        return convertToAssets(sharesOf(provider));
    }

    public BigInteger convertToShares(BigInteger assets) {
        if (totalShares.signum() == 0 || totalAssets.signum() == 0) {
            return assets;
        }
        return FixedPointMath.mulDiv(assets, totalShares, totalAssets);
    }

    public BigInteger convertToAssets(BigInteger shares) {
        if (totalShares.signum() == 0) {
            return shares;
        }
        return FixedPointMath.mulDiv(shares, totalAssets, totalShares);
    }

    /**
     * Profit weight: totalAssets scaled by the risk yield multiplier.
     */
    public BigInteger weight() {
        return FixedPointMath.applyBps(totalAssets, config.getRiskYieldMultiplierBps());
    }

    /**
     * Amount this cover would absorb out of the given loss.
     */
    public BigInteger calcLossCover(BigInteger loss) {
        return FixedPointMath.min(
                FixedPointMath.applyBps(loss, config.getCoverRatePerLossBps()),
                config.getCoverCapPerLoss(),
                totalAssets);
    }

    /**
     * Amount of the given recovery this cover would take back.
     */
    public BigInteger calcLossRecovery(BigInteger recovery) {
        return FixedPointMath.min(coveredLoss, recovery);
    }

    public void applyLossCover(BigInteger amount) {
        totalAssets = FixedPointMath.checked(totalAssets.subtract(amount), name + ".totalAssets");
        coveredLoss = FixedPointMath.checked(coveredLoss.add(amount), name + ".coveredLoss");
    }

    public void applyLossRecovery(BigInteger amount) {
        coveredLoss = FixedPointMath.checked(coveredLoss.subtract(amount), name + ".coveredLoss");
        totalAssets = FixedPointMath.checked(totalAssets.add(amount), name + ".totalAssets");
    }

    public void applyProfit(BigInteger amount) {
        totalAssets = FixedPointMath.checked(totalAssets.add(amount), name + ".totalAssets");
    }

    /**
     * Shares a provider would receive for the deposit; validates the liquidity cap.
     */
    public BigInteger previewDeposit(BigInteger assets) {
        FixedPointMath.requirePositive(assets, "assets");
        BigInteger newTotal = FixedPointMath.checked(totalAssets.add(assets), name + ".totalAssets");
        if (config.getMaxLiquidity() != null && config.getMaxLiquidity().signum() > 0
                && newTotal.compareTo(config.getMaxLiquidity()) > 0) {
            throw new ConstraintBlockedException(
                    "Deposit would exceed the max liquidity of first loss cover " + name);
        }
        BigInteger shares = convertToShares(assets);
        if (shares.signum() == 0) {
            throw new PreconditionViolationException("Deposit of " + assets + " mints zero cover shares");
        }
        return shares;
    }

    public BigInteger deposit(String provider, BigInteger assets) {
        BigInteger shares = previewDeposit(assets);
        totalAssets = totalAssets.add(assets);
        totalShares = totalShares.add(shares);
        providerShares.merge(provider, shares, BigInteger::add);
        return shares;
    }

    /**
     * Assets a provider would receive for redeeming the shares; validates ownership and min liquidity.
     */
    public BigInteger previewRedeem(String provider, BigInteger shares) {
        FixedPointMath.requirePositive(shares, "shares");
        if (shares.compareTo(sharesOf(provider)) > 0) {
            throw new PreconditionViolationException(
                    "Provider " + provider + " owns fewer than " + shares + " shares of " + name);
        }
        BigInteger assets = convertToAssets(shares);
        BigInteger minLiquidity = config.getMinLiquidity() == null ? BigInteger.ZERO : config.getMinLiquidity();
        if (totalAssets.subtract(assets).compareTo(minLiquidity) < 0) {
            throw new PreconditionViolationException(
                    "Redemption would take first loss cover " + name + " below its min liquidity");
        }
        return assets;
    }

    public BigInteger redeem(String provider, BigInteger shares) {
        BigInteger assets = previewRedeem(provider, shares);
        totalAssets = totalAssets.subtract(assets);
        totalShares = totalShares.subtract(shares);
        BigInteger remaining = sharesOf(provider).subtract(shares);
        if (remaining.signum() == 0) {
            providerShares.remove(provider);
        } else {
            providerShares.put(provider, remaining);
        }
        return assets;
    }
}
