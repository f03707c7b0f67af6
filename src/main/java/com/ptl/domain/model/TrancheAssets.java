package com.ptl.domain.model;

import com.ptl.domain.math.FixedPointMath;
import lombok.Value;

import java.math.BigInteger;

/**
 * Current net asset value per tranche.
 * Value object - every mutation yields a new, range-checked instance.
 */
@Value
public class TrancheAssets {
    public static final TrancheAssets ZERO = new TrancheAssets(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger seniorAssets;
    BigInteger juniorAssets;

    public TrancheAssets(BigInteger seniorAssets, BigInteger juniorAssets) {
        this.seniorAssets = FixedPointMath.checked(seniorAssets, "seniorAssets");
        this.juniorAssets = FixedPointMath.checked(juniorAssets, "juniorAssets");
    }

    public BigInteger get(TrancheType tranche) {
        return tranche == TrancheType.SENIOR ? seniorAssets : juniorAssets;
    }

    public TrancheAssets with(TrancheType tranche, BigInteger assets) {
        return tranche == TrancheType.SENIOR
                ? new TrancheAssets(assets, juniorAssets)
                : new TrancheAssets(seniorAssets, assets);
    }

    public BigInteger total() {
        return seniorAssets.add(juniorAssets);
    }
}
