package com.ptl.domain.model;

import com.ptl.domain.math.FixedPointMath;
import lombok.Value;

import java.math.BigInteger;

/**
 * Cumulative unrecovered loss per tranche. Grows with loss, shrinks only with recovery.
 */
@Value
public class TrancheLosses {
    public static final TrancheLosses ZERO = new TrancheLosses(BigInteger.ZERO, BigInteger.ZERO);

    BigInteger seniorLoss;
    BigInteger juniorLoss;

    public TrancheLosses(BigInteger seniorLoss, BigInteger juniorLoss) {
        this.seniorLoss = FixedPointMath.checked(seniorLoss, "seniorLoss");
        this.juniorLoss = FixedPointMath.checked(juniorLoss, "juniorLoss");
    }

    public TrancheLosses plus(TrancheLosses delta) {
        return new TrancheLosses(seniorLoss.add(delta.seniorLoss), juniorLoss.add(delta.juniorLoss));
    }

    public BigInteger total() {
        return seniorLoss.add(juniorLoss);
    }
}
