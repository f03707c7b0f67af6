package com.ptl.domain.model;

import com.ptl.domain.exception.PreconditionViolationException;
import com.ptl.domain.math.FixedPointMath;
import lombok.Value;

import java.math.BigInteger;

/**
 * Aggregate redemption demand and fulfilment of one epoch of one tranche.
 */
@Value
public class EpochInfo {
    long epochId;
    BigInteger totalSharesRequested;
    BigInteger totalSharesProcessed;
    BigInteger totalAmountProcessed;

    public EpochInfo(long epochId, BigInteger totalSharesRequested,
                     BigInteger totalSharesProcessed, BigInteger totalAmountProcessed) {
        this.epochId = epochId;
        this.totalSharesRequested = FixedPointMath.checked(totalSharesRequested, "totalSharesRequested");
        this.totalSharesProcessed = FixedPointMath.checked(totalSharesProcessed, "totalSharesProcessed");
        this.totalAmountProcessed = FixedPointMath.checked(totalAmountProcessed, "totalAmountProcessed");
        if (totalSharesProcessed.compareTo(totalSharesRequested) > 0) {
            throw new PreconditionViolationException(
                    "Epoch " + epochId + " cannot process more shares than requested");
        }
    }

    public static EpochInfo open(long epochId, BigInteger sharesRequested) {
        return new EpochInfo(epochId, sharesRequested, BigInteger.ZERO, BigInteger.ZERO);
    }

    public EpochState getState() {
        if (totalSharesProcessed.signum() == 0) {
            return EpochState.OPEN;
        }
        return isFulfilled() ? EpochState.FULFILLED : EpochState.PARTIALLY_FILLED;
    }

    public boolean isFulfilled() {
        return totalSharesProcessed.compareTo(totalSharesRequested) == 0 && totalSharesRequested.signum() > 0;
    }

    public BigInteger getRemainingShares() {
        return totalSharesRequested.subtract(totalSharesProcessed);
    }

    public EpochInfo withSharesRequested(BigInteger sharesRequested) {
        return new EpochInfo(epochId, sharesRequested, totalSharesProcessed, totalAmountProcessed);
    }

    public EpochInfo process(BigInteger shares, BigInteger amount) {
        return new EpochInfo(epochId, totalSharesRequested,
                totalSharesProcessed.add(shares), totalAmountProcessed.add(amount));
    }
}
