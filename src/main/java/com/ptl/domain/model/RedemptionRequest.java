package com.ptl.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * One lender's redemption request for one epoch.
 */
@Value
public class RedemptionRequest {
    long epochId;
    BigInteger sharesRequested;

    public RedemptionRequest withSharesRequested(BigInteger shares) {
        return new RedemptionRequest(epochId, shares);
    }
}
