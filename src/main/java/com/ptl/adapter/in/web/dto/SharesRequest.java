package com.ptl.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of a redemption request or cancellation.
 */
public record SharesRequest(String lender, BigInteger shares) {
    @JsonCreator
    public SharesRequest(
            @JsonProperty("lender") String lender,
            @JsonProperty("shares") BigInteger shares
    ) {
        this.lender = lender;
        this.shares = shares;
    }
}
