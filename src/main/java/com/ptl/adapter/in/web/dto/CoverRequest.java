package com.ptl.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of a first-loss-cover deposit (amount) or redemption (shares).
 */
public record CoverRequest(String provider, BigInteger amount, BigInteger shares) {
    @JsonCreator
    public CoverRequest(
            @JsonProperty("provider") String provider,
            @JsonProperty("amount") BigInteger amount,
            @JsonProperty("shares") BigInteger shares
    ) {
        this.provider = provider;
        this.amount = amount;
        this.shares = shares;
    }
}
