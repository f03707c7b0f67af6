package com.ptl.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of a tranche deposit.
 */
public record DepositRequest(String lender, BigInteger amount) {
    @JsonCreator
    public DepositRequest(
            @JsonProperty("lender") String lender,
            @JsonProperty("amount") BigInteger amount
    ) {
        this.lender = lender;
        this.amount = amount;
    }
}
