package com.ptl.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of the profit, loss and recovery endpoints.
 */
public record AmountRequest(BigInteger amount) {
    @JsonCreator
    public AmountRequest(@JsonProperty("amount") BigInteger amount) {
        this.amount = amount;
    }
}
