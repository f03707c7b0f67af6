package com.ptl.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Per-lender position in their request list, plus what was already counted
 * for the one request whose epoch is only partially settled.
 */
@Value
public class DisbursementCursor {
    public static final DisbursementCursor INITIAL = new DisbursementCursor(0, BigInteger.ZERO, BigInteger.ZERO);

    int requestsIndex;
    BigInteger partialSharesProcessed;
    BigInteger partialAmountProcessed;
}
