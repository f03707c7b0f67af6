package com.ptl.domain.model;

import java.math.BigInteger;

/**
 * Result of walking a lender's requests: what is newly withdrawable and where the cursor lands.
 */
public record WithdrawableAmount(BigInteger shares, BigInteger amount, DisbursementCursor nextCursor) {
}
