package com.ptl.domain.policy;

import java.math.BigInteger;

/**
 * Senior/junior split of one profit amount. seniorProfit + juniorProfit always equals the input profit.
 */
public record ProfitSplit(BigInteger seniorProfit, BigInteger juniorProfit) {
}
