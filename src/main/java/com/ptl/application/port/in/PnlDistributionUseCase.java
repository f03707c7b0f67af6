package com.ptl.application.port.in;

import java.math.BigInteger;
import java.util.List;

/**
 * Input port for the PnL waterfall.
 * Invoked by the loan ledger after each billing, payment or default event.
 */
public interface PnlDistributionUseCase {

    /**
     * Takes fees, splits the rest between senior and junior, and shares the junior part with the covers.
     * @param profit Raw profit before fees
     * @return How the profit was distributed
     */
    ProfitDistributionResult distributeProfit(BigInteger profit);

    /**
     * Covers absorb first, in list order; then junior, then senior.
     */
    LossDistributionResult distributeLoss(BigInteger loss);

    /**
     * Senior recovers first, then junior, then the covers in reverse list order.
     */
    RecoveryDistributionResult distributeLossRecovery(BigInteger recovery);

    record ProfitDistributionResult(
            BigInteger profit,
            BigInteger poolProfit,
            BigInteger seniorProfit,
            BigInteger juniorProfit,
            List<BigInteger> coverProfits
    ) {}

    record LossDistributionResult(
            BigInteger loss,
            List<BigInteger> coverLosses,
            BigInteger juniorLoss,
            BigInteger seniorLoss
    ) {}

    record RecoveryDistributionResult(
            BigInteger recovery,
            BigInteger seniorRecovery,
            BigInteger juniorRecovery,
            List<BigInteger> coverRecoveries
    ) {}
}
