package com.ptl.application.port.out;

import java.math.BigInteger;

/**
 * Output port for the protocol, pool owner and evaluation agent cuts taken from profit
 * before it reaches the tranches.
 */
public interface FeeCollector {

    /**
     * Profit left for the pool after fees. Pure: nothing is accrued.
     * Must equal what {@link #distributePoolFees(BigInteger)} returns for the same profit.
     */
    BigInteger calcPoolProfit(BigInteger profit);

    /**
     * Accrues the fees on the given profit.
     * @return Profit left for the pool after fees
     */
    BigInteger distributePoolFees(BigInteger profit);

    AccruedIncomes getAccruedIncomes();

    /**
     * Fees accrued so far, per recipient.
     */
    record AccruedIncomes(BigInteger protocolIncome, BigInteger poolOwnerIncome, BigInteger eaIncome) {

        public static AccruedIncomes zero() {
            return new AccruedIncomes(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
        }

        public AccruedIncomes plus(BigInteger protocol, BigInteger poolOwner, BigInteger ea) {
            return new AccruedIncomes(protocolIncome.add(protocol), poolOwnerIncome.add(poolOwner), eaIncome.add(ea));
        }
    }
}
