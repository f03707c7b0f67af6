package com.ptl.application.port.out;

import java.math.BigInteger;

/**
 * Output port for the pool safe: physical funds backing the tranche figures.
 */
public interface LiquidityReserve {

    /**
     * Liquidity that can be used for redemptions at the next epoch close.
     */
    BigInteger getAvailableReservation();

    BigInteger totalBalance();

    /**
     * Moves funds out of the reserve.
     * @throws com.ptl.domain.exception.ConstraintBlockedException if the reserve holds less than amount
     */
    void withdraw(String to, BigInteger amount);

    /**
     * Moves funds from an account into the reserve.
     */
    void deposit(String from, BigInteger amount);

    /**
     * Records the unmet redemption demand the reserve should set aside for the next epoch.
     */
    void setRedemptionReservation(BigInteger amount);

    BigInteger getRedemptionReservation();
}
