package com.ptl.adapter.out.memory;

import com.ptl.application.port.out.LiquidityReserve;
import com.ptl.application.port.out.UnderlyingToken;
import com.ptl.domain.exception.ConstraintBlockedException;
import com.ptl.domain.math.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Pool safe backed by one account of the underlying token.
 * Loans are out of scope here, so every unit held in the safe is available to redemptions.
 */
@Slf4j
public class InMemoryPoolSafe implements LiquidityReserve {

    public static final String DEFAULT_ACCOUNT = "pool:safe";

    private final UnderlyingToken token;
    private final String account;
    private BigInteger redemptionReservation = BigInteger.ZERO;

    public InMemoryPoolSafe(UnderlyingToken token) {
        this(token, DEFAULT_ACCOUNT);
    }

    public InMemoryPoolSafe(UnderlyingToken token, String account) {
        this.token = token;
        this.account = account;
    }

    public String getAccount() {
        return account;
    }

    @Override
    public BigInteger getAvailableReservation() {
        return totalBalance();
    }

    @Override
    public BigInteger totalBalance() {
        return token.balanceOf(account);
    }

    @Override
    public void withdraw(String to, BigInteger amount) {
        BigInteger balance = totalBalance();
        if (balance.compareTo(amount) < 0) {
            throw new ConstraintBlockedException(
                    "Pool safe holds " + balance + ", cannot release " + amount);
        }
        token.transfer(account, to, amount);
        log.debug("Released {} from the pool safe to {}", amount, to);
    }

    @Override
    public void deposit(String from, BigInteger amount) {
        token.transfer(from, account, amount);
        log.debug("Received {} into the pool safe from {}", amount, from);
    }

    @Override
    public void setRedemptionReservation(BigInteger amount) {
        redemptionReservation = FixedPointMath.checked(amount, "redemptionReservation");
    }

    @Override
    public BigInteger getRedemptionReservation() {
        return redemptionReservation;
    }
}
