package com.ptl.domain.math;

import com.ptl.domain.exception.ArithmeticOverflowException;
import com.ptl.domain.exception.PreconditionViolationException;

import java.math.BigInteger;

/**
 * Integer fixed-point helpers shared by the waterfall and the epoch settlement.
 * Amounts are unsigned 96-bit token units; all divisions floor unless named otherwise.
 */
public final class FixedPointMath {

    public static final BigInteger BPS_FACTOR = BigInteger.valueOf(10_000);
    public static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(18);
    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(96).subtract(BigInteger.ONE);
    public static final int DAYS_IN_A_YEAR = 360;

    private FixedPointMath() {
    }

    /**
     * Rejects values outside [0, 2^96 - 1].
     */
    public static BigInteger checked(BigInteger value, String name) {
        if (value == null) {
            throw new PreconditionViolationException(name + " is required");
        }
        if (value.signum() < 0) {
            throw new ArithmeticOverflowException(name + " underflows: " + value);
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new ArithmeticOverflowException(name + " exceeds the 96-bit amount range: " + value);
        }
        return value;
    }

    /**
     * Validates an operation input: in range and strictly positive.
     */
    public static BigInteger requirePositive(BigInteger value, String name) {
        checked(value, name);
        if (value.signum() == 0) {
            throw new PreconditionViolationException(name + " must be greater than zero");
        }
        return value;
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger divisor) {
        return a.multiply(b).divide(divisor);
    }

    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger divisor) {
        BigInteger[] qr = a.multiply(b).divideAndRemainder(divisor);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    public static BigInteger applyBps(BigInteger amount, int bps) {
        return mulDiv(amount, BigInteger.valueOf(bps), BPS_FACTOR);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger min(BigInteger a, BigInteger b, BigInteger c) {
        return min(min(a, b), c);
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Token price with 18 decimals. A tranche with no supply prices at 1.
     */
    public static BigInteger price(BigInteger assets, BigInteger supply) {
        if (supply.signum() == 0) {
            return PRICE_SCALE;
        }
        return mulDiv(assets, PRICE_SCALE, supply);
    }

    public static boolean isZero(BigInteger value) {
        return value.signum() == 0;
    }
}
