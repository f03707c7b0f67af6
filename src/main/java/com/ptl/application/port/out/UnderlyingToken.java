package com.ptl.application.port.out;

import java.math.BigInteger;

/**
 * Output port for the underlying asset the pool is denominated in.
 */
public interface UnderlyingToken {

    BigInteger balanceOf(String account);

    /**
     * @throws com.ptl.domain.exception.PreconditionViolationException if from holds less than amount
     */
    void transfer(String from, String to, BigInteger amount);
}
