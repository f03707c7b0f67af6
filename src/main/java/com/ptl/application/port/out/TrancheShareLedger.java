package com.ptl.application.port.out;

import java.math.BigInteger;

/**
 * Output port for the share token of one tranche.
 */
public interface TrancheShareLedger {

    BigInteger totalSupply();

    BigInteger balanceOf(String account);

    void mint(String account, BigInteger shares);

    void burn(String account, BigInteger shares);

    void transfer(String from, String to, BigInteger shares);
}
