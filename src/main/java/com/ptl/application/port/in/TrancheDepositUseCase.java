package com.ptl.application.port.in;

import com.ptl.domain.model.TrancheType;

import java.math.BigInteger;

/**
 * Input port for lender deposits into a tranche.
 */
public interface TrancheDepositUseCase {

    /**
     * @return Shares minted to the lender
     */
    BigInteger deposit(TrancheType tranche, String lender, BigInteger assets);
}
