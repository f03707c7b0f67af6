package com.ptl.domain.exception;

/**
 * An amount left the fixed-width range of the asset counters.
 */
public class ArithmeticOverflowException extends LedgerException {

    public ArithmeticOverflowException(String message) {
        super(ErrorTag.ARITHMETIC_OVERFLOW, message);
    }
}
