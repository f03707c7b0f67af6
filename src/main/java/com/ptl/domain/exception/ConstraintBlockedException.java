package com.ptl.domain.exception;

/**
 * A pool constraint (liquidity, liquidity cap, senior:junior ratio) blocks the operation right now.
 * Retrying later may succeed.
 */
public class ConstraintBlockedException extends LedgerException {

    public ConstraintBlockedException(String message) {
        super(ErrorTag.CONSTRAINT_BLOCKED, message);
    }
}
