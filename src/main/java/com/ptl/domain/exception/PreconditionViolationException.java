package com.ptl.domain.exception;

/**
 * Caller or upstream misuse: zero amounts, recovery beyond outstanding loss,
 * cancellation against a closed epoch and the like.
 */
public class PreconditionViolationException extends LedgerException {

    public PreconditionViolationException(String message) {
        super(ErrorTag.PRECONDITION_VIOLATION, message);
    }
}
