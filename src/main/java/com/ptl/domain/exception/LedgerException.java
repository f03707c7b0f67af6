package com.ptl.domain.exception;

/**
 * Base class for every rejection raised by the ledger.
 * A rejected operation leaves tranche, cover and epoch state untouched.
 */
public class LedgerException extends RuntimeException {
    private final ErrorTag tag;

    public LedgerException(ErrorTag tag, String message) {
        super(message);
        this.tag = tag;
    }

    public LedgerException(ErrorTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    public ErrorTag getTag() {
        return tag;
    }
}
