package com.ledgerengine.common.exception;

/**
 * Base exception for all ledger engine exceptions.
 */
public class LedgerEngineException extends RuntimeException {

    private final ErrorKind errorKind;

    public LedgerEngineException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public LedgerEngineException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
