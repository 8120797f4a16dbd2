package com.ledgerengine.common.exception;

/**
 * Thrown when the input source cannot be read or an output sink cannot be written.
 * Unlike the per-record failures this aborts the whole run.
 */
public class LedgerIOException extends LedgerEngineException {

    public LedgerIOException(String message) {
        super(ErrorKind.IO_ERROR, message);
    }

    public LedgerIOException(String message, Throwable cause) {
        super(ErrorKind.IO_ERROR, message, cause);
    }
}
