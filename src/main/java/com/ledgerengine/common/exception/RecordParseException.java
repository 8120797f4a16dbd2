package com.ledgerengine.common.exception;

/**
 * Thrown when an input row cannot be parsed into a transaction.
 */
public class RecordParseException extends LedgerEngineException {

    public RecordParseException(String message) {
        super(ErrorKind.PARSE_ERROR, message);
    }

    public RecordParseException(String message, Throwable cause) {
        super(ErrorKind.PARSE_ERROR, message, cause);
    }
}
