package com.ledgerengine.common.exception;

/**
 * Thrown when a record carries a transaction type the ledger does not know.
 */
public class UnrecognizedTypeException extends LedgerEngineException {

    private final String rawType;

    public UnrecognizedTypeException(String rawType) {
        super(ErrorKind.UNRECOGNIZED_TYPE, "Unrecognized transaction type: " + rawType);
        this.rawType = rawType;
    }

    public String getRawType() {
        return rawType;
    }
}
