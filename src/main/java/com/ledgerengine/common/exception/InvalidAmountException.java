package com.ledgerengine.common.exception;

/**
 * Thrown when a deposit or withdrawal carries an amount the ledger does not accept.
 */
public class InvalidAmountException extends LedgerEngineException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }
}
