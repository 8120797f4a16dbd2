package com.ledgerengine.common.exception;

/**
 * Thrown when a dispute, resolve or chargeback references a transaction
 * that was never applied to the account.
 */
public class UnknownTransactionException extends LedgerEngineException {

    public UnknownTransactionException(int client, long tx, String operation) {
        super(ErrorKind.UNKNOWN_TRANSACTION,
            String.format("Cannot %s transaction %d: not found in account %d", operation, tx, client));
    }
}
