package com.ledgerengine.common.exception;

/**
 * Thrown when resolving or charging back a transaction that is not under dispute.
 */
public class NotDisputedException extends LedgerEngineException {

    public NotDisputedException(int client, long tx, String operation) {
        super(ErrorKind.NOT_DISPUTED,
            String.format("Cannot %s transaction %d in account %d: transaction is not disputed",
                operation, tx, client));
    }
}
