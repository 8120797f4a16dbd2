package com.ledgerengine.common.exception;

/**
 * Thrown when disputing a transaction that is already under dispute.
 */
public class AlreadyDisputedException extends LedgerEngineException {

    public AlreadyDisputedException(int client, long tx) {
        super(ErrorKind.ALREADY_DISPUTED,
            String.format("Cannot dispute transaction %d in account %d: transaction is already disputed",
                tx, client));
    }
}
