package com.ledgerengine.common.exception;

/**
 * Thrown when a transaction targets an account locked by a chargeback.
 */
public class AccountLockedException extends LedgerEngineException {

    public AccountLockedException(int client) {
        super(ErrorKind.ACCOUNT_LOCKED, "Cannot process transaction: account " + client + " is locked");
    }
}
