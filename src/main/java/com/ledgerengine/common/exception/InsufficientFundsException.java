package com.ledgerengine.common.exception;

import com.ledgerengine.common.Money;

/**
 * Thrown when an account has insufficient funds for a withdrawal.
 */
public class InsufficientFundsException extends LedgerEngineException {

    public InsufficientFundsException(int client, Money required, Money total) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in account %d. Required: %s, Total: %s",
                client, required, total));
    }
}
