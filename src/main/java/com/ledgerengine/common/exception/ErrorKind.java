package com.ledgerengine.common.exception;

/**
 * Reasons a record can fail to apply to the ledger.
 *
 * Every kind except {@link #IO_ERROR} is local to a single record: the engine
 * records it as a failed record and keeps going.
 */
public enum ErrorKind {
    /**
     * The input row could not be turned into a well-formed transaction.
     */
    PARSE_ERROR,

    /**
     * Deposit or withdrawal with a missing or non-positive amount.
     */
    INVALID_AMOUNT,

    INSUFFICIENT_FUNDS,

    /**
     * Dispute, resolve or chargeback referencing a transaction the account never stored.
     */
    UNKNOWN_TRANSACTION,

    NOT_DISPUTED,

    ALREADY_DISPUTED,

    ACCOUNT_LOCKED,

    UNRECOGNIZED_TYPE,

    /**
     * Input could not be read or output could not be written. Fatal to the run.
     */
    IO_ERROR
}
