package com.ledgerengine.accounts;

import com.ledgerengine.common.Money;
import com.ledgerengine.transactions.Transaction;
import lombok.Getter;
import lombok.ToString;

/**
 * A deposit or withdrawal kept in an account's history so that later
 * dispute, resolve and chargeback records can find the original amount.
 */
@Getter
@ToString
public class StoredTransaction {

    private final Transaction transaction;

    private boolean disputed;

    StoredTransaction(Transaction transaction) {
        this.transaction = transaction;
    }

    public long getTx() {
        return transaction.getTx();
    }

    public Money getAmount() {
        return transaction.getAmount();
    }

    void markDisputed() {
        this.disputed = true;
    }

    void clearDisputed() {
        this.disputed = false;
    }
}
