package com.ledgerengine.transactions;

import com.ledgerengine.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * A single input record, as parsed from one row of the transaction file.
 *
 * The amount is only meaningful for deposits and withdrawals and is null
 * when the row did not carry one.
 */
@Value
@Builder
public class Transaction {

    TransactionType type;

    /**
     * Type token exactly as it appeared in the input.
     */
    String rawType;

    int client;

    long tx;

    Money amount;

    public boolean hasAmount() {
        return amount != null;
    }

    public static Transaction deposit(int client, long tx, Money amount) {
        return monetary(TransactionType.DEPOSIT, client, tx, amount);
    }

    public static Transaction withdrawal(int client, long tx, Money amount) {
        return monetary(TransactionType.WITHDRAWAL, client, tx, amount);
    }

    public static Transaction dispute(int client, long tx) {
        return reference(TransactionType.DISPUTE, client, tx);
    }

    public static Transaction resolve(int client, long tx) {
        return reference(TransactionType.RESOLVE, client, tx);
    }

    public static Transaction chargeback(int client, long tx) {
        return reference(TransactionType.CHARGEBACK, client, tx);
    }

    private static Transaction monetary(TransactionType type, int client, long tx, Money amount) {
        return Transaction.builder()
            .type(type)
            .rawType(type.getToken())
            .client(client)
            .tx(tx)
            .amount(amount)
            .build();
    }

    private static Transaction reference(TransactionType type, int client, long tx) {
        return Transaction.builder()
            .type(type)
            .rawType(type.getToken())
            .client(client)
            .tx(tx)
            .build();
    }
}
