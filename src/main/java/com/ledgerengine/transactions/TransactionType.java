package com.ledgerengine.transactions;

import java.util.Locale;

/**
 * Types of input transactions.
 *
 * Deposits and withdrawals move money and are stored by the account so later
 * records can reference them. Disputes, resolves and chargebacks only change the
 * state of a stored transaction.
 */
public enum TransactionType {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DISPUTE("dispute", false),
    RESOLVE("resolve", false),
    CHARGEBACK("chargeback", false),

    /**
     * Any type token not listed above. The raw token travels with the
     * {@link Transaction} so the failure can name it.
     */
    UNKNOWN(null, false);

    private final String token;
    private final boolean monetary;

    TransactionType(String token, boolean monetary) {
        this.token = token;
        this.monetary = monetary;
    }

    /**
     * Case-insensitive lookup; unrecognized tokens map to {@link #UNKNOWN}.
     */
    public static TransactionType fromToken(String token) {
        if (token == null) {
            return UNKNOWN;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (normalized.equals(type.token)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public String getToken() {
        return token;
    }

    /**
     * Whether this type carries an amount and is kept in the account history.
     */
    public boolean isMonetary() {
        return monetary;
    }
}
