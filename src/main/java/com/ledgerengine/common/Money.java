package com.ledgerengine.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a monetary amount.
 * Uses BigDecimal with a fixed scale of four decimal digits, the precision
 * the ledger works with for every balance and transaction amount.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money {

    public static final int SCALE = 4;

    private static final Money ZERO = new Money(BigDecimal.ZERO.setScale(SCALE));

    BigDecimal amount;

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount.setScale(SCALE, RoundingMode.HALF_UP));
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static Money zero() {
        return ZERO;
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public boolean isGreaterThan(Money other) {
        return this.amount.compareTo(other.amount) > 0;
    }

    public boolean isLessThan(Money other) {
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    public boolean isZero() {
        return this.amount.signum() == 0;
    }

    /**
     * Plain notation with exactly four decimal digits, e.g. {@code 1.5000}.
     */
    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
