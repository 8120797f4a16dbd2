package com.ledgerengine.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    void testOf_NormalizesToFourDecimals() {
        assertEquals("5.0000", Money.of("5").toString());
        assertEquals("2.7183", Money.of("2.71828").toString());
        assertEquals("0.0001", Money.of("0.00005").toString());
    }

    @Test
    void testOf_NullAmountRejected() {
        assertThrows(IllegalArgumentException.class, () -> Money.of((BigDecimal) null));
    }

    @Test
    void testEquality_IgnoresInputScale() {
        assertEquals(Money.of("1.5"), Money.of("1.50000"));
        assertEquals(Money.zero(), Money.of("0"));
    }

    @Test
    void testArithmetic() {
        Money a = Money.of("10.1234");
        Money b = Money.of("0.1234");

        assertEquals(Money.of("10.2468"), a.add(b));
        assertEquals(Money.of("10"), a.subtract(b));
        assertTrue(b.subtract(a).isNegative());
        assertTrue(a.isGreaterThan(b));
        assertTrue(b.isLessThan(a));
        assertTrue(a.subtract(a).isZero());
        assertFalse(Money.zero().isPositive());
    }
}
