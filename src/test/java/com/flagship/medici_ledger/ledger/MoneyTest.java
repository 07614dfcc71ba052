package com.flagship.medici_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Decimal strings are held as exact cents")
    void testParsesDecimalStrings() {
        assertEquals(100000L, Money.of("1000").getCents());
        assertEquals(1250L, Money.of("12.5").getCents());
        assertEquals(-333L, Money.of("-3.33").getCents());
        assertEquals("1000.00", Money.of("1000").toPlainString());
    }

    @Test
    @DisplayName("Extra fractional digits are rounded half up")
    void testRoundsHalfUp() {
        assertEquals(Money.of("0.01"), Money.of("0.005"));
        assertEquals(Money.of("0.00"), Money.of("0.004"));
        assertEquals(Money.of("-0.01"), Money.of("-0.005"));
    }

    @Test
    @DisplayName("Arithmetic is exact where binary floating point drifts")
    void testExactArithmetic() {
        Money total = Money.ZERO;
        for (int i = 0; i < 10; i++) {
            total = total.plus(Money.of("0.10"));
        }

        assertEquals(Money.of("1.00"), total, "Ten dimes must be exactly one unit");
        assertEquals(Money.of("0.30"), Money.of("0.10").plus(Money.of("0.20")));
        assertEquals(Money.of("-50.00"), Money.of("100.00").minus(Money.of("150.00")));
    }

    @Test
    @DisplayName("Equality ignores the scale of the input")
    void testEqualityIgnoresInputScale() {
        assertEquals(Money.of("1000"), Money.of("1000.00"));
        assertEquals(Money.of(new BigDecimal("1000.000")), Money.of("1000"));
        assertEquals(Money.of("1000").hashCode(), Money.of("1000.00").hashCode());
        assertNotEquals(Money.of("1000.00"), Money.of("1000.01"));
    }

    @Test
    @DisplayName("Even split rounds each share to the cent")
    void testDivideEvenly() {
        assertEquals(Money.of("500.00"), Money.of("1000.00").divideEvenly(2));
        assertEquals(Money.of("33.33"), Money.of("100.00").divideEvenly(3));
        assertEquals(Money.of("0.01"), Money.of("0.01").divideEvenly(1));
        assertThrows(IllegalArgumentException.class, () -> Money.of("1.00").divideEvenly(0));
    }

    @Test
    @DisplayName("Blank and non-numeric text is rejected")
    void testRejectsNonNumericText() {
        assertThrows(NumberFormatException.class, () -> Money.of(""));
        assertThrows(NumberFormatException.class, () -> Money.of("   "));
        assertThrows(NumberFormatException.class, () -> Money.of("ten ducats"));
        assertThrows(NumberFormatException.class, () -> Money.of((String) null));
    }

    @Test
    @DisplayName("Sign helpers and ordering")
    void testSignAndOrdering() {
        Money negative = Money.of("-2.50");

        assertTrue(negative.isNegative());
        assertEquals(Money.of("2.50"), negative.abs());
        assertEquals(Money.of("2.50"), negative.negate());
        assertTrue(Money.ZERO.isZero());
        assertTrue(Money.of("0.01").isPositive());
        assertTrue(Money.of("1.00").compareTo(Money.of("0.99")) > 0);
    }

    @Test
    @DisplayName("Overflow fails instead of wrapping around")
    void testOverflow() {
        Money max = Money.ofCents(Long.MAX_VALUE);
        assertThrows(ArithmeticException.class, () -> max.plus(Money.ofCents(1)));
    }
}
