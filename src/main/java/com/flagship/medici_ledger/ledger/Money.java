package com.flagship.medici_ledger.ledger;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exact monetary amount with two fractional digits.
 *
 * Stored as a whole number of cents, so addition, subtraction and comparison
 * never go through binary floating point. Values coming from decimal strings
 * or BigDecimals with more than two fractional digits are rounded HALF_UP.
 *
 * Key invariant: two amounts are equal only if they hold the same number of cents.
 */
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final Money ZERO = new Money(0L);

    private final long cents;

    private Money(long cents) {
        this.cents = cents;
    }

    public static Money ofCents(long cents) {
        return cents == 0L ? ZERO : new Money(cents);
    }

    /**
     * Parses a decimal string such as {@code "1000"}, {@code "12.5"} or {@code "-3.333"}.
     *
     * @throws NumberFormatException if the text is blank or not a decimal number
     */
    public static Money of(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new NumberFormatException("Amount is blank");
        }
        return of(new BigDecimal(amount.trim()));
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new NumberFormatException("Amount is null");
        }
        BigDecimal scaled = amount.setScale(SCALE, RoundingMode.HALF_UP);
        return ofCents(scaled.unscaledValue().longValueExact());
    }

    public long getCents() {
        return cents;
    }

    public Money plus(Money other) {
        return ofCents(Math.addExact(cents, other.cents));
    }

    public Money minus(Money other) {
        return ofCents(Math.subtractExact(cents, other.cents));
    }

    public Money negate() {
        return ofCents(Math.negateExact(cents));
    }

    public Money abs() {
        return cents < 0 ? negate() : this;
    }

    public Money times(int factor) {
        return ofCents(Math.multiplyExact(cents, (long) factor));
    }

    /**
     * Divides this amount into {@code parts} equal shares, each rounded HALF_UP to the cent.
     * The shares do not necessarily add back up to this amount.
     */
    public Money divideEvenly(int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("Parts must be positive: " + parts);
        }
        BigDecimal share = BigDecimal.valueOf(cents)
            .divide(BigDecimal.valueOf(parts), 0, RoundingMode.HALF_UP);
        return ofCents(share.longValueExact());
    }

    public boolean isZero() {
        return cents == 0L;
    }

    public boolean isNegative() {
        return cents < 0L;
    }

    public boolean isPositive() {
        return cents > 0L;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(cents, SCALE);
    }

    /**
     * Plain decimal rendering with exactly two fractional digits, e.g. {@code "1000.00"}.
     */
    public String toPlainString() {
        return toBigDecimal().toPlainString();
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(cents, other.cents);
    }

    @Override
    public String toString() {
        return toPlainString();
    }
}
