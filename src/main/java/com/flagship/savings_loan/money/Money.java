package com.flagship.savings_loan.money;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-precision monetary amount.
 *
 * Every value is held at {@link #SCALE} decimal places. Multiplication by a rate
 * rounds back to that scale with HALF_EVEN, so a value that went through any number
 * of operations is still exactly representable in the ledger.
 */
@Value
public class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    /**
     * Largest amount a ledger column (NUMERIC(19,2)) holds.
     */
    public static final Money MAX = new Money(new BigDecimal("99999999999999999.99"));

    BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING);
    }

    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(amount);
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * True when {@code amount} has no digits below cents, so {@link #of} keeps it unchanged.
     * Trailing zeros do not count: "10.500" qualifies, "10.005" does not.
     */
    public static boolean isWholeCents(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= SCALE;
    }

    public Money plus(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    /**
     * Multiplies by a rate (e.g. 0.20) and rounds the product to cents.
     */
    public Money times(BigDecimal rate) {
        Objects.requireNonNull(rate, "rate");
        return new Money(amount.multiply(rate));
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean exceedsMax() {
        return isGreaterThan(MAX);
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
