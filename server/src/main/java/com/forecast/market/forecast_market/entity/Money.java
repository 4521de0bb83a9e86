package com.forecast.market.forecast_market.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * Fixed-precision amount for stakes, payouts, balances and volumes.
 *
 * Every payout identity of the settlement model (win return = stake + profit,
 * loss refund = stake - loss amount) is computed on this type, so it never
 * goes through double arithmetic. Scale is fixed at 8 decimal places with
 * banker's rounding.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 8;
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    /**
     * Create Money from double. Goes through {@link BigDecimal#valueOf(double)}
     * so {@code Money.of(0.1)} is exactly one tenth.
     */
    public static Money of(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Amount must be finite: " + amount);
        }
        return new Money(BigDecimal.valueOf(amount));
    }

    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return new Money(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    public static Money sum(Collection<Money> amounts) {
        BigDecimal total = BigDecimal.ZERO;
        for (Money m : amounts) {
            total = total.add(m.amount);
        }
        return new Money(total);
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public Money multiply(BigDecimal factor) {
        return new Money(this.amount.multiply(factor));
    }

    /**
     * Ratio of this amount to {@code divisor}, as a plain double.
     * Used for percentages (capital at risk, stake shares), never for payouts.
     */
    public double ratioTo(Money divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return this.amount.divide(divisor.amount, 12, ROUNDING_MODE).doubleValue();
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    public Money max(Money other) {
        return this.compareTo(other) >= 0 ? this : other;
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

    public boolean isGreaterThan(Money other) {
        return this.compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return this.compareTo(other) < 0;
    }

    public BigDecimal toBigDecimal() {
        return amount;
    }

    /**
     * Display and analytics only.
     */
    public double toDouble() {
        return amount.doubleValue();
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return amount.compareTo(((Money) obj).amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return amount.stripTrailingZeros().toPlainString();
    }
}
