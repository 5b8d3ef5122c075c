package com.flagship.bookkeeping.money;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.bookkeeping.exception.InvalidAmountException;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision monetary amount.
 *
 * Every value is held at scale 2, rounded HALF_UP on construction, so two amounts
 * that print the same are equal. All arithmetic in the posting engines goes through
 * this type; conversion to and from {@link BigDecimal} happens only at the
 * persistence boundary.
 *
 * Parsing policy:
 * - null, blank string: {@link #ZERO}
 * - unparsable text, NaN, infinity: {@link InvalidAmountException}
 */
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = round(amount);
    }

    public static Money of(BigDecimal value) {
        return value == null ? ZERO : new Money(value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Money of(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        try {
            return new Money(new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidAmountException(value);
        }
    }

    public static Money of(Number value) {
        if (value == null) {
            return ZERO;
        }
        if (value instanceof BigDecimal) {
            return of((BigDecimal) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidAmountException(String.valueOf(value));
            }
            // toString keeps the shortest decimal form, avoiding binary drift
            return new Money(new BigDecimal(Double.toString(d)));
        }
        return of(value.toString());
    }

    public Money add(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public Money abs() {
        return amount.signum() < 0 ? negate() : this;
    }

    /** Larger of this and zero. */
    public Money positivePart() {
        return amount.signum() > 0 ? this : ZERO;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * Equality at the configured precision. Same as {@link #equals(Object)}
     * because every instance is already normalized to scale 2.
     */
    public boolean isEqualTo(Money other) {
        return other != null && amount.compareTo(other.amount) == 0;
    }

    public static BigDecimal round(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(SCALE, ROUNDING) : value.setScale(SCALE, ROUNDING);
    }

    public BigDecimal toBigDecimal() {
        return amount;
    }

    public double toDisplayNumber() {
        return amount.doubleValue();
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @JsonValue
    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
