package com.hftrisk.domain.vo;

import com.hftrisk.exception.ValidationException;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable non-negative tradeable quantity. Crypto venues trade fractional units, so the
 * value is a {@link BigDecimal} rather than a lot count.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Quantity implements Comparable<Quantity> {

    private static final Quantity ZERO = new Quantity(BigDecimal.ZERO);

    BigDecimal value;

    public static Quantity of(BigDecimal value) {
        if (value == null) {
            throw new ValidationException("quantity", "must not be null");
        }
        if (value.signum() < 0) {
            throw new ValidationException("quantity", "must not be negative: " + value);
        }
        return new Quantity(value);
    }

    public static Quantity of(String value) {
        try {
            return of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            throw new ValidationException("quantity", "is not a decimal number: " + value);
        }
    }

    public static Quantity zero() {
        return ZERO;
    }

    public Quantity add(Quantity other) {
        return new Quantity(value.add(other.value));
    }

    /** Subtracts {@code other}; a negative result is rejected. */
    public Quantity subtract(Quantity other) {
        BigDecimal result = value.subtract(other.value);
        if (result.signum() < 0) {
            throw new ValidationException("quantity", "cannot go negative: " + value + " - " + other.value);
        }
        return new Quantity(result);
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isGreaterThan(Quantity other) {
        return value.compareTo(other.value) > 0;
    }

    @Override
    public int compareTo(Quantity other) {
        return value.compareTo(other.value);
    }

    /** Numeric equality: {@code 1.0} equals {@code 1}. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quantity)) {
            return false;
        }
        return value.compareTo(((Quantity) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
