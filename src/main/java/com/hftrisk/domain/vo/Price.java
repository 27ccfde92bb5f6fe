package com.hftrisk.domain.vo;

import com.hftrisk.exception.ValidationException;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable non-negative price. Zero is legal and means "no price" (market orders).
 * Arithmetic is decimal-exact; callers choose the rounding where a division happens.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Price implements Comparable<Price> {

    private static final Price ZERO = new Price(BigDecimal.ZERO);

    BigDecimal value;

    public static Price of(BigDecimal value) {
        if (value == null) {
            throw new ValidationException("price", "must not be null");
        }
        if (value.signum() < 0) {
            throw new ValidationException("price", "must not be negative: " + value);
        }
        return new Price(value);
    }

    public static Price of(String value) {
        try {
            return of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            throw new ValidationException("price", "is not a decimal number: " + value);
        }
    }

    public static Price zero() {
        return ZERO;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    /** Notional value of {@code quantity} units at this price. */
    public BigDecimal multiply(Quantity quantity) {
        return value.multiply(quantity.getValue());
    }

    @Override
    public int compareTo(Price other) {
        return value.compareTo(other.value);
    }

    /** Numeric equality: {@code 1.0} equals {@code 1}. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Price)) {
            return false;
        }
        return value.compareTo(((Price) o).value) == 0;
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
