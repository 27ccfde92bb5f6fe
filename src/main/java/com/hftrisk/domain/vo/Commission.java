package com.hftrisk.domain.vo;

import com.hftrisk.exception.ValidationException;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable commission amount with its settlement asset (e.g. 0.25 USDT).
 * Accumulation keeps the asset of the most recent fill.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Commission {

    BigDecimal amount;
    String asset;

    public static Commission of(BigDecimal amount, String asset) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("commission", "amount must be non-negative: " + amount);
        }
        return new Commission(amount, asset != null ? asset : "");
    }

    public static Commission zero() {
        return new Commission(BigDecimal.ZERO, "");
    }

    public static Commission zero(String asset) {
        return new Commission(BigDecimal.ZERO, asset);
    }

    /** Returns the summed amount, settled in {@code other}'s asset. */
    public Commission add(Commission other) {
        return new Commission(amount.add(other.amount), other.asset);
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }
}
