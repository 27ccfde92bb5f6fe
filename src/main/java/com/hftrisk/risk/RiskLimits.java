package com.hftrisk.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable risk limit snapshot for one strategy (or the global default set).
 *
 * <p>Snapshots are fetched per check from {@link RiskLimitsProvider}. When a strategy has no
 * limits of its own, the {@link RiskChecker} substitutes the default set it was constructed
 * with; {@link #defaults()} documents the built-in values used when configuration does not
 * override them.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    /** Maximum absolute position size per symbol, in units. */
    BigDecimal maxPositionSize;

    /** Maximum quantity of a single order, in units. */
    BigDecimal maxOrderSize;

    /** Maximum tolerated loss (positive number, quote currency). */
    BigDecimal maxDailyLoss;

    /** Maximum peak-to-trough decline, in percent (10 = 10%). */
    BigDecimal maxDrawdownPercent;

    /** Maximum orders a strategy may submit per rate window. */
    int maxOrdersPerSecond;

    /** Maximum aggregate notional of positions and the incoming order. */
    BigDecimal maxExposure;

    BigDecimal stopLossPercent;
    BigDecimal takeProfitPercent;

    /**
     * Built-in default limits: position 1000, order 100, daily loss 10000, drawdown 10%,
     * 100 orders/s, exposure 100000, stop loss 2%, take profit 5%.
     */
    public static RiskLimits defaults() {
        return RiskLimits.builder()
                .maxPositionSize(new BigDecimal("1000"))
                .maxOrderSize(new BigDecimal("100"))
                .maxDailyLoss(new BigDecimal("10000"))
                .maxDrawdownPercent(new BigDecimal("10"))
                .maxOrdersPerSecond(100)
                .maxExposure(new BigDecimal("100000"))
                .stopLossPercent(new BigDecimal("2"))
                .takeProfitPercent(new BigDecimal("5"))
                .build();
    }
}
