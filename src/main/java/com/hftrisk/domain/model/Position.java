package com.hftrisk.domain.model;

import com.hftrisk.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A strategy's open position in one symbol.
 *
 * <p>Quantity is absolute; direction is carried by {@code side} (BUY = long, SELL = short).
 * Positions are owned by the external position store; the risk core only reads them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String strategyId;
    private String symbol;
    private String exchange;
    private OrderSide side;

    /** Absolute position size. */
    private BigDecimal quantity;

    private BigDecimal averagePrice;

    /** Latest mark price. Falls back to averagePrice for notional when absent. */
    private BigDecimal markPrice;

    /** Negative when the position is losing. */
    private BigDecimal unrealizedPnl;

    private BigDecimal margin;
    private BigDecimal maintenanceMargin;

    private Instant updatedAt;

    /** Notional value: quantity x (mark price, or average price if no mark is known). */
    public BigDecimal notional() {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal reference = markPrice != null ? markPrice : averagePrice;
        return reference != null ? quantity.abs().multiply(reference) : BigDecimal.ZERO;
    }
}
