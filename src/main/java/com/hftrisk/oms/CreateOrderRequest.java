package com.hftrisk.oms;

import com.hftrisk.domain.enums.OrderSide;
import com.hftrisk.domain.enums.OrderType;
import com.hftrisk.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound order parameters for {@link OrderService#createOrder(CreateOrderRequest)}.
 *
 * <p>Carries raw values only; shape validation happens when the order is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    private String strategyId;

    /** Caller-assigned id for idempotent resubmission. Optional. */
    private String clientOrderId;

    private String symbol;
    private String exchange;
    private OrderSide side;
    private OrderType orderType;
    private BigDecimal quantity;

    /** Limit price. Null for MARKET orders. */
    private BigDecimal price;

    /** Trigger price for STOP and STOP_LIMIT orders. */
    private BigDecimal stopPrice;

    private TimeInForce timeInForce;

    /** Required when timeInForce is GTD. */
    private Instant expiresAt;
}
