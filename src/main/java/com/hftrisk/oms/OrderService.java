package com.hftrisk.oms;

import com.hftrisk.domain.enums.OrderType;
import com.hftrisk.domain.model.Order;
import com.hftrisk.domain.model.StrategyState;
import com.hftrisk.domain.vo.Commission;
import com.hftrisk.domain.vo.Price;
import com.hftrisk.domain.vo.Quantity;
import com.hftrisk.exception.RiskViolationException;
import com.hftrisk.exception.ValidationException;
import com.hftrisk.risk.RiskValidator;
import com.hftrisk.risk.StrategyRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order domain service: creates risk-checked orders and answers pre-trade questions about
 * value, commission and whether a strategy may place an order.
 *
 * <p>Neither executes nor persists orders. Execution goes through {@link OrderRouter}.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final RiskValidator riskValidator;
    private final CommissionCalculator commissionCalculator;
    private final StrategyRegistry strategyRegistry;
    private final Clock clock;

    public OrderService(
            RiskValidator riskValidator,
            CommissionCalculator commissionCalculator,
            StrategyRegistry strategyRegistry,
            Clock clock) {
        this.riskValidator = riskValidator;
        this.commissionCalculator = commissionCalculator;
        this.strategyRegistry = strategyRegistry;
        this.clock = clock;
    }

    /**
     * Builds an order from the request and runs pre-trade risk validation on it.
     *
     * @return the new PENDING order
     * @throws ValidationException if the request is malformed
     * @throws RiskViolationException if risk management blocks the order; the message starts
     *     with {@value RiskViolationException#BLOCKED_PREFIX}
     */
    public Order createOrder(CreateOrderRequest request) {
        if (request == null) {
            throw new ValidationException("request", "is required");
        }

        Order order = Order.builder()
                .clientOrderId(request.getClientOrderId())
                .strategyId(request.getStrategyId())
                .symbol(request.getSymbol())
                .exchange(request.getExchange())
                .side(request.getSide())
                .orderType(request.getOrderType())
                .timeInForce(request.getTimeInForce())
                .quantity(request.getQuantity() != null ? Quantity.of(request.getQuantity()) : null)
                .price(request.getPrice() != null ? Price.of(request.getPrice()) : null)
                .stopPrice(request.getStopPrice() != null ? Price.of(request.getStopPrice()) : null)
                .expiresAt(request.getExpiresAt())
                .clock(clock)
                .create();

        try {
            riskValidator.validateOrder(order);
        } catch (RiskViolationException e) {
            log.warn(
                    "Order blocked by risk management: strategyId={}, symbol={}, code={}, reason={}",
                    order.getStrategyId(),
                    order.getSymbol(),
                    e.getCode(),
                    e.getMessage());
            throw RiskViolationException.blocked(e);
        }

        log.debug(
                "Order created: orderId={}, strategyId={}, symbol={}, side={}, type={}, quantity={}, price={}",
                order.getId(),
                order.getStrategyId(),
                order.getSymbol(),
                order.getSide(),
                order.getOrderType(),
                order.getQuantity(),
                order.getPrice());
        return order;
    }

    /**
     * Notional value {@code quantity x price}.
     *
     * @throws ValidationException for MARKET orders or orders without a price
     */
    public BigDecimal calculateOrderValue(Order order) {
        if (order.getOrderType() == OrderType.MARKET || order.getPrice() == null || order.getPrice().isZero()) {
            throw new ValidationException("cannot calculate value without current market price");
        }
        return order.getPrice().multiply(order.getQuantity());
    }

    /** Estimated commission for the order on the given exchange. */
    public Commission calculateCommission(Order order, String exchange) {
        BigDecimal value = calculateOrderValue(order);
        return commissionCalculator.calculate(value, exchange, order.getSymbol());
    }

    /**
     * Whether the strategy may place the order now: the order must belong to the strategy,
     * pass risk validation, and the strategy must be active with enough capital. When the
     * strategy store cannot answer, the risk result alone decides.
     */
    public boolean canPlaceOrder(String strategyId, Order order) {
        if (strategyId == null || !strategyId.equals(order.getStrategyId())) {
            log.debug("Order does not belong to strategy: strategyId={}, orderStrategyId={}",
                    strategyId, order.getStrategyId());
            return false;
        }

        try {
            riskValidator.validateOrder(order);
        } catch (RiskViolationException e) {
            log.debug("Order would be blocked: strategyId={}, code={}", strategyId, e.getCode());
            return false;
        }

        Optional<StrategyState> strategy;
        try {
            strategy = strategyRegistry.findStrategy(strategyId);
        } catch (RuntimeException e) {
            log.warn("Strategy lookup failed, deciding on risk checks only: strategyId={}, reason={}",
                    strategyId, e.getMessage());
            return true;
        }
        if (strategy.isEmpty()) {
            log.debug("Strategy unknown to registry, deciding on risk checks only: strategyId={}", strategyId);
            return true;
        }

        StrategyState state = strategy.get();
        if (!state.isActive()) {
            log.debug("Strategy inactive: strategyId={}", strategyId);
            return false;
        }
        if (state.getAvailableCapital() != null && order.getPrice().isPositive()) {
            BigDecimal value = order.getPrice().multiply(order.getQuantity());
            if (state.getAvailableCapital().compareTo(value) < 0) {
                log.debug("Insufficient capital: strategyId={}, available={}, required={}",
                        strategyId, state.getAvailableCapital().toPlainString(), value.toPlainString());
                return false;
            }
        }
        return true;
    }
}
