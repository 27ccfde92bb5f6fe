package com.hftrisk.oms;

import com.hftrisk.domain.enums.OrderStatus;
import com.hftrisk.domain.model.Order;
import com.hftrisk.event.StrategyHaltEvent;
import com.hftrisk.exception.ExecutionException;
import com.hftrisk.exception.InvalidStateTransitionException;
import com.hftrisk.exception.RiskViolationException;
import com.hftrisk.observability.RiskMetricsBinder;
import com.hftrisk.risk.OrderRateProvider;
import com.hftrisk.risk.RiskService;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Single entry point for sending orders to the venue.
 *
 * <p>Submission pipeline:
 * <ol>
 *   <li>Halt check: strategies stopped by a {@link StrategyHaltEvent} are refused</li>
 *   <li>Risk validation at submission time through {@link RiskService}</li>
 *   <li>Record the submission for order-rate limiting</li>
 *   <li>Confirm the order and hand it to the {@link ExecutionGateway}</li>
 *   <li>Store the exchange order id and the acknowledgement latency</li>
 * </ol>
 *
 * <p>Any refusal rejects the order itself and returns a rejected {@link OrderRouteResult};
 * only misuse (submitting an order that is not PENDING) throws.
 */
@Service
public class OrderRouter {

    private static final Logger log = LoggerFactory.getLogger(OrderRouter.class);

    private final RiskService riskService;
    private final OrderRateProvider orderRateProvider;
    private final ExecutionGateway executionGateway;
    private final RiskMetricsBinder riskMetricsBinder;

    private final Set<String> haltedStrategies = ConcurrentHashMap.newKeySet();

    public OrderRouter(
            RiskService riskService,
            OrderRateProvider orderRateProvider,
            ExecutionGateway executionGateway,
            RiskMetricsBinder riskMetricsBinder) {
        this.riskService = riskService;
        this.orderRateProvider = orderRateProvider;
        this.executionGateway = executionGateway;
        this.riskMetricsBinder = riskMetricsBinder;
    }

    /**
     * Validates and submits a PENDING order.
     *
     * @throws InvalidStateTransitionException if the order is not PENDING
     */
    public OrderRouteResult submit(Order order) {
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new InvalidStateTransitionException(order.getId(), order.getStatus(), "submit");
        }

        if (haltedStrategies.contains(order.getStrategyId())) {
            return reject(order, "strategy " + order.getStrategyId() + " is halted by risk management");
        }

        try {
            riskService.validateOrder(order);
        } catch (RiskViolationException e) {
            return reject(order, RiskViolationException.blocked(e).getMessage());
        }

        orderRateProvider.recordOrder(order.getStrategyId());
        order.confirm();

        long startNanos = System.nanoTime();
        String exchangeOrderId;
        try {
            exchangeOrderId = executionGateway.submit(order);
        } catch (ExecutionException e) {
            log.error("Execution gateway refused order: orderId={}, strategyId={}, reason={}",
                    order.getId(), order.getStrategyId(), e.getMessage());
            return reject(order, "execution failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Execution gateway failed: orderId={}, strategyId={}",
                    order.getId(), order.getStrategyId(), e);
            return reject(order, "execution failed: " + e.getMessage());
        }

        order.setExchangeOrderId(exchangeOrderId);
        order.setLatency(Duration.ofNanos(System.nanoTime() - startNanos));
        riskMetricsBinder.recordOrderRouted();

        log.info(
                "Order routed: orderId={}, exchangeOrderId={}, strategyId={}, symbol={}, side={}, quantity={}, latencyMicros={}",
                order.getId(),
                exchangeOrderId,
                order.getStrategyId(),
                order.getSymbol(),
                order.getSide(),
                order.getQuantity(),
                order.getLatency().toNanos() / 1_000);
        return OrderRouteResult.accepted(order.getId(), exchangeOrderId);
    }

    /**
     * Cancels a working order at the venue, then locally.
     *
     * @throws InvalidStateTransitionException if the order is already terminal
     * @throws ExecutionException if the venue refuses the cancel; the order is left unchanged
     */
    public void cancel(Order order) {
        if (order.isTerminal()) {
            throw new InvalidStateTransitionException(order.getId(), order.getStatus(), "cancel");
        }
        if (order.getExchangeOrderId() != null) {
            executionGateway.cancel(order.getExchangeOrderId());
        }
        order.cancel();
        log.info("Order canceled: orderId={}, strategyId={}", order.getId(), order.getStrategyId());
    }

    /** Stops all further submissions for a strategy stopped by risk management. */
    @EventListener
    public void onStrategyHalt(StrategyHaltEvent event) {
        if (haltedStrategies.add(event.getStrategyId())) {
            log.error("Strategy halted, new orders will be rejected: strategyId={}, riskEventId={}, reason={}",
                    event.getStrategyId(), event.getRiskEventId(), event.getReason());
        }
    }

    /** Lifts a halt. */
    public void resumeStrategy(String strategyId) {
        if (haltedStrategies.remove(strategyId)) {
            log.info("Strategy resumed: strategyId={}", strategyId);
        }
    }

    public boolean isHalted(String strategyId) {
        return haltedStrategies.contains(strategyId);
    }

    private OrderRouteResult reject(Order order, String reason) {
        order.reject(reason);
        riskMetricsBinder.recordOrderRejected();
        log.warn("Order rejected: orderId={}, strategyId={}, symbol={}, reason={}",
                order.getId(), order.getStrategyId(), order.getSymbol(), reason);
        return OrderRouteResult.rejected(order.getId(), reason);
    }
}
