package com.hftrisk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hftrisk.domain.enums.OrderLifecycleEventType;
import com.hftrisk.domain.enums.OrderSide;
import com.hftrisk.domain.enums.OrderStatus;
import com.hftrisk.domain.enums.OrderType;
import com.hftrisk.domain.enums.TimeInForce;
import com.hftrisk.domain.model.Order;
import com.hftrisk.domain.model.OrderLifecycleEvent;
import com.hftrisk.domain.vo.Price;
import com.hftrisk.domain.vo.Quantity;
import com.hftrisk.event.StrategyHaltEvent;
import com.hftrisk.exception.ExecutionException;
import com.hftrisk.exception.InvalidStateTransitionException;
import com.hftrisk.exception.RiskViolationException;
import com.hftrisk.observability.RiskMetricsBinder;
import com.hftrisk.oms.ExecutionGateway;
import com.hftrisk.oms.OrderRouteResult;
import com.hftrisk.oms.OrderRouter;
import com.hftrisk.risk.OrderRateProvider;
import com.hftrisk.risk.RiskService;
import com.hftrisk.risk.RiskViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OrderRouter covering the submission pipeline, rejection paths, halting and
 * resuming strategies, and cancellation.
 */
class OrderRouterTest {

    private RiskService riskService;
    private OrderRateProvider orderRateProvider;
    private ExecutionGateway executionGateway;
    private RiskMetricsBinder riskMetricsBinder;
    private OrderRouter orderRouter;

    @BeforeEach
    void setUp() {
        riskService = mock(RiskService.class);
        orderRateProvider = mock(OrderRateProvider.class);
        executionGateway = mock(ExecutionGateway.class);
        riskMetricsBinder = mock(RiskMetricsBinder.class);
        orderRouter = new OrderRouter(riskService, orderRateProvider, executionGateway, riskMetricsBinder);
    }

    private Order pendingOrder() {
        return Order.builder()
                .strategyId("strat-1")
                .symbol("BTC/USDT")
                .exchange("binance")
                .side(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .timeInForce(TimeInForce.GTC)
                .quantity(Quantity.of("1"))
                .price(Price.of("100"))
                .create();
    }

    // ==============================
    // SUBMISSION
    // ==============================

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Accepted order is confirmed with exchange id and latency")
        void accepted() {
            Order order = pendingOrder();
            when(executionGateway.submit(order)).thenReturn("EX-42");

            OrderRouteResult result = orderRouter.submit(order);

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getExchangeOrderId()).isEqualTo("EX-42");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
            assertThat(order.getExchangeOrderId()).isEqualTo("EX-42");
            assertThat(order.getLatency().isNegative()).isFalse();
            assertThat(order.getEvents()).extracting(OrderLifecycleEvent::type).contains(
                    OrderLifecycleEventType.CONFIRMED,
                    OrderLifecycleEventType.EXCHANGE_ORDER_ID_ASSIGNED,
                    OrderLifecycleEventType.LATENCY_RECORDED);
            verify(riskService).validateOrder(order);
            verify(orderRateProvider).recordOrder("strat-1");
            verify(riskMetricsBinder).recordOrderRouted();
        }

        @Test
        @DisplayName("Risk violation rejects the order without reaching the gateway")
        void riskViolation_rejected() {
            Order order = pendingOrder();
            doThrow(new RiskViolationException(
                            "strat-1", RiskViolation.of(RiskViolation.ORDER_RATE_EXCEEDED, "too many orders")))
                    .when(riskService)
                    .validateOrder(order);

            OrderRouteResult result = orderRouter.submit(order);

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getRejectionReason()).startsWith("order blocked by risk management");
            assertThat(order.isRejected()).isTrue();
            assertThat(order.getErrorMessage()).isEqualTo(result.getRejectionReason());
            verify(executionGateway, never()).submit(any());
            verify(orderRateProvider, never()).recordOrder(any());
            verify(riskMetricsBinder).recordOrderRejected();
        }

        @Test
        @DisplayName("Gateway failure rejects the confirmed order")
        void gatewayFailure_rejected() {
            Order order = pendingOrder();
            when(executionGateway.submit(order)).thenThrow(new ExecutionException("venue unreachable"));

            OrderRouteResult result = orderRouter.submit(order);

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getRejectionReason()).contains("venue unreachable");
            assertThat(order.isRejected()).isTrue();
            assertThat(order.getExchangeOrderId()).isNull();
        }

        @Test
        @DisplayName("Unexpected gateway error rejects the order instead of leaving it working")
        void unexpectedGatewayError_rejected() {
            Order order = pendingOrder();
            when(executionGateway.submit(order)).thenThrow(new IllegalStateException("connection pool closed"));

            OrderRouteResult result = orderRouter.submit(order);

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getRejectionReason()).isEqualTo("execution failed: connection pool closed");
            assertThat(order.isRejected()).isTrue();
            assertThat(order.getExchangeOrderId()).isNull();
            verify(riskMetricsBinder).recordOrderRejected();
            verify(riskMetricsBinder, never()).recordOrderRouted();
        }

        @Test
        @DisplayName("Submitting a non-pending order is a caller error")
        void nonPending_throws() {
            Order order = pendingOrder();
            order.cancel();

            assertThatThrownBy(() -> orderRouter.submit(order))
                    .isInstanceOf(InvalidStateTransitionException.class);
            verify(riskService, never()).validateOrder(any());
        }
    }

    // ==============================
    // HALTS
    // ==============================

    @Nested
    @DisplayName("Strategy Halts")
    class Halts {

        @Test
        @DisplayName("Halted strategy is refused until resumed")
        void halted_refusedUntilResumed() {
            orderRouter.onStrategyHalt(new StrategyHaltEvent(this, "strat-1", "drawdown 15%", "evt-1"));
            assertThat(orderRouter.isHalted("strat-1")).isTrue();

            Order refused = pendingOrder();
            OrderRouteResult result = orderRouter.submit(refused);

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getRejectionReason()).contains("halted");
            verify(riskService, never()).validateOrder(any());

            orderRouter.resumeStrategy("strat-1");
            Order accepted = pendingOrder();
            when(executionGateway.submit(accepted)).thenReturn("EX-1");

            assertThat(orderRouter.submit(accepted).isAccepted()).isTrue();
        }
    }

    // ==============================
    // CANCELLATION
    // ==============================

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Working order is canceled at the venue and locally")
        void workingOrder_canceled() {
            Order order = pendingOrder();
            when(executionGateway.submit(order)).thenReturn("EX-7");
            orderRouter.submit(order);

            orderRouter.cancel(order);

            verify(executionGateway).cancel("EX-7");
            assertThat(order.isCanceled()).isTrue();
        }

        @Test
        @DisplayName("Venue refusal leaves the order working")
        void venueRefusal_unchanged() {
            Order order = pendingOrder();
            when(executionGateway.submit(order)).thenReturn("EX-8");
            orderRouter.submit(order);
            doThrow(new ExecutionException("too late")).when(executionGateway).cancel("EX-8");

            assertThatThrownBy(() -> orderRouter.cancel(order)).isInstanceOf(ExecutionException.class);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
        }
    }
}
