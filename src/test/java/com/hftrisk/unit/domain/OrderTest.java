package com.hftrisk.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hftrisk.domain.enums.OrderLifecycleEventType;
import com.hftrisk.domain.enums.OrderSide;
import com.hftrisk.domain.enums.OrderStatus;
import com.hftrisk.domain.enums.OrderType;
import com.hftrisk.domain.enums.TimeInForce;
import com.hftrisk.domain.model.Order;
import com.hftrisk.domain.model.OrderLifecycleEvent;
import com.hftrisk.domain.vo.Commission;
import com.hftrisk.domain.vo.Price;
import com.hftrisk.domain.vo.Quantity;
import com.hftrisk.exception.InvalidStateTransitionException;
import com.hftrisk.exception.ValidationException;
import com.hftrisk.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the Order entity covering creation validation, the status state machine,
 * fill accounting, expiry and the lifecycle audit trail.
 */
class OrderTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
    }

    private Order.OrderBuilder limitBuy(String quantity, String price) {
        return Order.builder()
                .strategyId("strat-1")
                .symbol("BTC/USDT")
                .exchange("binance")
                .side(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .timeInForce(TimeInForce.GTC)
                .quantity(Quantity.of(quantity))
                .price(Price.of(price))
                .clock(clock);
    }

    private Order confirmedOrder(String quantity, String price) {
        Order order = limitBuy(quantity, price).create();
        order.confirm();
        return order;
    }

    // ==============================
    // CREATION
    // ==============================

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("Valid limit order starts PENDING with one CREATED event")
        void validOrder_pendingWithCreatedEvent() {
            Order order = limitBuy("1.5", "50000").create();

            assertThat(order.getId()).isNotBlank();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getFilledQuantity().isZero()).isTrue();
            assertThat(order.getRemainingQuantity()).isEqualTo(order.getQuantity());
            assertThat(order.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
            assertThat(order.getEvents()).hasSize(1);
            assertThat(order.getEvents().get(0).type()).isEqualTo(OrderLifecycleEventType.CREATED);
        }

        @Test
        @DisplayName("Every order gets a distinct id")
        void distinctIds() {
            assertThat(limitBuy("1", "100").create().getId())
                    .isNotEqualTo(limitBuy("1", "100").create().getId());
        }

        @Test
        @DisplayName("Empty strategy id is rejected")
        void emptyStrategyId_rejected() {
            assertThatThrownBy(() -> limitBuy("1", "100").strategyId("  ").create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("strategyId");
        }

        @Test
        @DisplayName("Missing symbol or exchange is rejected")
        void missingSymbolOrExchange_rejected() {
            assertThatThrownBy(() -> limitBuy("1", "100").symbol(null).create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("symbol");
            assertThatThrownBy(() -> limitBuy("1", "100").exchange("").create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("exchange");
        }

        @Test
        @DisplayName("Missing side, type or time in force is rejected")
        void missingEnums_rejected() {
            assertThatThrownBy(() -> limitBuy("1", "100").side(null).create())
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> limitBuy("1", "100").orderType(null).create())
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> limitBuy("1", "100").timeInForce(null).create())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Zero quantity is rejected")
        void zeroQuantity_rejected() {
            assertThatThrownBy(() -> limitBuy("0", "100").create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("quantity");
        }

        @Test
        @DisplayName("Limit order without price is rejected")
        void limitWithoutPrice_rejected() {
            assertThatThrownBy(() -> limitBuy("1", "100").price(null).create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("price");
        }

        @Test
        @DisplayName("Market order without price gets a zero price")
        void marketWithoutPrice_zeroPrice() {
            Order order = limitBuy("1", "100").orderType(OrderType.MARKET).price(null).create();

            assertThat(order.getPrice().isZero()).isTrue();
        }

        @Test
        @DisplayName("Stop order requires a stop price")
        void stopWithoutStopPrice_rejected() {
            assertThatThrownBy(() -> limitBuy("1", "100").orderType(OrderType.STOP).create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("stopPrice");

            Order order = limitBuy("1", "100")
                    .orderType(OrderType.STOP_LIMIT)
                    .stopPrice(Price.of("95"))
                    .create();
            assertThat(order.getStopPrice().getValue()).isEqualByComparingTo("95");
        }

        @Test
        @DisplayName("GTD order requires a future expiry")
        void gtdExpiry_required() {
            assertThatThrownBy(() -> limitBuy("1", "100").timeInForce(TimeInForce.GTD).create())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("expiresAt");
            assertThatThrownBy(() -> limitBuy("1", "100")
                            .timeInForce(TimeInForce.GTD)
                            .expiresAt(clock.instant().minusSeconds(1))
                            .create())
                    .isInstanceOf(ValidationException.class);
        }
    }

    // ==============================
    // STATE MACHINE
    // ==============================

    @Nested
    @DisplayName("State Transitions")
    class StateTransitions {

        @Test
        @DisplayName("Confirm moves PENDING to NEW and refreshes updatedAt")
        void confirm_pendingToNew() {
            Order order = limitBuy("1", "100").create();
            clock.advance(Duration.ofMillis(5));

            order.confirm();

            assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
            assertThat(order.isActive()).isTrue();
            assertThat(order.getUpdatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00.005Z"));
            assertThat(order.getEvents()).extracting(OrderLifecycleEvent::type)
                    .containsExactly(OrderLifecycleEventType.CREATED, OrderLifecycleEventType.CONFIRMED);
        }

        @Test
        @DisplayName("Confirm twice fails with the current status")
        void confirmTwice_fails() {
            Order order = confirmedOrder("1", "100");

            assertThatThrownBy(order::confirm)
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .satisfies(e -> {
                        InvalidStateTransitionException ex = (InvalidStateTransitionException) e;
                        assertThat(ex.getCurrentStatus()).isEqualTo(OrderStatus.NEW);
                        assertThat(ex.getOperation()).isEqualTo("confirm");
                    });
        }

        @Test
        @DisplayName("Cancel is allowed from PENDING, NEW and PARTIALLY_FILLED")
        void cancel_fromWorkingStates() {
            Order pending = limitBuy("1", "100").create();
            pending.cancel();
            assertThat(pending.isCanceled()).isTrue();

            Order partial = confirmedOrder("2", "100");
            partial.partialFill(Quantity.of("1"), Price.of("100"), null);
            partial.cancel();
            assertThat(partial.getStatus()).isEqualTo(OrderStatus.CANCELED);
            assertThat(partial.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("Cancel of a filled or canceled order fails")
        void cancel_terminalFails() {
            Order filled = confirmedOrder("1", "100");
            filled.partialFill(Quantity.of("1"), Price.of("100"), null);
            assertThatThrownBy(filled::cancel).isInstanceOf(InvalidStateTransitionException.class);

            Order canceled = limitBuy("1", "100").create();
            canceled.cancel();
            assertThatThrownBy(canceled::cancel).isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Reject is unconditional and stores the reason")
        void reject_unconditional() {
            Order order = confirmedOrder("1", "100");

            order.reject("venue rejected: insufficient balance");

            assertThat(order.isRejected()).isTrue();
            assertThat(order.isTerminal()).isTrue();
            assertThat(order.getErrorMessage()).isEqualTo("venue rejected: insufficient balance");
            OrderLifecycleEvent last = order.getEvents().get(order.getEvents().size() - 1);
            assertThat(last.type()).isEqualTo(OrderLifecycleEventType.REJECTED);
            assertThat(last.data()).containsEntry("reason", "venue rejected: insufficient balance");
        }

        @Test
        @DisplayName("GTD order expires once its expiry has passed")
        void gtd_expires() {
            Order order = limitBuy("1", "100")
                    .timeInForce(TimeInForce.GTD)
                    .expiresAt(clock.instant().plusSeconds(60))
                    .create();
            order.confirm();

            assertThat(order.isExpired(clock.instant())).isFalse();
            assertThatThrownBy(() -> order.expire(clock.instant()))
                    .isInstanceOf(InvalidStateTransitionException.class);

            clock.advance(Duration.ofSeconds(60));
            order.expire(clock.instant());

            assertThat(order.getStatus()).isEqualTo(OrderStatus.EXPIRED);
            assertThat(order.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("GTC order never expires")
        void gtc_neverExpires() {
            Order order = confirmedOrder("1", "100");

            assertThat(order.isExpired(clock.instant().plus(Duration.ofDays(365)))).isFalse();
        }
    }

    // ==============================
    // FILLS
    // ==============================

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Two fills produce the quantity-weighted average price")
        void twoFills_weightedAverage() {
            Order order = confirmedOrder("0.1", "50000");

            order.partialFill(Quantity.of("0.05"), Price.of("50100"), Commission.of(new BigDecimal("2.505"), "USDT"));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(order.getRemainingQuantity().getValue()).isEqualByComparingTo("0.05");

            order.partialFill(Quantity.of("0.05"), Price.of("50200"), Commission.of(new BigDecimal("2.51"), "USDT"));

            assertThat(order.isFilled()).isTrue();
            assertThat(order.getFilledQuantity().getValue()).isEqualByComparingTo("0.1");
            assertThat(order.getRemainingQuantity().isZero()).isTrue();
            assertThat(order.getAvgFillPrice().getValue()).isEqualByComparingTo("50150");
            assertThat(order.getCommission().getAmount()).isEqualByComparingTo("5.015");
            assertThat(order.getCommission().getAsset()).isEqualTo("USDT");
        }

        @Test
        @DisplayName("Completing fill records PARTIALLY_FILLED then FILLED")
        void completingFill_recordsBothEvents() {
            Order order = confirmedOrder("1", "100");

            order.partialFill(Quantity.of("1"), Price.of("100"), null);

            List<OrderLifecycleEventType> types = order.getEvents().stream()
                    .map(OrderLifecycleEvent::type)
                    .toList();
            assertThat(types).containsExactly(
                    OrderLifecycleEventType.CREATED,
                    OrderLifecycleEventType.CONFIRMED,
                    OrderLifecycleEventType.PARTIALLY_FILLED,
                    OrderLifecycleEventType.FILLED);
            assertThat(order.getEvents().get(2).data()).containsEntry("fillPrice", "100");
        }

        @Test
        @DisplayName("Overfill fails and leaves the order unchanged")
        void overfill_failsWithoutChange() {
            Order order = confirmedOrder("1", "100");
            order.partialFill(Quantity.of("0.4"), Price.of("100"), null);
            int eventsBefore = order.getEvents().size();

            assertThatThrownBy(() -> order.partialFill(Quantity.of("0.7"), Price.of("100"), null))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .hasMessageContaining("exceeds remaining");

            assertThat(order.getFilledQuantity().getValue()).isEqualByComparingTo("0.4");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
            assertThat(order.getEvents()).hasSize(eventsBefore);
        }

        @Test
        @DisplayName("Fill of a pending order fails")
        void fillPending_fails() {
            Order order = limitBuy("1", "100").create();

            assertThatThrownBy(() -> order.partialFill(Quantity.of("1"), Price.of("100"), null))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Non-positive fill price fails")
        void zeroFillPrice_fails() {
            Order order = confirmedOrder("1", "100");

            assertThatThrownBy(() -> order.partialFill(Quantity.of("1"), Price.zero(), null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    // ==============================
    // METADATA
    // ==============================

    @Nested
    @DisplayName("Exchange Id and Latency")
    class Metadata {

        @Test
        @DisplayName("Exchange id can be set once; same id again is a no-op")
        void exchangeId_setOnce() {
            Order order = confirmedOrder("1", "100");

            order.setExchangeOrderId("EX-1");
            order.setExchangeOrderId("EX-1");

            assertThat(order.getExchangeOrderId()).isEqualTo("EX-1");
            assertThat(order.getEvents()).filteredOn(e -> e.type() == OrderLifecycleEventType.EXCHANGE_ORDER_ID_ASSIGNED)
                    .hasSize(1);
            assertThatThrownBy(() -> order.setExchangeOrderId("EX-2"))
                    .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> order.setExchangeOrderId(" "))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Latency must be non-negative")
        void latency_nonNegative() {
            Order order = confirmedOrder("1", "100");

            order.setLatency(Duration.ofNanos(250_000));

            assertThat(order.getLatency()).isEqualTo(Duration.ofNanos(250_000));
            assertThatThrownBy(() -> order.setLatency(Duration.ofMillis(-1)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Event log cannot be modified by callers")
        void events_readOnly() {
            Order order = limitBuy("1", "100").create();

            assertThatThrownBy(() -> order.getEvents().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
