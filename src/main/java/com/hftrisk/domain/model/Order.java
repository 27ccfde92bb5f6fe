package com.hftrisk.domain.model;

import com.hftrisk.domain.enums.OrderLifecycleEventType;
import com.hftrisk.domain.enums.OrderSide;
import com.hftrisk.domain.enums.OrderStatus;
import com.hftrisk.domain.enums.OrderType;
import com.hftrisk.domain.enums.TimeInForce;
import com.hftrisk.domain.vo.Commission;
import com.hftrisk.domain.vo.Price;
import com.hftrisk.domain.vo.Quantity;
import com.hftrisk.exception.InvalidStateTransitionException;
import com.hftrisk.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * A single trading intent and its execution state.
 *
 * <p>State machine:
 * <pre>
 *   PENDING -> NEW -> PARTIALLY_FILLED (repeated) -> FILLED
 *   PENDING | NEW | PARTIALLY_FILLED -> CANCELED
 *   NEW | PARTIALLY_FILLED -> EXPIRED   (GTD orders past their expiry)
 *   any -> REJECTED
 * </pre>
 *
 * <p>There are no setters for execution state: every mutation goes through a method that
 * validates the transition, refreshes {@code updatedAt} and appends to the event log. A
 * failed operation throws and leaves the order untouched. {@code filledQuantity +
 * remainingQuantity == quantity} holds after every call.
 *
 * <p>Not thread-safe. An order is owned by one caller at a time (creator, then router,
 * then the execution pipeline) and each owner serialises its own access.
 *
 * <p>Construct through {@code Order.builder()...create()}.
 */
@Getter
public class Order {

    /** Scale used for the running average fill price. */
    public static final int PRICE_SCALE = 8;

    private final String id;
    private final String clientOrderId;
    private final String strategyId;
    private final String symbol;
    private final String exchange;
    private final OrderSide side;
    private final OrderType orderType;
    private final TimeInForce timeInForce;
    private final Quantity quantity;
    private final Price price;

    /** Trigger price for STOP and STOP_LIMIT orders; null otherwise. */
    private final Price stopPrice;

    private final Instant createdAt;

    /** Mandatory for GTD orders; null otherwise. */
    private final Instant expiresAt;

    private OrderStatus status;
    private Quantity filledQuantity;
    private Quantity remainingQuantity;

    /** Quantity-weighted average of all fills. Zero until the first fill. */
    private Price avgFillPrice;

    private Commission commission;
    private Instant updatedAt;

    /** Venue-assigned id, set once the exchange acknowledges the order. */
    private String exchangeOrderId;

    /** Rejection reason. */
    private String errorMessage;

    /** Processing latency from submission to acknowledgement. */
    private Duration latency;

    @Getter(AccessLevel.NONE)
    private final List<OrderLifecycleEvent> events = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    private Order(
            String clientOrderId,
            String strategyId,
            String symbol,
            String exchange,
            OrderSide side,
            OrderType orderType,
            TimeInForce timeInForce,
            Quantity quantity,
            Price price,
            Price stopPrice,
            Instant expiresAt,
            Clock clock) {
        this.clock = clock;
        this.id = UUID.randomUUID().toString();
        this.clientOrderId = clientOrderId;
        this.strategyId = strategyId;
        this.symbol = symbol;
        this.exchange = exchange;
        this.side = side;
        this.orderType = orderType;
        this.timeInForce = timeInForce;
        this.quantity = quantity;
        this.price = price;
        this.stopPrice = stopPrice;
        this.expiresAt = expiresAt;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.status = OrderStatus.PENDING;
        this.filledQuantity = Quantity.zero();
        this.remainingQuantity = quantity;
        this.avgFillPrice = Price.zero();
        this.commission = Commission.zero();
        this.latency = Duration.ZERO;
    }

    /**
     * Validates every parameter and creates a PENDING order with a single CREATED event.
     *
     * @throws ValidationException if any parameter is missing or malformed
     */
    @Builder(buildMethodName = "create")
    private static Order create(
            String clientOrderId,
            String strategyId,
            String symbol,
            String exchange,
            OrderSide side,
            OrderType orderType,
            TimeInForce timeInForce,
            Quantity quantity,
            Price price,
            Price stopPrice,
            Instant expiresAt,
            Clock clock) {
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

        requireNonBlank(strategyId, "strategyId");
        requireNonBlank(symbol, "symbol");
        requireNonBlank(exchange, "exchange");
        if (side == null) {
            throw new ValidationException("side", "is required");
        }
        if (orderType == null) {
            throw new ValidationException("orderType", "is required");
        }
        if (timeInForce == null) {
            throw new ValidationException("timeInForce", "is required");
        }
        if (quantity == null || !quantity.isPositive()) {
            throw new ValidationException("quantity", "must be greater than zero");
        }

        Price effectivePrice = price != null ? price : Price.zero();
        if (orderType.requiresPrice() && !effectivePrice.isPositive()) {
            throw new ValidationException("price", "is required for " + orderType.code() + " orders");
        }
        if (orderType.requiresStopPrice() && (stopPrice == null || !stopPrice.isPositive())) {
            throw new ValidationException("stopPrice", "is required for " + orderType.code() + " orders");
        }

        if (timeInForce.requiresExpiry()) {
            if (expiresAt == null) {
                throw new ValidationException("expiresAt", "is required for GTD orders");
            }
            if (!expiresAt.isAfter(effectiveClock.instant())) {
                throw new ValidationException("expiresAt", "must be in the future: " + expiresAt);
            }
        }

        Order order = new Order(
                blankToNull(clientOrderId),
                strategyId,
                symbol,
                exchange,
                side,
                orderType,
                timeInForce,
                quantity,
                effectivePrice,
                stopPrice,
                expiresAt,
                effectiveClock);
        order.record(OrderLifecycleEventType.CREATED);
        return order;
    }

    // ========================
    // TRANSITIONS
    // ========================

    /** PENDING -> NEW. The exchange (or the router) has accepted the order. */
    public void confirm() {
        if (status != OrderStatus.PENDING) {
            throw new InvalidStateTransitionException(id, status, "confirm");
        }
        status = OrderStatus.NEW;
        touch();
        record(OrderLifecycleEventType.CONFIRMED);
    }

    /**
     * Applies a fill of {@code fillQuantity} at {@code fillPrice}.
     *
     * <p>The average fill price becomes {@code (oldAvg * oldFilled + fillPrice * fillQty) /
     * newFilled}. Commission amounts accumulate; the settlement asset follows the latest
     * fill. The order becomes FILLED once nothing remains.
     *
     * @throws InvalidStateTransitionException if the order is not NEW or PARTIALLY_FILLED, or
     *     the fill exceeds the remaining quantity
     * @throws ValidationException if the fill quantity or price is not positive
     */
    public void partialFill(Quantity fillQuantity, Price fillPrice, Commission fillCommission) {
        if (!isActive()) {
            throw new InvalidStateTransitionException(id, status, "fill");
        }
        if (fillQuantity == null || !fillQuantity.isPositive()) {
            throw new ValidationException("fillQuantity", "must be greater than zero");
        }
        if (fillPrice == null || !fillPrice.isPositive()) {
            throw new ValidationException("fillPrice", "must be greater than zero");
        }
        if (fillQuantity.isGreaterThan(remainingQuantity)) {
            throw new InvalidStateTransitionException(
                    id,
                    status,
                    "fill",
                    "fill quantity " + fillQuantity + " exceeds remaining quantity " + remainingQuantity);
        }

        Quantity newFilled = filledQuantity.add(fillQuantity);
        BigDecimal weightedTotal = avgFillPrice
                .multiply(filledQuantity)
                .add(fillPrice.multiply(fillQuantity));

        filledQuantity = newFilled;
        remainingQuantity = quantity.subtract(newFilled);
        avgFillPrice = Price.of(weightedTotal.divide(newFilled.getValue(), PRICE_SCALE, RoundingMode.HALF_UP));
        if (fillCommission != null) {
            commission = commission.add(fillCommission);
        }
        status = remainingQuantity.isZero() ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        touch();

        Map<String, Object> fill = new LinkedHashMap<>();
        fill.put("fillQuantity", fillQuantity.toString());
        fill.put("fillPrice", fillPrice.toString());
        record(OrderLifecycleEventType.PARTIALLY_FILLED, fill);
        if (status == OrderStatus.FILLED) {
            record(OrderLifecycleEventType.FILLED);
        }
    }

    /**
     * Cancels the order. Legal from PENDING, NEW and PARTIALLY_FILLED; a filled or
     * already-canceled order (or any other terminal order) cannot be canceled.
     */
    public void cancel() {
        if (status.isTerminal()) {
            throw new InvalidStateTransitionException(id, status, "cancel");
        }
        status = OrderStatus.CANCELED;
        touch();
        record(OrderLifecycleEventType.CANCELED);
    }

    /**
     * Marks the order rejected with the given reason. Unguarded: a rejection may be
     * signalled at any point up to execution.
     */
    public void reject(String reason) {
        status = OrderStatus.REJECTED;
        errorMessage = reason;
        touch();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason != null ? reason : "");
        record(OrderLifecycleEventType.REJECTED, data);
    }

    /**
     * Expires a working GTD order whose expiry has passed.
     *
     * @throws InvalidStateTransitionException if the order is not working, not GTD, or not
     *     yet expired at {@code now}
     */
    public void expire(Instant now) {
        if (!isActive()) {
            throw new InvalidStateTransitionException(id, status, "expire");
        }
        if (!isExpired(now)) {
            throw new InvalidStateTransitionException(id, status, "expire", "order has not reached its expiry");
        }
        status = OrderStatus.EXPIRED;
        touch();
        record(OrderLifecycleEventType.EXPIRED);
    }

    // ========================
    // METADATA
    // ========================

    /** Records the venue-assigned id. The id can be set once; re-sending the same id is a no-op. */
    public void setExchangeOrderId(String exchangeOrderId) {
        requireNonBlank(exchangeOrderId, "exchangeOrderId");
        if (exchangeOrderId.equals(this.exchangeOrderId)) {
            return;
        }
        if (this.exchangeOrderId != null) {
            throw new InvalidStateTransitionException(
                    id, status, "assign exchange id", "exchange order id already set to " + this.exchangeOrderId);
        }
        this.exchangeOrderId = exchangeOrderId;
        touch();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exchangeOrderId", exchangeOrderId);
        record(OrderLifecycleEventType.EXCHANGE_ORDER_ID_ASSIGNED, data);
    }

    public void setLatency(Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new ValidationException("latency", "must be a non-negative duration");
        }
        this.latency = latency;
        touch();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("latencyNanos", latency.toNanos());
        record(OrderLifecycleEventType.LATENCY_RECORDED, data);
    }

    // ========================
    // PREDICATES
    // ========================

    /** NEW or PARTIALLY_FILLED: the order is working at the venue. */
    public boolean isActive() {
        return status == OrderStatus.NEW || status == OrderStatus.PARTIALLY_FILLED;
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public boolean isCanceled() {
        return status == OrderStatus.CANCELED;
    }

    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True for GTD orders whose expiry is at or before {@code now}. */
    public boolean isExpired(Instant now) {
        return timeInForce == TimeInForce.GTD && expiresAt != null && !now.isBefore(expiresAt);
    }

    /** Read-only view of the audit trail, oldest first. */
    public List<OrderLifecycleEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    @Override
    public String toString() {
        return "Order[id=" + id + ", strategyId=" + strategyId + ", " + side + " " + quantity + " " + symbol + "@"
                + price + " " + orderType + ", status=" + status + ", filled=" + filledQuantity + "]";
    }

    // ========================
    // INTERNALS
    // ========================

    private void touch() {
        updatedAt = clock.instant();
    }

    private void record(OrderLifecycleEventType type) {
        record(type, Map.of());
    }

    private void record(OrderLifecycleEventType type, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status.code());
        data.put("filledQuantity", filledQuantity.toString());
        data.put("remainingQuantity", remainingQuantity.toString());
        data.put("avgFillPrice", avgFillPrice.toString());
        data.put("commission", commission.getAmount().toPlainString());
        data.putAll(extra);
        events.add(new OrderLifecycleEvent(type, updatedAt, data));
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be empty");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
