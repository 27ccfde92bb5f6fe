package com.hftrisk.risk;

import com.hftrisk.domain.model.Order;
import com.hftrisk.domain.model.Position;
import com.hftrisk.exception.DependencyUnavailableException;
import com.hftrisk.exception.ResourceNotFoundException;
import com.hftrisk.exception.RiskViolationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless, synchronous evaluator of pre-trade and position risk rules.
 *
 * <p>Order validation runs in a fixed order and stops at the first failure:
 * <ol>
 *   <li>Order size against {@code maxOrderSize}</li>
 *   <li>Hypothetical position size against {@code maxPositionSize}</li>
 *   <li>Current exposure plus order notional against {@code maxExposure}</li>
 *   <li>Orders in the current rate window against {@code maxOrdersPerSecond}</li>
 *   <li>Market hours (no-op for always-open venues)</li>
 * </ol>
 *
 * <p>Exceeding a limit is fatal and raises {@link RiskViolationException}. Failing to fetch
 * the data behind a pre-trade rule (position, exposure, order count) is not: the rule is
 * skipped with a warning so degraded telemetry does not halt trading. Limits that cannot be
 * fetched fall back to the default set given at construction.
 *
 * <p>Holds no mutable state and is safe to share between threads.
 */
public class RiskChecker implements RiskValidator {

    private static final Logger log = LoggerFactory.getLogger(RiskChecker.class);

    private final RiskLimits defaultLimits;
    private final RiskLimitsProvider riskLimitsProvider;
    private final PositionProvider positionProvider;
    private final ExposureCalculator exposureCalculator;
    private final DrawdownCalculator drawdownCalculator;
    private final OrderRateProvider orderRateProvider;
    private final MarketHoursPolicy marketHoursPolicy;
    private final Clock clock;

    public RiskChecker(
            RiskLimits defaultLimits,
            RiskLimitsProvider riskLimitsProvider,
            PositionProvider positionProvider,
            ExposureCalculator exposureCalculator,
            DrawdownCalculator drawdownCalculator,
            OrderRateProvider orderRateProvider,
            MarketHoursPolicy marketHoursPolicy,
            Clock clock) {
        this.defaultLimits = defaultLimits;
        this.riskLimitsProvider = riskLimitsProvider;
        this.positionProvider = positionProvider;
        this.exposureCalculator = exposureCalculator;
        this.drawdownCalculator = drawdownCalculator;
        this.orderRateProvider = orderRateProvider;
        this.marketHoursPolicy = marketHoursPolicy;
        this.clock = clock;
    }

    // ========================
    // PRE-TRADE VALIDATION
    // ========================

    @Override
    public void validateOrder(Order order) {
        RiskLimits limits = limitsFor(order.getStrategyId());

        checkOrderSize(order, limits);
        checkPositionLimits(order, limits);
        checkExposureLimits(order, limits);
        checkOrderRate(order, limits);
        checkMarketHours(order);
    }

    private void checkOrderSize(Order order, RiskLimits limits) {
        BigDecimal quantity = order.getQuantity().getValue();
        if (limits.getMaxOrderSize() != null && quantity.compareTo(limits.getMaxOrderSize()) > 0) {
            throw violation(
                    order.getStrategyId(),
                    RiskViolation.ORDER_SIZE_EXCEEDED,
                    "Order quantity " + quantity.toPlainString() + " exceeds max order size "
                            + limits.getMaxOrderSize().toPlainString());
        }
    }

    /**
     * Same-side orders grow the position; opposite-side orders shrink it, and an order that
     * flips the position leaves a net size of {@code |current - order|}.
     */
    private void checkPositionLimits(Order order, RiskLimits limits) {
        if (limits.getMaxPositionSize() == null) {
            return;
        }

        Optional<Position> current;
        try {
            current = positionProvider.findPosition(order.getStrategyId(), order.getSymbol());
        } catch (DependencyUnavailableException e) {
            log.warn(
                    "Position lookup unavailable, skipping position limit check: strategyId={}, symbol={}, reason={}",
                    order.getStrategyId(),
                    order.getSymbol(),
                    e.getMessage());
            return;
        }
        if (current.isEmpty() || current.get().getQuantity() == null) {
            return;
        }

        Position position = current.get();
        BigDecimal currentSize = position.getQuantity().abs();
        BigDecimal orderSize = order.getQuantity().getValue();
        BigDecimal newSize = position.getSide() == order.getSide()
                ? currentSize.add(orderSize)
                : currentSize.subtract(orderSize).abs();

        if (newSize.compareTo(limits.getMaxPositionSize()) > 0) {
            throw violation(
                    order.getStrategyId(),
                    RiskViolation.POSITION_LIMIT_EXCEEDED,
                    "Position size for " + order.getSymbol() + " would be " + newSize.toPlainString()
                            + ", exceeding max position size " + limits.getMaxPositionSize().toPlainString());
        }
    }

    private void checkExposureLimits(Order order, RiskLimits limits) {
        if (limits.getMaxExposure() == null) {
            return;
        }

        BigDecimal currentExposure;
        try {
            currentExposure = exposureCalculator.currentExposure(order.getStrategyId());
        } catch (DependencyUnavailableException e) {
            log.warn(
                    "Exposure calculation failed, allowing order: strategyId={}, orderId={}, reason={}",
                    order.getStrategyId(),
                    order.getId(),
                    e.getMessage());
            return;
        }

        BigDecimal orderExposure = order.getPrice().multiply(order.getQuantity());
        BigDecimal newExposure = currentExposure.add(orderExposure);
        if (newExposure.compareTo(limits.getMaxExposure()) > 0) {
            throw violation(
                    order.getStrategyId(),
                    RiskViolation.EXPOSURE_LIMIT_EXCEEDED,
                    "Exposure would be " + newExposure.toPlainString() + " (current "
                            + currentExposure.toPlainString() + " + order " + orderExposure.toPlainString()
                            + "), exceeding max exposure " + limits.getMaxExposure().toPlainString());
        }
    }

    private void checkOrderRate(Order order, RiskLimits limits) {
        if (limits.getMaxOrdersPerSecond() <= 0) {
            return;
        }

        int recentOrders;
        try {
            recentOrders = orderRateProvider.recentOrderCount(order.getStrategyId());
        } catch (DependencyUnavailableException e) {
            log.warn(
                    "Recent order count unavailable, skipping rate check: strategyId={}, reason={}",
                    order.getStrategyId(),
                    e.getMessage());
            return;
        }

        if (recentOrders >= limits.getMaxOrdersPerSecond()) {
            throw violation(
                    order.getStrategyId(),
                    RiskViolation.ORDER_RATE_EXCEEDED,
                    "Strategy submitted " + recentOrders + " orders in the current window, limit is "
                            + limits.getMaxOrdersPerSecond());
        }
    }

    private void checkMarketHours(Order order) {
        if (!marketHoursPolicy.isOpen(order.getExchange(), order.getSymbol(), clock.instant())) {
            throw violation(
                    order.getStrategyId(),
                    RiskViolation.MARKET_CLOSED,
                    "Market closed for " + order.getSymbol() + " on " + order.getExchange());
        }
    }

    // ========================
    // POSITION VALIDATION
    // ========================

    /**
     * Checks a position against size, loss and margin limits.
     *
     * @throws RiskViolationException on the first breached limit
     */
    public void validatePosition(Position position) {
        RiskLimits limits = limitsFor(position.getStrategyId());

        BigDecimal size = position.getQuantity() != null ? position.getQuantity().abs() : BigDecimal.ZERO;
        if (limits.getMaxPositionSize() != null && size.compareTo(limits.getMaxPositionSize()) > 0) {
            throw violation(
                    position.getStrategyId(),
                    RiskViolation.POSITION_SIZE_EXCEEDED,
                    "Position size " + size.toPlainString() + " for " + position.getSymbol()
                            + " exceeds max position size " + limits.getMaxPositionSize().toPlainString());
        }

        // maxDailyLoss is a positive number; breach when the loss is larger than it
        BigDecimal pnl = position.getUnrealizedPnl();
        if (limits.getMaxDailyLoss() != null && pnl != null && pnl.signum() < 0
                && pnl.negate().compareTo(limits.getMaxDailyLoss()) > 0) {
            throw violation(
                    position.getStrategyId(),
                    RiskViolation.DAILY_LOSS_EXCEEDED,
                    "Unrealized loss " + pnl.negate().toPlainString() + " for " + position.getSymbol()
                            + " exceeds max daily loss " + limits.getMaxDailyLoss().toPlainString());
        }

        if (position.getMargin() != null && position.getMaintenanceMargin() != null
                && position.getMargin().compareTo(position.getMaintenanceMargin()) < 0) {
            throw violation(
                    position.getStrategyId(),
                    RiskViolation.MARGIN_BELOW_MAINTENANCE,
                    "Margin " + position.getMargin().toPlainString() + " for " + position.getSymbol()
                            + " is below maintenance margin " + position.getMaintenanceMargin().toPlainString());
        }
    }

    // ========================
    // STRATEGY-LEVEL CHECKS
    // ========================

    /**
     * Computes the strategy's exposure and compares it with {@code maxExposure}.
     *
     * @return the computed exposure
     * @throws RiskViolationException if the exposure exceeds the limit
     * @throws DependencyUnavailableException if the exposure cannot be computed
     */
    public BigDecimal checkExposure(String strategyId) {
        BigDecimal exposure = currentExposure(strategyId);
        evaluateExposure(strategyId, exposure);
        return exposure;
    }

    /**
     * Computes the strategy's drawdown and compares it with {@code maxDrawdownPercent}.
     *
     * @return the computed drawdown in percent
     * @throws RiskViolationException if the drawdown exceeds the limit
     * @throws DependencyUnavailableException if the drawdown cannot be computed
     */
    public BigDecimal checkDrawdown(String strategyId) {
        BigDecimal drawdown = currentDrawdown(strategyId);
        evaluateDrawdown(strategyId, drawdown);
        return drawdown;
    }

    public BigDecimal currentExposure(String strategyId) {
        BigDecimal exposure = exposureCalculator.currentExposure(strategyId);
        return exposure != null ? exposure : BigDecimal.ZERO;
    }

    public BigDecimal currentDrawdown(String strategyId) {
        BigDecimal drawdown = drawdownCalculator.currentDrawdownPercent(strategyId);
        return drawdown != null ? drawdown : BigDecimal.ZERO;
    }

    /** Fails if an already computed exposure exceeds the strategy's limit. */
    public void evaluateExposure(String strategyId, BigDecimal exposure) {
        RiskLimits limits = limitsFor(strategyId);
        if (limits.getMaxExposure() != null && exposure.compareTo(limits.getMaxExposure()) > 0) {
            throw violation(
                    strategyId,
                    RiskViolation.EXPOSURE_LIMIT_EXCEEDED,
                    "Exposure " + exposure.toPlainString() + " exceeds max exposure "
                            + limits.getMaxExposure().toPlainString());
        }
    }

    /** Fails if an already computed drawdown exceeds the strategy's limit. */
    public void evaluateDrawdown(String strategyId, BigDecimal drawdown) {
        RiskLimits limits = limitsFor(strategyId);
        if (limits.getMaxDrawdownPercent() != null && drawdown.compareTo(limits.getMaxDrawdownPercent()) > 0) {
            throw violation(
                    strategyId,
                    RiskViolation.DRAWDOWN_LIMIT_EXCEEDED,
                    "Drawdown " + drawdown.toPlainString() + "% exceeds max drawdown "
                            + limits.getMaxDrawdownPercent().toPlainString() + "%");
        }
    }

    // ========================
    // LIMITS
    // ========================

    /**
     * Returns the strategy's limits, or the default set when the strategy has none or the
     * store cannot be read.
     */
    public RiskLimits limitsFor(String strategyId) {
        try {
            RiskLimits limits = riskLimitsProvider.getStrategyRiskLimits(strategyId);
            return limits != null ? limits : defaultLimits;
        } catch (ResourceNotFoundException e) {
            log.debug("No strategy-specific risk limits, using defaults: strategyId={}", strategyId);
            return defaultLimits;
        } catch (DependencyUnavailableException e) {
            log.warn("Risk limits store unavailable, using defaults: strategyId={}, reason={}", strategyId, e.getMessage());
            return defaultLimits;
        }
    }

    public RiskLimits getDefaultLimits() {
        return defaultLimits;
    }

    private RiskViolationException violation(String strategyId, String code, String message) {
        return new RiskViolationException(strategyId, RiskViolation.of(code, message));
    }
}
