package com.hftrisk.config;

import com.hftrisk.risk.DrawdownCalculator;
import com.hftrisk.risk.ExposureCalculator;
import com.hftrisk.risk.MarketHoursPolicy;
import com.hftrisk.risk.OrderRateProvider;
import com.hftrisk.risk.PositionProvider;
import com.hftrisk.risk.RiskChecker;
import com.hftrisk.risk.RiskLimits;
import com.hftrisk.risk.RiskLimitsProvider;
import com.hftrisk.risk.RiskServiceSettings;
import com.hftrisk.risk.SlidingWindowOrderRateTracker;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the risk checker and the risk service settings from application.yml.
 *
 * <p>The default limit set is built here and handed to the {@link RiskChecker}; strategies
 * without their own limits are checked against it.
 *
 * <p>Properties prefix: {@code hftrisk.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskLimits defaultRiskLimits(
            @Value("${hftrisk.risk.defaults.max-position-size:1000}") BigDecimal maxPositionSize,
            @Value("${hftrisk.risk.defaults.max-order-size:100}") BigDecimal maxOrderSize,
            @Value("${hftrisk.risk.defaults.max-daily-loss:10000}") BigDecimal maxDailyLoss,
            @Value("${hftrisk.risk.defaults.max-drawdown-percent:10}") BigDecimal maxDrawdownPercent,
            @Value("${hftrisk.risk.defaults.max-orders-per-second:100}") int maxOrdersPerSecond,
            @Value("${hftrisk.risk.defaults.max-exposure:100000}") BigDecimal maxExposure,
            @Value("${hftrisk.risk.defaults.stop-loss-percent:2}") BigDecimal stopLossPercent,
            @Value("${hftrisk.risk.defaults.take-profit-percent:5}") BigDecimal takeProfitPercent) {
        return RiskLimits.builder()
                .maxPositionSize(maxPositionSize)
                .maxOrderSize(maxOrderSize)
                .maxDailyLoss(maxDailyLoss)
                .maxDrawdownPercent(maxDrawdownPercent)
                .maxOrdersPerSecond(maxOrdersPerSecond)
                .maxExposure(maxExposure)
                .stopLossPercent(stopLossPercent)
                .takeProfitPercent(takeProfitPercent)
                .build();
    }

    @Bean
    public RiskServiceSettings riskServiceSettings(
            @Value("${hftrisk.risk.service.event-buffer-size:1000}") int eventBufferSize,
            @Value("${hftrisk.risk.service.violation-buffer-size:100}") int violationBufferSize,
            @Value("${hftrisk.risk.service.exposure-check-interval:30s}") Duration exposureCheckInterval,
            @Value("${hftrisk.risk.service.drawdown-check-interval:60s}") Duration drawdownCheckInterval,
            @Value("${hftrisk.risk.service.stop-timeout:5s}") Duration stopTimeout,
            @Value("${hftrisk.risk.service.max-retained-events:10000}") int maxRetainedEvents) {
        return RiskServiceSettings.builder()
                .eventBufferSize(eventBufferSize)
                .violationBufferSize(violationBufferSize)
                .exposureCheckInterval(exposureCheckInterval)
                .drawdownCheckInterval(drawdownCheckInterval)
                .stopTimeout(stopTimeout)
                .maxRetainedEvents(maxRetainedEvents)
                .build();
    }

    @Bean
    public SlidingWindowOrderRateTracker orderRateTracker(
            @Value("${hftrisk.risk.service.order-rate-window:1s}") Duration window, Clock clock) {
        return new SlidingWindowOrderRateTracker(window, clock);
    }

    @Bean
    public MarketHoursPolicy marketHoursPolicy() {
        return MarketHoursPolicy.alwaysOpen();
    }

    @Bean
    public RiskChecker riskChecker(
            RiskLimits defaultRiskLimits,
            RiskLimitsProvider riskLimitsProvider,
            PositionProvider positionProvider,
            ExposureCalculator exposureCalculator,
            DrawdownCalculator drawdownCalculator,
            OrderRateProvider orderRateProvider,
            MarketHoursPolicy marketHoursPolicy,
            Clock clock) {
        return new RiskChecker(
                defaultRiskLimits,
                riskLimitsProvider,
                positionProvider,
                exposureCalculator,
                drawdownCalculator,
                orderRateProvider,
                marketHoursPolicy,
                clock);
    }
}
