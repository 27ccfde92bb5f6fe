package com.hftrisk.observability;

import com.hftrisk.event.RiskEvent;
import com.hftrisk.risk.RiskService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Publishes risk service state as Micrometer meters.
 *
 * <ul>
 *   <li><b>risk.checks.total</b>, <b>risk.violations.total</b>, <b>risk.orders.blocked</b>,
 *       <b>risk.violation.rate</b>, <b>risk.score</b>, <b>risk.events.active</b>,
 *       <b>risk.events.dropped</b>, <b>risk.events.evicted</b> (gauges over {@link RiskService#getMetrics()})</li>
 *   <li><b>risk.events.processed</b> (counter per event type, from published RiskEvents)</li>
 *   <li><b>orders.routed.count</b>, <b>orders.rejected.count</b> (counters, from the router)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily at scrape time.
 */
@Service
public class RiskMetricsBinder {

    private final MeterRegistry meterRegistry;
    private final Counter ordersRoutedCounter;
    private final Counter ordersRejectedCounter;

    public RiskMetricsBinder(MeterRegistry meterRegistry, RiskService riskService) {
        this.meterRegistry = meterRegistry;

        this.ordersRoutedCounter = Counter.builder("orders.routed.count")
                .description("Orders acknowledged by the execution gateway")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("orders.rejected.count")
                .description("Orders rejected at submission by halts, risk checks or the gateway")
                .register(meterRegistry);

        Gauge.builder("risk.checks.total", riskService, s -> s.getMetrics().getTotalChecks())
                .description("Risk checks performed")
                .register(meterRegistry);
        Gauge.builder("risk.violations.total", riskService, s -> s.getMetrics().getViolations())
                .description("Risk checks that failed")
                .register(meterRegistry);
        Gauge.builder("risk.orders.blocked", riskService, s -> s.getMetrics().getBlockedOrders())
                .register(meterRegistry);
        Gauge.builder("risk.violation.rate", riskService, s -> s.getMetrics().getViolationRate())
                .register(meterRegistry);
        Gauge.builder("risk.score", riskService, s -> s.getMetrics().getRiskScore())
                .description("Severity-weighted score of unresolved risk events, 0-100")
                .register(meterRegistry);
        Gauge.builder("risk.events.active", riskService, s -> s.getMetrics().getActiveEvents())
                .register(meterRegistry);
        Gauge.builder("risk.events.dropped", riskService, s -> s.getMetrics().getDroppedEvents())
                .tag("channel", "events")
                .register(meterRegistry);
        Gauge.builder("risk.events.dropped", riskService, s -> s.getMetrics().getDroppedViolations())
                .tag("channel", "violations")
                .register(meterRegistry);
        Gauge.builder("risk.events.evicted", riskService, s -> s.getMetrics().getEvictedEvents())
                .description("Unresolved events evicted at the retention limit")
                .register(meterRegistry);
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        meterRegistry.counter("risk.events.processed", "type", event.getType().code()).increment();
    }

    public void recordOrderRouted() {
        ordersRoutedCounter.increment();
    }

    public void recordOrderRejected() {
        ordersRejectedCounter.increment();
    }
}
