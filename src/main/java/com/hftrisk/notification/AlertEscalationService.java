package com.hftrisk.notification;

import com.hftrisk.event.RiskEvent;
import com.hftrisk.event.RiskSeverity;
import com.hftrisk.risk.RiskEventChannel;
import com.hftrisk.risk.RiskMetrics;
import com.hftrisk.risk.RiskService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drains the risk service's escalation channel and raises alerts: HIGH events are logged at
 * warn, CRITICAL at error. Each escalation is counted in {@code risk.alerts.escalated}
 * tagged with the severity.
 *
 * <p>Also logs a periodic risk summary while unresolved events exist. Exposure-reduction
 * requests are reported by {@link ExposureReductionAlertListener}.
 */
@Service
public class AlertEscalationService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertEscalationService.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final RiskService riskService;
    private final RiskEventChannel violationStream;
    private final MeterRegistry meterRegistry;
    private final AtomicLong escalations = new AtomicLong();

    private volatile boolean running;
    private Thread consumerThread;

    public AlertEscalationService(RiskService riskService, MeterRegistry meterRegistry) {
        this.riskService = riskService;
        this.violationStream = riskService.violationStream();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumerThread = new Thread(this::consumeLoop, "risk-alert-escalation");
        consumerThread.setDaemon(true);
        consumerThread.start();
        log.info("AlertEscalationService started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumerThread.interrupt();
        try {
            consumerThread.join(POLL_TIMEOUT.multipliedBy(10).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        consumerThread = null;
        log.info("AlertEscalationService stopped: escalations={}", escalations.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Raises the alert for one escalated event. */
    public void escalate(RiskEvent event) {
        if (event.getSeverity() == RiskSeverity.CRITICAL) {
            log.error(
                    "CRITICAL risk alert: strategyId={}, type={}, action={}, description={}",
                    event.getStrategyId(),
                    event.getType().code(),
                    event.getAction().code(),
                    event.getDescription());
        } else {
            log.warn(
                    "Risk alert: severity={}, strategyId={}, type={}, action={}, description={}",
                    event.getSeverity().code(),
                    event.getStrategyId(),
                    event.getType().code(),
                    event.getAction().code(),
                    event.getDescription());
        }
        escalations.incrementAndGet();
        meterRegistry.counter("risk.alerts.escalated", "severity", event.getSeverity().code()).increment();
    }

    @Scheduled(fixedDelayString = "${hftrisk.alerts.summary-interval:PT1M}")
    public void logRiskSummary() {
        RiskMetrics metrics = riskService.getMetrics();
        if (metrics.getActiveEvents() == 0) {
            return;
        }
        log.info(
                "Risk summary: activeEvents={}, riskScore={}, checks={}, violations={}, blockedOrders={}, dropped={}/{}",
                metrics.getActiveEvents(),
                metrics.getRiskScore(),
                metrics.getTotalChecks(),
                metrics.getViolations(),
                metrics.getBlockedOrders(),
                metrics.getDroppedEvents(),
                metrics.getDroppedViolations());
    }

    public long getEscalationCount() {
        return escalations.get();
    }

    private void consumeLoop() {
        while (running) {
            try {
                RiskEvent event = violationStream.poll(POLL_TIMEOUT);
                if (event != null) {
                    escalate(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Failed to escalate risk event", e);
            }
        }
    }
}
