package com.hftrisk.notification;

import com.hftrisk.event.ExposureReductionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Reports exposure-reduction requests off the risk event processor thread. */
@Component
public class ExposureReductionAlertListener {

    private static final Logger log = LoggerFactory.getLogger(ExposureReductionAlertListener.class);

    private final Counter exposureReductionCounter;

    public ExposureReductionAlertListener(MeterRegistry meterRegistry) {
        this.exposureReductionCounter = Counter.builder("risk.alerts.exposure_reduction")
                .description("Exposure reduction requests raised by the risk service")
                .register(meterRegistry);
    }

    @Async
    @EventListener
    public void onExposureReduction(ExposureReductionEvent event) {
        log.warn("Exposure reduction requested: strategyId={}, symbol={}, riskEventId={}",
                event.getStrategyId(),
                event.getSymbol() != null ? event.getSymbol() : "*",
                event.getRiskEventId());
        exposureReductionCounter.increment();
    }
}
