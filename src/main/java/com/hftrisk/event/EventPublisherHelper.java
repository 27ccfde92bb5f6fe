package com.hftrisk.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for the
 * events the risk core emits, so call sites read {@code publishStrategyHalt(...)} rather
 * than constructing events inline.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Publishes a processed risk event as a payload event. */
    public void publishRiskEvent(RiskEvent riskEvent) {
        applicationEventPublisher.publishEvent(riskEvent);
    }

    public void publishStrategyHalt(Object source, RiskEvent riskEvent) {
        applicationEventPublisher.publishEvent(
                new StrategyHaltEvent(source, riskEvent.getStrategyId(), riskEvent.getDescription(), riskEvent.getId()));
    }

    public void publishExposureReduction(Object source, RiskEvent riskEvent) {
        applicationEventPublisher.publishEvent(new ExposureReductionEvent(
                source, riskEvent.getStrategyId(), riskEvent.getSymbol(), riskEvent.getId()));
    }
}
