package com.hftrisk.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a STOP_STRATEGY risk action is processed. The order router stops
 * accepting orders for the strategy; an external strategy engine may also listen.
 */
public class StrategyHaltEvent extends ApplicationEvent {

    private final String strategyId;
    private final String reason;
    private final String riskEventId;

    public StrategyHaltEvent(Object source, String strategyId, String reason, String riskEventId) {
        super(source);
        this.strategyId = strategyId;
        this.reason = reason;
        this.riskEventId = riskEventId;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public String getReason() {
        return reason;
    }

    public String getRiskEventId() {
        return riskEventId;
    }
}
