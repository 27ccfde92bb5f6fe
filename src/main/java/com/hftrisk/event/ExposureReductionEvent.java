package com.hftrisk.event;

import org.springframework.context.ApplicationEvent;

/** Published when a REDUCE_EXPOSURE risk action is processed, for the position-reduction collaborator. */
public class ExposureReductionEvent extends ApplicationEvent {

    private final String strategyId;
    private final String symbol;
    private final String riskEventId;

    public ExposureReductionEvent(Object source, String strategyId, String symbol, String riskEventId) {
        super(source);
        this.strategyId = strategyId;
        this.symbol = symbol;
        this.riskEventId = riskEventId;
    }

    public String getStrategyId() {
        return strategyId;
    }

    /** Null when the whole strategy's exposure must come down. */
    public String getSymbol() {
        return symbol;
    }

    public String getRiskEventId() {
        return riskEventId;
    }
}
