package com.hftrisk.risk;

/** Limits store owned by the external configuration service. */
public interface RiskLimitsProvider {

    /**
     * @throws com.hftrisk.exception.ResourceNotFoundException if the strategy has no limits
     * @throws com.hftrisk.exception.DependencyUnavailableException if the store cannot be read
     */
    RiskLimits getStrategyRiskLimits(String strategyId);
}
