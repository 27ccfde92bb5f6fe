package com.hftrisk.repository.memory;

import com.hftrisk.exception.ResourceNotFoundException;
import com.hftrisk.risk.RiskLimits;
import com.hftrisk.risk.RiskLimitsProvider;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Strategy-specific risk limits held in memory. Strategies without an entry raise
 * {@link ResourceNotFoundException} so the risk checker falls back to the default set.
 */
@Repository
public class InMemoryRiskLimitsRepository implements RiskLimitsProvider {

    private final Map<String, RiskLimits> limitsByStrategy = new ConcurrentHashMap<>();

    @Override
    public RiskLimits getStrategyRiskLimits(String strategyId) {
        RiskLimits limits = limitsByStrategy.get(strategyId);
        if (limits == null) {
            throw new ResourceNotFoundException("RiskLimits", strategyId);
        }
        return limits;
    }

    public void save(String strategyId, RiskLimits limits) {
        limitsByStrategy.put(strategyId, limits);
    }

    public void delete(String strategyId) {
        limitsByStrategy.remove(strategyId);
    }
}
