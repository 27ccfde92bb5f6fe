package com.hftrisk.risk;

import com.hftrisk.domain.model.StrategyState;
import java.util.Optional;
import java.util.Set;

/** External strategy store: activity flags and capital, and the set the monitors poll. */
public interface StrategyRegistry {

    Set<String> activeStrategyIds();

    Optional<StrategyState> findStrategy(String strategyId);
}
