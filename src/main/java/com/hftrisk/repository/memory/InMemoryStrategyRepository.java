package com.hftrisk.repository.memory;

import com.hftrisk.domain.model.StrategyState;
import com.hftrisk.risk.StrategyRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

/** Strategy activity and capital, polled by the risk monitors and the order service. */
@Repository
public class InMemoryStrategyRepository implements StrategyRegistry {

    private final Map<String, StrategyState> strategies = new ConcurrentHashMap<>();

    @Override
    public Set<String> activeStrategyIds() {
        return strategies.values().stream()
                .filter(StrategyState::isActive)
                .map(StrategyState::getStrategyId)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Optional<StrategyState> findStrategy(String strategyId) {
        return Optional.ofNullable(strategies.get(strategyId));
    }

    public void save(StrategyState strategy) {
        strategies.put(strategy.getStrategyId(), strategy);
    }

    public void delete(String strategyId) {
        strategies.remove(strategyId);
    }
}
