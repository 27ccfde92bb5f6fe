package com.hftrisk.repository.memory;

import com.hftrisk.domain.model.Position;
import com.hftrisk.risk.PositionProvider;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Positions keyed by strategy and symbol. */
@Repository
public class InMemoryPositionRepository implements PositionProvider {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    @Override
    public Optional<Position> findPosition(String strategyId, String symbol) {
        return Optional.ofNullable(positions.get(key(strategyId, symbol)));
    }

    @Override
    public List<Position> findByStrategy(String strategyId) {
        return positions.values().stream()
                .filter(p -> strategyId.equals(p.getStrategyId()))
                .toList();
    }

    public void save(Position position) {
        positions.put(key(position.getStrategyId(), position.getSymbol()), position);
    }

    public void delete(String strategyId, String symbol) {
        positions.remove(key(strategyId, symbol));
    }

    public void deleteAll() {
        positions.clear();
    }

    private static String key(String strategyId, String symbol) {
        return strategyId + ":" + symbol;
    }
}
