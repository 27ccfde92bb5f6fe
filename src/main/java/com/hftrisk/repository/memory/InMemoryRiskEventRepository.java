package com.hftrisk.repository.memory;

import com.hftrisk.event.RiskEvent;
import com.hftrisk.risk.RiskEventRepository;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

/**
 * Append-only risk event log. Saving an event id again (e.g. after resolution) appends a
 * new entry; readers see the full history.
 */
@Repository
public class InMemoryRiskEventRepository implements RiskEventRepository {

    private final List<RiskEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void save(RiskEvent event) {
        events.add(event);
    }

    @Override
    public List<RiskEvent> findByStrategy(String strategyId) {
        return events.stream()
                .filter(e -> strategyId.equals(e.getStrategyId()))
                .toList();
    }

    public List<RiskEvent> findAll() {
        return List.copyOf(events);
    }

    public int count() {
        return events.size();
    }
}
