package com.hftrisk.risk;

import com.hftrisk.event.RiskEvent;
import java.util.List;

/** Durable store for risk events, written by the risk service's event-processing loop. */
public interface RiskEventRepository {

    void save(RiskEvent event);

    List<RiskEvent> findByStrategy(String strategyId);
}
