package com.hftrisk.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Raised by the risk service whenever a check fails.
 *
 * <p>Events live in the risk service's event map until resolved, travel through its bounded
 * event channel (and the escalation channel for HIGH/CRITICAL), are persisted by the
 * processing loop and finally published as a Spring application event for listeners such
 * as alerting.
 */
@Value
@Builder(toBuilder = true)
public class RiskEvent {

    String id;
    RiskEventType type;
    RiskSeverity severity;
    String strategyId;

    /** Null for strategy-wide events (exposure, drawdown). */
    String symbol;

    String description;

    /** Condition-specific values, e.g. {"currentExposure": "49000", "limit": "50000"}. */
    Map<String, Object> data;

    RiskAction action;
    boolean resolved;
    Instant createdAt;
    Instant resolvedAt;

    public Map<String, Object> getData() {
        return data != null ? Collections.unmodifiableMap(data) : Map.of();
    }

    /** Returns a resolved copy of this event. */
    public RiskEvent resolve(Instant at) {
        return toBuilder()
                .resolved(true)
                .resolvedAt(at)
                .data(data != null ? new LinkedHashMap<>(data) : null)
                .build();
    }
}
