package com.hftrisk.risk;

import lombok.Builder;
import lombok.Value;

/** Point-in-time snapshot of the risk service's counters. */
@Value
@Builder
public class RiskMetrics {

    long totalChecks;
    long violations;
    long blockedOrders;

    /** violations / totalChecks, zero before the first check. */
    double violationRate;

    /** Severity-weighted sum over unresolved events, capped at 100. */
    int riskScore;

    /** Unresolved events currently tracked. */
    int activeEvents;

    /** Events that did not fit in the event channel. They remain in the event map. */
    long droppedEvents;

    /** HIGH/CRITICAL events that did not fit in the escalation channel. */
    long droppedViolations;

    /** Unresolved events evicted because the retention limit was reached. */
    long evictedEvents;
}
