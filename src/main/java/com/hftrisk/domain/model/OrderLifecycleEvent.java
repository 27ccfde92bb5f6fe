package com.hftrisk.domain.model;

import com.hftrisk.domain.enums.OrderLifecycleEventType;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of an order's audit trail. The data map holds the post-operation snapshot
 * (status, quantities, prices) as strings and cannot be modified after construction.
 */
public record OrderLifecycleEvent(OrderLifecycleEventType type, Instant timestamp, Map<String, Object> data) {

    public OrderLifecycleEvent {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}
