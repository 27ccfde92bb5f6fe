package com.hftrisk.domain.enums;

/** Entry types of an order's append-only audit log. */
public enum OrderLifecycleEventType {
    CREATED,
    CONFIRMED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED,
    EXCHANGE_ORDER_ID_ASSIGNED,
    LATENCY_RECORDED
}
