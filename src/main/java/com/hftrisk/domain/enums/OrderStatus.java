package com.hftrisk.domain.enums;

/**
 * Lifecycle status of an order.
 * PENDING is the pre-confirmation state assigned at creation; FILLED, CANCELED, REJECTED
 * and EXPIRED are terminal and freeze the order.
 */
public enum OrderStatus {
    PENDING,
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
    }

    public String code() {
        return name().toLowerCase();
    }

    /** Parses a wire code ("partially_filled") case-insensitively. Null for unknown or blank input. */
    public static OrderStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (OrderStatus status : values()) {
            if (status.name().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }
}
