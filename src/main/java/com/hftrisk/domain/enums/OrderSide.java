package com.hftrisk.domain.enums;

/** Buy or sell side of an order. Wire code is the lowercase name ("buy", "sell"). */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public String code() {
        return name().toLowerCase();
    }

    /** Parses a wire code case-insensitively. Returns null for unknown or blank input. */
    public static OrderSide fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (OrderSide side : values()) {
            if (side.name().equalsIgnoreCase(code.trim())) {
                return side;
            }
        }
        return null;
    }
}
