package com.hftrisk.domain.enums;

/**
 * Order execution type.
 *
 * <p>LIMIT, STOP_LIMIT, IOC, FOK and POST_ONLY carry a limit price. STOP and STOP_LIMIT
 * additionally need a stop (trigger) price. MARKET orders execute at the prevailing price
 * and may carry a zero price.
 */
public enum OrderType {
    MARKET("market"),
    LIMIT("limit"),
    STOP("stop"),
    STOP_LIMIT("stop_limit"),
    IOC("ioc"),
    FOK("fok"),
    POST_ONLY("post");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT || this == IOC || this == FOK || this == POST_ONLY;
    }

    public boolean requiresStopPrice() {
        return this == STOP || this == STOP_LIMIT;
    }

    public static OrderType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim();
        for (OrderType type : values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
