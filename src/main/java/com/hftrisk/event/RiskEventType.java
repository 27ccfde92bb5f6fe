package com.hftrisk.event;

/**
 * Classifies which risk check produced a {@link RiskEvent}.
 * The code is the stable lowercase identifier used by external consumers.
 */
public enum RiskEventType {

    /** Pre-trade order validation failed. */
    ORDER_VALIDATION("order_validation"),

    /** A position breached size, loss or margin limits. */
    POSITION_VALIDATION("position_validation"),

    /** Strategy exposure exceeded its limit. */
    EXPOSURE_LIMIT("exposure_limit"),

    /** Strategy drawdown exceeded its limit. */
    DRAWDOWN_LIMIT("drawdown_limit");

    private final String code;

    RiskEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RiskEventType fromCode(String code) {
        for (RiskEventType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return null;
    }
}
