package com.hftrisk.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single risk limit violation detected by the {@link RiskChecker}.
 *
 * <p>The code is machine-readable (ORDER_SIZE_EXCEEDED, EXPOSURE_LIMIT_EXCEEDED, ...);
 * the message is for humans and logs.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String ORDER_SIZE_EXCEEDED = "ORDER_SIZE_EXCEEDED";
    public static final String POSITION_LIMIT_EXCEEDED = "POSITION_LIMIT_EXCEEDED";
    public static final String EXPOSURE_LIMIT_EXCEEDED = "EXPOSURE_LIMIT_EXCEEDED";
    public static final String ORDER_RATE_EXCEEDED = "ORDER_RATE_EXCEEDED";
    public static final String MARKET_CLOSED = "MARKET_CLOSED";
    public static final String POSITION_SIZE_EXCEEDED = "POSITION_SIZE_EXCEEDED";
    public static final String DAILY_LOSS_EXCEEDED = "DAILY_LOSS_EXCEEDED";
    public static final String MARGIN_BELOW_MAINTENANCE = "MARGIN_BELOW_MAINTENANCE";
    public static final String DRAWDOWN_LIMIT_EXCEEDED = "DRAWDOWN_LIMIT_EXCEEDED";

    /** Machine-readable violation code. */
    private final String code;

    /** Human-readable description of the violation. */
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
