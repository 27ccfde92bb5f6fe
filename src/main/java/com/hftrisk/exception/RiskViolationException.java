package com.hftrisk.exception;

import com.hftrisk.risk.RiskViolation;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A fetched or computed value exceeds a configured risk limit.
 *
 * <p>Carries the {@link RiskViolation} so callers can branch on the machine-readable code.
 * {@link #blocked(RiskViolationException)} wraps a violation raised during order creation so
 * the message reads "order blocked by risk management: ..." while keeping the violation.
 */
@Getter
public class RiskViolationException extends BaseException {

    public static final String BLOCKED_PREFIX = "order blocked by risk management";

    private final RiskViolation violation;
    private final String strategyId;

    public RiskViolationException(String strategyId, RiskViolation violation) {
        super(ErrorCode.RISK_LIMIT_EXCEEDED, violation.getMessage(), detailsOf(strategyId, violation));
        this.violation = violation;
        this.strategyId = strategyId;
    }

    private RiskViolationException(String message, RiskViolationException cause) {
        super(ErrorCode.RISK_LIMIT_EXCEEDED, message, cause.getDetails(), cause);
        this.violation = cause.getViolation();
        this.strategyId = cause.getStrategyId();
    }

    public static RiskViolationException blocked(RiskViolationException cause) {
        return new RiskViolationException(BLOCKED_PREFIX + ": " + cause.getMessage(), cause);
    }

    public String getCode() {
        return violation.getCode();
    }

    public boolean isBlockedOrder() {
        return getMessage() != null && getMessage().startsWith(BLOCKED_PREFIX);
    }

    private static Map<String, Object> detailsOf(String strategyId, RiskViolation violation) {
        Map<String, Object> details = new HashMap<>();
        details.put("code", violation.getCode());
        if (strategyId != null) {
            details.put("strategyId", strategyId);
        }
        return details;
    }
}
