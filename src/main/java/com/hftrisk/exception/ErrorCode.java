package com.hftrisk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable failure categories. The HTTP-style status is for whatever transport sits in front
 * of the risk core; nothing in this module serves HTTP.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    /** Malformed request or value object input. */
    VALIDATION_ERROR("VALIDATION_ERROR", 400),

    /** No stored entry, e.g. a strategy without limits of its own. */
    NOT_FOUND("NOT_FOUND", 404),

    /** Order operation not allowed from the order's current status. */
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", 409),

    /** Risk limit breached; the order or strategy is blocked. */
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),

    /** Execution venue refused or failed a request. */
    EXECUTION_ERROR("EXECUTION_ERROR", 502),

    /** Position, exposure or order-rate data could not be fetched. */
    DEPENDENCY_UNAVAILABLE("DEPENDENCY_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
