package com.hftrisk.exception;

import java.util.Map;

/**
 * Malformed input: empty identifiers, missing enum values, non-positive quantities,
 * missing price or expiry. Always surfaced synchronously and never retried.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, field + " " + message, Map.of("field", field));
    }
}
