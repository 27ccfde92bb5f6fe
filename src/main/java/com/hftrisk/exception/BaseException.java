package com.hftrisk.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the risk core's unchecked exceptions: an {@link ErrorCode} plus read-only context
 * values (strategy, field, violation code) for callers that translate failures outward.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty() ? Map.of() : Map.copyOf(details);
    }
}
