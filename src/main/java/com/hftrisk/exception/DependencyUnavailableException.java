package com.hftrisk.exception;

/**
 * A collaborator (limits store, exposure calculator, rate lookup) could not answer.
 * Risk checks treat this as non-fatal: the failure is logged and a fallback is used.
 */
public class DependencyUnavailableException extends BaseException {

    public DependencyUnavailableException(String message) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, message, cause);
    }
}
