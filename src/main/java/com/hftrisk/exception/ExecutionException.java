package com.hftrisk.exception;

/** Raised by an execution gateway when it cannot accept an order. */
public class ExecutionException extends BaseException {

    public ExecutionException(String message) {
        super(ErrorCode.EXECUTION_ERROR, message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
    }
}
