package com.hftrisk.exception;

import com.hftrisk.domain.enums.OrderStatus;
import java.util.Map;
import lombok.Getter;

/** Thrown when an order operation is invoked from a status that does not permit it. */
@Getter
public class InvalidStateTransitionException extends BaseException {

    private final OrderStatus currentStatus;
    private final String operation;

    public InvalidStateTransitionException(String orderId, OrderStatus currentStatus, String operation) {
        this(orderId, currentStatus, operation, "cannot " + operation + " order in status " + currentStatus);
    }

    public InvalidStateTransitionException(
            String orderId, OrderStatus currentStatus, String operation, String message) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                "Order " + orderId + ": " + message,
                Map.of("orderId", orderId, "status", currentStatus.name(), "operation", operation));
        this.currentStatus = currentStatus;
        this.operation = operation;
    }
}
