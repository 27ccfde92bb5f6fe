package com.hftrisk.oms;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of {@link OrderRouter#submit(com.hftrisk.domain.model.Order)}.
 *
 * <p>Accepted results carry the exchange order id; rejected ones carry the reason, which is
 * also stored on the order itself.
 */
@Data
@Builder
public class OrderRouteResult {

    private boolean accepted;

    private String orderId;

    /** Exchange-assigned id. Null if rejected. */
    private String exchangeOrderId;

    /** Null if accepted. */
    private String rejectionReason;

    public static OrderRouteResult accepted(String orderId, String exchangeOrderId) {
        return OrderRouteResult.builder()
                .accepted(true)
                .orderId(orderId)
                .exchangeOrderId(exchangeOrderId)
                .build();
    }

    public static OrderRouteResult rejected(String orderId, String reason) {
        return OrderRouteResult.builder()
                .accepted(false)
                .orderId(orderId)
                .rejectionReason(reason)
                .build();
    }
}
