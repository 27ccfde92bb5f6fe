package com.hftrisk.oms;

import com.hftrisk.domain.model.Order;

/**
 * Venue-side order entry. Implementations talk to an exchange or, for paper trading, to
 * the {@link com.hftrisk.simulator.PaperExecutionGateway}.
 */
public interface ExecutionGateway {

    /**
     * Sends a confirmed order to the venue.
     *
     * @return the exchange-assigned order id
     * @throws com.hftrisk.exception.ExecutionException if the venue refuses or cannot be reached
     */
    String submit(Order order);

    /**
     * Cancels a working order at the venue.
     *
     * @throws com.hftrisk.exception.ExecutionException if the venue refuses or cannot be reached
     */
    void cancel(String exchangeOrderId);
}
