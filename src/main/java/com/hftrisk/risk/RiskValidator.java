package com.hftrisk.risk;

import com.hftrisk.domain.model.Order;

/**
 * Pre-trade order validation contract used by the order domain service.
 * Implemented by the stateless {@link RiskChecker} and by the stateful {@link RiskService}.
 */
public interface RiskValidator {

    /**
     * Validates an order against the owning strategy's risk limits.
     *
     * @throws com.hftrisk.exception.RiskViolationException on the first violated limit
     */
    void validateOrder(Order order);
}
