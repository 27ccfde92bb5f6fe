package com.hftrisk.risk;

import java.math.BigDecimal;

@FunctionalInterface
public interface ExposureCalculator {

    /**
     * Aggregate notional currently held by the strategy.
     *
     * @throws com.hftrisk.exception.DependencyUnavailableException if the data is unavailable
     */
    BigDecimal currentExposure(String strategyId);
}
