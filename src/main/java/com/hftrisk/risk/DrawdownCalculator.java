package com.hftrisk.risk;

import java.math.BigDecimal;

@FunctionalInterface
public interface DrawdownCalculator {

    /**
     * Current peak-to-trough decline of the strategy's equity, in percent.
     *
     * @throws com.hftrisk.exception.DependencyUnavailableException if the data is unavailable
     */
    BigDecimal currentDrawdownPercent(String strategyId);
}
