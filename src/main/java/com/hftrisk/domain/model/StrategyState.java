package com.hftrisk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** External view of a trading strategy: whether it may trade and how much capital it has left. */
@Value
@Builder
public class StrategyState {

    String strategyId;
    boolean active;

    /** Null when the strategy store does not track capital. */
    BigDecimal availableCapital;
}
