package com.hftrisk.risk;

import java.time.Instant;

/**
 * Trading-hours restriction per exchange and symbol. Crypto venues trade around the clock,
 * so the default policy is {@link #alwaysOpen()}.
 */
@FunctionalInterface
public interface MarketHoursPolicy {

    boolean isOpen(String exchange, String symbol, Instant at);

    static MarketHoursPolicy alwaysOpen() {
        return (exchange, symbol, at) -> true;
    }
}
