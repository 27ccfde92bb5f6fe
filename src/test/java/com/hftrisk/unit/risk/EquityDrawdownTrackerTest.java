package com.hftrisk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.hftrisk.risk.EquityDrawdownTracker;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EquityDrawdownTrackerTest {

    private final EquityDrawdownTracker tracker = new EquityDrawdownTracker();

    @Test
    @DisplayName("Drawdown is the decline from the running peak in percent")
    void declineFromPeak() {
        tracker.recordEquity("s1", new BigDecimal("10000"));
        tracker.recordEquity("s1", new BigDecimal("12000"));
        tracker.recordEquity("s1", new BigDecimal("10800"));

        assertThat(tracker.currentDrawdownPercent("s1")).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("New high resets the drawdown to zero")
    void newHigh_zero() {
        tracker.recordEquity("s1", new BigDecimal("10000"));
        tracker.recordEquity("s1", new BigDecimal("9000"));
        tracker.recordEquity("s1", new BigDecimal("10500"));

        assertThat(tracker.currentDrawdownPercent("s1")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Unknown or reset strategy has zero drawdown")
    void unknownOrReset_zero() {
        tracker.recordEquity("s1", new BigDecimal("100"));
        tracker.recordEquity("s1", new BigDecimal("50"));
        tracker.reset("s1");

        assertThat(tracker.currentDrawdownPercent("s1")).isEqualByComparingTo("0");
        assertThat(tracker.currentDrawdownPercent("nobody")).isEqualByComparingTo("0");
    }
}
