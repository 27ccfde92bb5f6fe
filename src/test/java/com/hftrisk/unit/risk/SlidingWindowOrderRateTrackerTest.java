package com.hftrisk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.hftrisk.risk.SlidingWindowOrderRateTracker;
import com.hftrisk.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SlidingWindowOrderRateTrackerTest {

    private MutableClock clock;
    private SlidingWindowOrderRateTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        tracker = new SlidingWindowOrderRateTracker(Duration.ofSeconds(1), clock);
    }

    @Test
    @DisplayName("Counts only submissions inside the trailing window")
    void countsWithinWindow() {
        tracker.recordOrder("s1");
        clock.advance(Duration.ofMillis(400));
        tracker.recordOrder("s1");
        tracker.recordOrder("s1");

        assertThat(tracker.recentOrderCount("s1")).isEqualTo(3);

        clock.advance(Duration.ofMillis(600));
        assertThat(tracker.recentOrderCount("s1")).isEqualTo(2);

        clock.advance(Duration.ofMillis(400));
        assertThat(tracker.recentOrderCount("s1")).isZero();
    }

    @Test
    @DisplayName("Strategies are counted independently")
    void perStrategy() {
        tracker.recordOrder("s1");
        tracker.recordOrder("s2");
        tracker.recordOrder("s2");

        assertThat(tracker.recentOrderCount("s1")).isEqualTo(1);
        assertThat(tracker.recentOrderCount("s2")).isEqualTo(2);
        assertThat(tracker.recentOrderCount("unknown")).isZero();
    }
}
