package com.hftrisk.risk;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-strategy submission timestamps kept for one rate window. Entries older than the window
 * are evicted on every read and write, so counts reflect only the trailing window.
 *
 * <p>Built by {@code RiskConfig} with the configured window (one second by default).
 */
public class SlidingWindowOrderRateTracker implements OrderRateProvider {

    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> submissions = new ConcurrentHashMap<>();

    public SlidingWindowOrderRateTracker(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    @Override
    public int recentOrderCount(String strategyId) {
        Deque<Instant> timestamps = submissions.get(strategyId);
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.instant());
            return timestamps.size();
        }
    }

    @Override
    public void recordOrder(String strategyId) {
        Deque<Instant> timestamps = submissions.computeIfAbsent(strategyId, id -> new ArrayDeque<>());
        synchronized (timestamps) {
            Instant now = clock.instant();
            evictExpired(timestamps, now);
            timestamps.addLast(now);
        }
    }

    public Duration getWindow() {
        return window;
    }

    // caller holds the deque's monitor
    private void evictExpired(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
