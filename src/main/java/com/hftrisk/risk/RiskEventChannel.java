package com.hftrisk.risk;

import com.hftrisk.event.RiskEvent;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Read-only consumer view of one of the risk service's bounded event queues.
 * Consumers can take events out but never publish into the channel.
 */
public class RiskEventChannel {

    private final BlockingQueue<RiskEvent> queue;
    private final int capacity;

    RiskEventChannel(BlockingQueue<RiskEvent> queue, int capacity) {
        this.queue = queue;
        this.capacity = capacity;
    }

    /** Waits up to {@code timeout} for the next event; returns null on timeout. */
    public RiskEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Blocks until an event is available. */
    public RiskEvent take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
