package com.hftrisk.risk;

import com.hftrisk.domain.model.Order;
import com.hftrisk.domain.model.Position;
import com.hftrisk.event.EventPublisherHelper;
import com.hftrisk.event.RiskAction;
import com.hftrisk.event.RiskEvent;
import com.hftrisk.event.RiskEventType;
import com.hftrisk.event.RiskSeverity;
import com.hftrisk.exception.DependencyUnavailableException;
import com.hftrisk.exception.RiskViolationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

/**
 * Stateful risk service wrapping the {@link RiskChecker}.
 *
 * <p>Every check goes through here so counters, the event map and the two bounded channels
 * stay consistent. A failed check becomes a {@link RiskEvent} that is:
 * <ol>
 *   <li>stored in the event map until resolved</li>
 *   <li>offered to the event channel (dropped and counted when full)</li>
 *   <li>offered to the escalation channel when HIGH or CRITICAL</li>
 * </ol>
 * and the original violation is rethrown to the caller. Emitting never blocks.
 *
 * <p>Three background threads run while the service is started:
 * <ul>
 *   <li>risk-event-processor: persists events, performs the event's action and publishes it</li>
 *   <li>risk-exposure-monitor: checks exposure of every active strategy periodically</li>
 *   <li>risk-drawdown-monitor: checks drawdown of every active strategy periodically</li>
 * </ul>
 *
 * <p>Shared state is guarded by a read/write lock; no blocking I/O happens while it is held.
 *
 * <p>Primary {@link RiskValidator}: order creation validates through here so every blocked
 * order is counted.
 */
@Primary
@Service
public class RiskService implements RiskValidator, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RiskService.class);

    static final int MAX_RISK_SCORE = 100;

    private final RiskChecker riskChecker;
    private final RiskEventRepository riskEventRepository;
    private final StrategyRegistry strategyRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final RiskServiceSettings settings;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, RiskEvent> events = new LinkedHashMap<>();
    private final Map<String, BigDecimal> exposureByStrategy = new LinkedHashMap<>();
    private final Map<String, BigDecimal> drawdownByStrategy = new LinkedHashMap<>();
    private long totalChecks;
    private long violations;
    private long blockedOrders;
    private long droppedEvents;
    private long droppedViolations;
    private int activeEvents;
    private long unresolvedWeight;
    private long evictedEvents;

    /** Ids of resolved events, oldest resolution first. First candidates for eviction. */
    private final Deque<String> resolvedIds = new ArrayDeque<>();

    private final BlockingQueue<RiskEvent> eventQueue;
    private final BlockingQueue<RiskEvent> violationQueue;
    private final RiskEventChannel eventStream;
    private final RiskEventChannel violationStream;

    private final Object lifecycleMonitor = new Object();
    private volatile boolean running;
    private CountDownLatch stopSignal;
    private final List<Thread> workers = new ArrayList<>();

    public RiskService(
            RiskChecker riskChecker,
            RiskEventRepository riskEventRepository,
            StrategyRegistry strategyRegistry,
            EventPublisherHelper eventPublisherHelper,
            RiskServiceSettings settings,
            Clock clock) {
        this.riskChecker = riskChecker;
        this.riskEventRepository = riskEventRepository;
        this.strategyRegistry = strategyRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.settings = settings;
        this.clock = clock;
        this.eventQueue = new ArrayBlockingQueue<>(settings.getEventBufferSize());
        this.violationQueue = new ArrayBlockingQueue<>(settings.getViolationBufferSize());
        this.eventStream = new RiskEventChannel(eventQueue, settings.getEventBufferSize());
        this.violationStream = new RiskEventChannel(violationQueue, settings.getViolationBufferSize());
    }

    // ========================
    // CHECKS
    // ========================

    /**
     * Validates an order against the strategy's limits. A failure counts as a blocked order
     * and emits a BLOCK_ORDER event before the violation is rethrown.
     */
    @Override
    public void validateOrder(Order order) {
        try {
            riskChecker.validateOrder(order);
            recordPassedCheck();
        } catch (RiskViolationException e) {
            recordViolation(true);

            Map<String, Object> data = violationData(e);
            data.put("orderId", order.getId());
            data.put("side", order.getSide().code());
            data.put("quantity", order.getQuantity().toString());
            data.put("price", order.getPrice().toString());

            RiskEventType type = RiskViolation.EXPOSURE_LIMIT_EXCEEDED.equals(e.getCode())
                    ? RiskEventType.EXPOSURE_LIMIT
                    : RiskEventType.ORDER_VALIDATION;
            emitRiskEvent(newEvent(type, order.getStrategyId(), order.getSymbol(), e, data, RiskAction.BLOCK_ORDER));
            throw e;
        }
    }

    public void validatePosition(Position position) {
        try {
            riskChecker.validatePosition(position);
            recordPassedCheck();
        } catch (RiskViolationException e) {
            recordViolation(false);

            Map<String, Object> data = violationData(e);
            data.put("quantity", plain(position.getQuantity()));
            data.put("unrealizedPnl", plain(position.getUnrealizedPnl()));
            emitRiskEvent(newEvent(
                    RiskEventType.POSITION_VALIDATION,
                    position.getStrategyId(),
                    position.getSymbol(),
                    e,
                    data,
                    RiskAction.MONITOR_POSITION));
            throw e;
        }
    }

    /**
     * Computes and checks the strategy's exposure. The computed value is cached for
     * {@link #getExposureSnapshot(String)} whether or not it breaches the limit.
     *
     * @throws DependencyUnavailableException if the exposure cannot be computed; not counted as a check
     */
    public BigDecimal checkExposure(String strategyId) {
        BigDecimal exposure = riskChecker.currentExposure(strategyId);
        lock.writeLock().lock();
        try {
            exposureByStrategy.put(strategyId, exposure);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            riskChecker.evaluateExposure(strategyId, exposure);
            recordPassedCheck();
            return exposure;
        } catch (RiskViolationException e) {
            recordViolation(false);

            Map<String, Object> data = violationData(e);
            data.put("currentExposure", exposure.toPlainString());
            data.put("limit", plain(riskChecker.limitsFor(strategyId).getMaxExposure()));
            emitRiskEvent(newEvent(RiskEventType.EXPOSURE_LIMIT, strategyId, null, e, data, RiskAction.REDUCE_EXPOSURE));
            throw e;
        }
    }

    /**
     * Computes and checks the strategy's drawdown. A breach is CRITICAL and stops the strategy.
     *
     * @throws DependencyUnavailableException if the drawdown cannot be computed; not counted as a check
     */
    public BigDecimal checkDrawdown(String strategyId) {
        BigDecimal drawdown = riskChecker.currentDrawdown(strategyId);
        lock.writeLock().lock();
        try {
            drawdownByStrategy.put(strategyId, drawdown);
        } finally {
            lock.writeLock().unlock();
        }

        try {
            riskChecker.evaluateDrawdown(strategyId, drawdown);
            recordPassedCheck();
            return drawdown;
        } catch (RiskViolationException e) {
            recordViolation(false);

            Map<String, Object> data = violationData(e);
            data.put("currentDrawdownPercent", drawdown.toPlainString());
            data.put("limit", plain(riskChecker.limitsFor(strategyId).getMaxDrawdownPercent()));
            emitRiskEvent(newEvent(RiskEventType.DRAWDOWN_LIMIT, strategyId, null, e, data, RiskAction.STOP_STRATEGY));
            throw e;
        }
    }

    // ========================
    // EVENTS
    // ========================

    /**
     * Records an event and hands it to the channels. Never blocks: an event that does not
     * fit in a full channel is counted as dropped but stays in the event map, which holds at
     * most {@code maxRetainedEvents} entries.
     */
    public void emitRiskEvent(RiskEvent event) {
        boolean queued;
        boolean escalated = event.getSeverity().isEscalated();
        boolean escalationQueued = false;
        int evicted;

        lock.writeLock().lock();
        try {
            RiskEvent previous = events.put(event.getId(), event);
            if (previous != null && !previous.isResolved()) {
                untrack(previous);
            }
            if (event.isResolved()) {
                resolvedIds.addLast(event.getId());
            } else {
                track(event);
            }
            evicted = enforceRetention();

            queued = eventQueue.offer(event);
            if (!queued) {
                droppedEvents++;
            }
            if (escalated) {
                escalationQueued = violationQueue.offer(event);
                if (!escalationQueued) {
                    droppedViolations++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (evicted > 0) {
            log.warn("Risk event retention limit reached, evicted {} unresolved events: limit={}",
                    evicted, settings.getMaxRetainedEvents());
        }
        if (!queued) {
            log.warn("Risk event channel full, event dropped from channel: eventId={}, type={}",
                    event.getId(), event.getType().code());
        }
        if (escalated && !escalationQueued) {
            log.warn("Risk violation channel full, escalation dropped: eventId={}, severity={}",
                    event.getId(), event.getSeverity().code());
        }
        log.info(
                "Risk event emitted: eventId={}, type={}, severity={}, strategyId={}, action={}, description={}",
                event.getId(),
                event.getType().code(),
                event.getSeverity().code(),
                event.getStrategyId(),
                event.getAction().code(),
                event.getDescription());
    }

    /**
     * Marks an event resolved so it no longer counts toward the risk score.
     *
     * @return true if the event existed and was unresolved
     */
    public boolean resolveEvent(String eventId) {
        lock.writeLock().lock();
        try {
            RiskEvent event = events.get(eventId);
            if (event == null || event.isResolved()) {
                return false;
            }
            untrack(event);
            events.put(eventId, event.resolve(clock.instant()));
            resolvedIds.addLast(eventId);
            enforceRetention();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Risk event resolved: eventId={}", eventId);
        return true;
    }

    public Optional<RiskEvent> getEvent(String eventId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(events.get(eventId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All tracked events, oldest first. */
    public List<RiskEvent> getEvents() {
        lock.readLock().lock();
        try {
            return List.copyOf(events.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Unresolved events of one strategy, oldest first. */
    public List<RiskEvent> getActiveEvents(String strategyId) {
        lock.readLock().lock();
        try {
            List<RiskEvent> active = new ArrayList<>();
            for (RiskEvent event : events.values()) {
                if (!event.isResolved() && strategyId.equals(event.getStrategyId())) {
                    active.add(event);
                }
            }
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Last exposure computed for the strategy by a check or the monitor. */
    public Optional<BigDecimal> getExposureSnapshot(String strategyId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(exposureByStrategy.get(strategyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Last drawdown computed for the strategy by a check or the monitor. */
    public Optional<BigDecimal> getDrawdownSnapshot(String strategyId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(drawdownByStrategy.get(strategyId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Consumer view of every emitted event. Competes with the processing loop while started. */
    public RiskEventChannel eventStream() {
        return eventStream;
    }

    /** Consumer view of HIGH and CRITICAL events. */
    public RiskEventChannel violationStream() {
        return violationStream;
    }

    public RiskMetrics getMetrics() {
        lock.readLock().lock();
        try {
            double rate = totalChecks == 0 ? 0.0 : (double) violations / totalChecks;
            return RiskMetrics.builder()
                    .totalChecks(totalChecks)
                    .violations(violations)
                    .blockedOrders(blockedOrders)
                    .violationRate(rate)
                    .riskScore((int) Math.min(unresolvedWeight, MAX_RISK_SCORE))
                    .activeEvents(activeEvents)
                    .droppedEvents(droppedEvents)
                    .droppedViolations(droppedViolations)
                    .evictedEvents(evictedEvents)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================
    // MONITORING
    // ========================

    /** Checks exposure of every active strategy once. Used by the exposure monitor. */
    public void sweepExposure() {
        sweep("exposure", this::checkExposure);
    }

    /** Checks drawdown of every active strategy once. Used by the drawdown monitor. */
    public void sweepDrawdown() {
        sweep("drawdown", this::checkDrawdown);
    }

    private void sweep(String checkName, Consumer<String> check) {
        Set<String> strategyIds;
        try {
            strategyIds = strategyRegistry.activeStrategyIds();
        } catch (RuntimeException e) {
            log.warn("Cannot list active strategies, skipping {} sweep: reason={}", checkName, e.getMessage());
            return;
        }

        for (String strategyId : strategyIds) {
            try {
                check.accept(strategyId);
            } catch (RiskViolationException e) {
                log.debug("{} check failed during sweep: strategyId={}, code={}", checkName, strategyId, e.getCode());
            } catch (DependencyUnavailableException e) {
                log.warn("{} check skipped, data unavailable: strategyId={}, reason={}",
                        checkName, strategyId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} check errored: strategyId={}", checkName, strategyId, e);
            }
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            workers.add(newWorker("risk-event-processor", () -> processLoop(signal)));
            workers.add(newWorker(
                    "risk-exposure-monitor",
                    () -> monitorLoop(signal, settings.getExposureCheckInterval(), this::sweepExposure)));
            workers.add(newWorker(
                    "risk-drawdown-monitor",
                    () -> monitorLoop(signal, settings.getDrawdownCheckInterval(), this::sweepDrawdown)));
            running = true;
            workers.forEach(Thread::start);
            log.info("RiskService started: eventBuffer={}, violationBuffer={}, exposureInterval={}, drawdownInterval={}",
                    settings.getEventBufferSize(),
                    settings.getViolationBufferSize(),
                    settings.getExposureCheckInterval(),
                    settings.getDrawdownCheckInterval());
        }
    }

    /**
     * Signals all background threads and waits for them to exit, each for at most the
     * configured stop timeout. Safe to call more than once.
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            stopSignal.countDown();
            workers.forEach(Thread::interrupt);

            long timeoutMillis = settings.getStopTimeout().toMillis();
            for (Thread worker : workers) {
                try {
                    worker.join(timeoutMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for {} to stop", worker.getName());
                    break;
                }
                if (worker.isAlive()) {
                    log.warn("{} did not stop within {}", worker.getName(), settings.getStopTimeout());
                }
            }
            workers.clear();
            log.info("RiskService stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private Thread newWorker(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        return thread;
    }

    private void processLoop(CountDownLatch signal) {
        log.info("Risk event processor started");
        while (signal.getCount() > 0) {
            RiskEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            processEvent(event);
        }
        log.info("Risk event processor stopped");
    }

    private void monitorLoop(CountDownLatch signal, Duration interval, Runnable sweep) {
        log.info("{} started: interval={}", Thread.currentThread().getName(), interval);
        try {
            while (!signal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                sweep.run();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("{} stopped", Thread.currentThread().getName());
    }

    /** Persists the event, performs its action and publishes it. Failures are logged. */
    void processEvent(RiskEvent event) {
        try {
            riskEventRepository.save(event);
        } catch (RuntimeException e) {
            log.error("Failed to persist risk event: eventId={}", event.getId(), e);
        }

        try {
            String outcome = switch (event.getAction()) {
                case BLOCK_ORDER -> "order already blocked";
                case MONITOR_POSITION -> {
                    log.info("Monitoring position: strategyId={}, symbol={}, reason={}",
                            event.getStrategyId(), event.getSymbol(), event.getDescription());
                    yield "position flagged";
                }
                case REDUCE_EXPOSURE -> {
                    log.warn("Requesting exposure reduction: strategyId={}, reason={}",
                            event.getStrategyId(), event.getDescription());
                    eventPublisherHelper.publishExposureReduction(this, event);
                    yield "exposure reduction requested";
                }
                case STOP_STRATEGY -> {
                    log.error("Stopping strategy: strategyId={}, reason={}",
                            event.getStrategyId(), event.getDescription());
                    eventPublisherHelper.publishStrategyHalt(this, event);
                    yield "strategy halt requested";
                }
            };
            eventPublisherHelper.publishRiskEvent(event);
            log.debug("Risk event processed: eventId={}, outcome={}", event.getId(), outcome);
        } catch (RuntimeException e) {
            log.error("Failed to handle risk event: eventId={}, action={}", event.getId(), event.getAction(), e);
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private void recordPassedCheck() {
        lock.writeLock().lock();
        try {
            totalChecks++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void recordViolation(boolean orderBlocked) {
        lock.writeLock().lock();
        try {
            totalChecks++;
            violations++;
            if (orderBlocked) {
                blockedOrders++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Keeps at most {@code maxRetainedEvents} events. Resolved events go first, oldest
     * resolution first; only then are the oldest unresolved events evicted, which also
     * removes their weight from the risk score. Caller holds the write lock.
     *
     * @return number of unresolved events evicted
     */
    private int enforceRetention() {
        int limit = settings.getMaxRetainedEvents();
        while (events.size() > limit && !resolvedIds.isEmpty()) {
            String id = resolvedIds.pollFirst();
            RiskEvent retained = events.get(id);
            if (retained != null && retained.isResolved()) {
                events.remove(id);
            }
        }

        int evicted = 0;
        Iterator<RiskEvent> oldestFirst = events.values().iterator();
        while (events.size() > limit && oldestFirst.hasNext()) {
            RiskEvent oldest = oldestFirst.next();
            oldestFirst.remove();
            if (!oldest.isResolved()) {
                untrack(oldest);
                evicted++;
            }
        }
        evictedEvents += evicted;
        return evicted;
    }

    // caller holds the write lock
    private void track(RiskEvent event) {
        activeEvents++;
        unresolvedWeight += event.getSeverity().weight();
    }

    // caller holds the write lock
    private void untrack(RiskEvent event) {
        activeEvents--;
        unresolvedWeight -= event.getSeverity().weight();
    }

    private RiskEvent newEvent(
            RiskEventType type,
            String strategyId,
            String symbol,
            RiskViolationException violation,
            Map<String, Object> data,
            RiskAction action) {
        return RiskEvent.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .severity(severityOf(type))
                .strategyId(strategyId)
                .symbol(symbol)
                .description(violation.getMessage())
                .data(Collections.unmodifiableMap(data))
                .action(action)
                .resolved(false)
                .createdAt(clock.instant())
                .build();
    }

    static RiskSeverity severityOf(RiskEventType type) {
        return switch (type) {
            case ORDER_VALIDATION -> RiskSeverity.MEDIUM;
            case POSITION_VALIDATION, EXPOSURE_LIMIT -> RiskSeverity.HIGH;
            case DRAWDOWN_LIMIT -> RiskSeverity.CRITICAL;
        };
    }

    private static Map<String, Object> violationData(RiskViolationException e) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", e.getCode());
        return data;
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }
}
