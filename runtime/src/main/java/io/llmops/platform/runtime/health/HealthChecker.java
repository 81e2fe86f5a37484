package io.llmops.platform.runtime.health;

import io.llmops.platform.runtime.config.HealthCheckSpec;
import io.llmops.platform.runtime.event.TargetHealthEvent;
import io.llmops.platform.runtime.instance.BackgroundLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Probes the load balancer's backend targets and maintains pool membership.
 *
 * <p>Membership uses hysteresis: a healthy target is ejected only after
 * {@code retries} consecutive failed probes, and an ejected target rejoins
 * after {@code healthy_threshold} consecutive successful probes. Every target
 * starts healthy.</p>
 *
 * <p>Each target is probed on its own fixed-delay schedule with at most one
 * probe in flight. The pool is published as an immutable {@link PoolSnapshot};
 * listeners are told about membership transitions only.</p>
 */
public class HealthChecker implements BackgroundLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthChecker.class);

    private static final Duration STOP_GRACE = Duration.ofSeconds(1);

    private final HealthCheckSpec spec;
    private final HealthProbe probe;
    private final Clock clock;
    private final Map<String, TargetTracker> trackers = new LinkedHashMap<>();
    private final AtomicReference<PoolSnapshot> snapshot = new AtomicReference<>();
    private final AtomicLong version = new AtomicLong();
    private final List<PoolListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PoolSnapshot>> snapshotListeners = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();

    private volatile ScheduledExecutorService executor;

    /**
     * Create a health checker.
     *
     * @param addresses backend targets, {@code host:port}
     * @param spec probe settings
     * @param probe probe implementation
     * @param clock clock for snapshot timestamps
     */
    public HealthChecker(
            @Nonnull List<String> addresses,
            @Nonnull HealthCheckSpec spec,
            @Nonnull HealthProbe probe,
            @Nonnull Clock clock) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String address : addresses) {
            trackers.putIfAbsent(address, new TargetTracker(address));
        }
        if (trackers.isEmpty()) {
            throw new IllegalArgumentException("at least one backend target is required");
        }
        publish();
    }

    /**
     * Register a pool listener.
     *
     * @param listener the listener
     */
    public void addListener(@Nonnull PoolListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Register a consumer called with every published snapshot, including
     * those that only update counters.
     *
     * @param listener snapshot consumer
     */
    public void addSnapshotListener(@Nonnull Consumer<PoolSnapshot> listener) {
        snapshotListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ==================== Loop ====================

    @Nonnull
    @Override
    public String getName() {
        return "health-checker";
    }

    @Override
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        AtomicInteger threads = new AtomicInteger();
        executor = Executors.newScheduledThreadPool(Math.min(trackers.size(), 4), r -> {
            Thread t = new Thread(r, "HealthChecker-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long interval = spec.interval().toMillis();
        for (TargetTracker tracker : trackers.values()) {
            executor.scheduleWithFixedDelay(() -> tick(tracker), 0, interval, TimeUnit.MILLISECONDS);
        }
        LOGGER.info("Health checking {} targets every {}ms (path {}, retries {}, healthy threshold {})",
                trackers.size(), interval, spec.path(), spec.retries(), spec.healthyThreshold());
    }

    @Override
    public void stop() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
            executor = null;
        }
        if (current == null) {
            return;
        }

        current.shutdown();
        try {
            long wait = spec.timeout().plus(STOP_GRACE).toMillis();
            if (!current.awaitTermination(wait, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Health check tick did not finish within {}ms, interrupting", wait);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health checker stopped");
    }

    @Override
    public boolean isRunning() {
        return executor != null;
    }

    private void tick(TargetTracker tracker) {
        if (!tracker.lock.tryLock()) {
            return;
        }
        try {
            probeAndApply(tracker);
        } catch (RuntimeException e) {
            LOGGER.error("Health check of {} failed unexpectedly", tracker.address, e);
        } finally {
            tracker.lock.unlock();
        }
    }

    // ==================== Probing ====================

    /**
     * Probe every target once, waiting for probes already in flight.
     *
     * @return the pool after all probes were applied
     */
    @Nonnull
    public PoolSnapshot checkNow() {
        for (TargetTracker tracker : trackers.values()) {
            checkTarget(tracker);
        }
        return getSnapshot();
    }

    /**
     * Probe one target once, waiting for a probe already in flight.
     *
     * @param address target address
     * @return the pool after the probe was applied
     */
    @Nonnull
    public PoolSnapshot checkNow(@Nonnull String address) {
        TargetTracker tracker = trackers.get(address);
        if (tracker == null) {
            throw new IllegalArgumentException("unknown target: " + address);
        }
        checkTarget(tracker);
        return getSnapshot();
    }

    private void checkTarget(TargetTracker tracker) {
        tracker.lock.lock();
        try {
            probeAndApply(tracker);
        } finally {
            tracker.lock.unlock();
        }
    }

    private void probeAndApply(TargetTracker tracker) {
        HealthCheckResult result;
        try {
            result = probe.probe(tracker.address, spec.path(), spec.timeout());
        } catch (RuntimeException e) {
            result = HealthCheckResult.failure(tracker.address, Instant.now(clock), Duration.ZERO,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        apply(tracker, result);
    }

    /**
     * Apply a probe result to a target's counters. Must hold the tracker's lock.
     */
    private void apply(TargetTracker tracker, HealthCheckResult result) {
        BackendTarget before = tracker.current;
        BackendTarget after;
        if (result.success()) {
            int successes = before.consecutiveSuccesses() + 1;
            TargetState state = before.state() == TargetState.UNHEALTHY && successes >= spec.healthyThreshold()
                    ? TargetState.HEALTHY
                    : before.state();
            after = new BackendTarget(tracker.address, state, 0, successes, result);
        } else {
            int failures = before.consecutiveFailures() + 1;
            TargetState state = before.state() == TargetState.HEALTHY && failures >= spec.retries()
                    ? TargetState.UNHEALTHY
                    : before.state();
            after = new BackendTarget(tracker.address, state, failures, 0, result);
        }
        tracker.current = after;

        PoolSnapshot published = publish();
        if (after.state() == before.state()) {
            return;
        }

        TargetHealthEvent event = new TargetHealthEvent(tracker.address, before.state(), after.state(), result);
        if (event.becameUnhealthy()) {
            LOGGER.warn("Target {} ejected after {} consecutive failures: {}",
                    tracker.address, after.consecutiveFailures(), result.error());
        } else {
            LOGGER.info("Target {} back in pool after {} consecutive successes",
                    tracker.address, after.consecutiveSuccesses());
        }
        if (published.degraded()) {
            LOGGER.warn("All {} targets unhealthy, routing to every target", published.targets().size());
        }
        for (PoolListener listener : listeners) {
            try {
                listener.onPoolChange(event, published);
            } catch (RuntimeException e) {
                LOGGER.error("Pool listener failed for {}", event, e);
            }
        }
    }

    private PoolSnapshot publish() {
        synchronized (publishLock) {
            List<BackendTarget> targets = new ArrayList<>(trackers.size());
            for (TargetTracker tracker : trackers.values()) {
                targets.add(tracker.current);
            }
            PoolSnapshot next = PoolSnapshot.of(targets, Instant.now(clock), version.incrementAndGet());
            snapshot.set(next);
            for (Consumer<PoolSnapshot> listener : snapshotListeners) {
                try {
                    listener.accept(next);
                } catch (RuntimeException e) {
                    LOGGER.error("Pool snapshot listener failed", e);
                }
            }
            return next;
        }
    }

    // ==================== State ====================

    /**
     * Get the latest published pool.
     *
     * @return the pool snapshot
     */
    @Nonnull
    public PoolSnapshot getSnapshot() {
        return snapshot.get();
    }

    @Nonnull
    public List<String> getEligibleTargets() {
        return getSnapshot().eligible();
    }

    @Nonnull
    public HealthCheckSpec getSpec() {
        return spec;
    }

    private static final class TargetTracker {
        private final String address;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile BackendTarget current;

        private TargetTracker(String address) {
            this.address = address;
            this.current = BackendTarget.initial(address);
        }
    }
}
