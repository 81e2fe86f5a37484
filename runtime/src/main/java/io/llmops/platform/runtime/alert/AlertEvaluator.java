package io.llmops.platform.runtime.alert;

import io.llmops.platform.runtime.event.AlertTransitionEvent;
import io.llmops.platform.runtime.instance.BackgroundLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Evaluates alert rules against a metrics source on a fixed tick.
 *
 * <p>The tick is the evaluation interval, shortened to the shortest non-zero
 * rule duration. A rule fires only once its condition has held continuously
 * for the rule's duration. When the source is unreachable, or delivers no
 * sample for a rule, the rule's condition is unknown and its state is left as
 * it was.</p>
 */
public class AlertEvaluator implements BackgroundLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertEvaluator.class);

    public static final Duration DEFAULT_EVALUATION_INTERVAL = Duration.ofSeconds(15);

    private static final Duration MIN_TICK = Duration.ofMillis(100);
    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final List<AlertRule> rules;
    private final MetricsSource source;
    private final Clock clock;
    private final Duration tickInterval;
    private final Map<String, RuleTracker> trackers = new LinkedHashMap<>();
    private final AtomicReference<AlertSnapshot> snapshot = new AtomicReference<>();
    private final AtomicLong version = new AtomicLong();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<AlertSnapshot>> snapshotListeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock evaluationLock = new ReentrantLock();

    private volatile ScheduledExecutorService executor;

    /**
     * Create an alert evaluator.
     *
     * @param rules rules to evaluate
     * @param source metrics source
     * @param evaluationInterval configured evaluation interval
     * @param clock evaluation clock
     */
    public AlertEvaluator(
            @Nonnull List<AlertRule> rules,
            @Nonnull MetricsSource source,
            @Nonnull Duration evaluationInterval,
            @Nonnull Clock clock) {
        this.rules = List.copyOf(rules);
        this.source = Objects.requireNonNull(source, "source");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (this.rules.isEmpty()) {
            throw new IllegalArgumentException("at least one alert rule is required");
        }
        for (AlertRule rule : this.rules) {
            if (trackers.putIfAbsent(rule.name(), new RuleTracker(rule)) != null) {
                throw new IllegalArgumentException("duplicate alert rule: " + rule.name());
            }
        }
        this.tickInterval = tickInterval(evaluationInterval, this.rules);
        publish(clock.instant());
    }

    /**
     * Compute the evaluation tick.
     *
     * @param evaluationInterval configured interval
     * @param rules the rules
     * @return the smaller of the interval and the shortest non-zero rule duration
     */
    @Nonnull
    public static Duration tickInterval(@Nonnull Duration evaluationInterval, @Nonnull List<AlertRule> rules) {
        Duration tick = evaluationInterval;
        for (AlertRule rule : rules) {
            if (!rule.duration().isZero() && rule.duration().compareTo(tick) < 0) {
                tick = rule.duration();
            }
        }
        return tick.compareTo(MIN_TICK) < 0 ? MIN_TICK : tick;
    }

    public void addListener(@Nonnull AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Register a consumer called with every published snapshot.
     *
     * @param listener snapshot consumer
     */
    public void addSnapshotListener(@Nonnull Consumer<AlertSnapshot> listener) {
        snapshotListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ==================== Loop ====================

    @Nonnull
    @Override
    public String getName() {
        return "alert-evaluator";
    }

    @Override
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "AlertEvaluator");
            t.setDaemon(true);
            return t;
        });
        long tick = tickInterval.toMillis();
        executor.scheduleWithFixedDelay(this::tick, tick, tick, TimeUnit.MILLISECONDS);
        LOGGER.info("Evaluating {} alert rules every {}ms", rules.size(), tick);
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
            if (!current.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Alert evaluation did not finish within {}ms, interrupting", STOP_GRACE.toMillis());
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Alert evaluator stopped");
    }

    @Override
    public boolean isRunning() {
        return executor != null;
    }

    private void tick() {
        try {
            evaluateNow();
        } catch (RuntimeException e) {
            LOGGER.error("Alert evaluation failed unexpectedly", e);
        }
    }

    // ==================== Evaluation ====================

    /**
     * Run one evaluation, waiting for an evaluation already in progress.
     *
     * @return the states after this evaluation
     */
    @Nonnull
    public AlertSnapshot evaluateNow() {
        evaluationLock.lock();
        List<AlertTransitionEvent> events = new ArrayList<>();
        try {
            Instant now = clock.instant();
            List<MetricSample> batch;
            try {
                batch = source.poll();
            } catch (MetricsUnavailableException e) {
                LOGGER.warn("Metrics source unavailable, alert states unchanged: {}", e.getMessage());
                return snapshot.get();
            }

            List<MetricSample> ordered = new ArrayList<>(batch);
            ordered.sort(Comparator.comparing(MetricSample::timestamp));

            for (RuleTracker tracker : trackers.values()) {
                Condition condition = tracker.observe(ordered, now);
                if (condition == null) {
                    LOGGER.debug("Alert '{}' condition unknown, state kept at {}", tracker.rule.name(), tracker.state.status());
                    continue;
                }
                AlertTransitionEvent event = tracker.apply(condition, now);
                if (event != null) {
                    events.add(event);
                }
            }
            publish(now);
        } finally {
            evaluationLock.unlock();
        }

        for (AlertTransitionEvent event : events) {
            log(event);
            for (AlertListener listener : listeners) {
                try {
                    listener.onTransition(event);
                } catch (RuntimeException e) {
                    LOGGER.error("Alert listener failed for {}", event, e);
                }
            }
        }
        return snapshot.get();
    }

    private static void log(AlertTransitionEvent event) {
        AlertRule rule = event.getRule();
        AlertState state = event.getState();
        switch (event.getNewStatus()) {
            case FIRING -> LOGGER.warn("Alert '{}' FIRING: {} {} for {}s (last value {})",
                    rule.name(), rule.metric(), rule.describeThreshold(), rule.duration().toSeconds(), state.lastValue());
            case RESOLVED -> LOGGER.info("Alert '{}' RESOLVED (last value {})", rule.name(), state.lastValue());
            default -> LOGGER.debug("Alert '{}' {} -> {}", rule.name(), event.getPreviousStatus(), state.status());
        }
    }

    private void publish(Instant now) {
        List<AlertState> states = new ArrayList<>(trackers.size());
        for (RuleTracker tracker : trackers.values()) {
            states.add(tracker.state);
        }
        AlertSnapshot next = new AlertSnapshot(states, now, version.incrementAndGet());
        snapshot.set(next);
        for (Consumer<AlertSnapshot> listener : snapshotListeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                LOGGER.error("Alert snapshot listener failed", e);
            }
        }
    }

    // ==================== State ====================

    @Nonnull
    public AlertSnapshot getSnapshot() {
        return snapshot.get();
    }

    @Nonnull
    public List<AlertRule> getRules() {
        return rules;
    }

    @Nonnull
    public Duration getTickInterval() {
        return tickInterval;
    }

    /**
     * Outcome of one observation of a rule's metric.
     *
     * @param holds whether the condition is true
     * @param since earliest time the condition can be said to hold from
     * @param value observed value
     */
    private record Condition(boolean holds, Instant since, double value) {
    }

    /**
     * Mutable per-rule state. Only touched under the evaluation lock.
     */
    private static final class RuleTracker {
        private final AlertRule rule;
        private final Map<String, Deque<MetricSample>> failedSeries = new HashMap<>();
        private final Map<String, Deque<MetricSample>> totalSeries = new HashMap<>();
        private boolean unmatchedReported;
        private volatile AlertState state;

        private RuleTracker(AlertRule rule) {
            this.rule = rule;
            this.state = AlertState.initial(rule.name());
        }

        @Nullable
        private Condition observe(List<MetricSample> batch, Instant now) {
            List<MetricSample> selected = select(batch, rule.metric());
            if (rule.kind() == AlertRule.Kind.VALUE) {
                reportUnmatched(batch, selected.isEmpty(), rule.metric());
                return observeValue(selected, now);
            }
            List<MetricSample> totals = select(batch, rule.totalMetric());
            reportUnmatched(batch, totals.isEmpty(), rule.totalMetric());
            return observePercentage(selected, totals, now);
        }

        private static List<MetricSample> select(List<MetricSample> batch, MetricSelector selector) {
            List<MetricSample> selected = new ArrayList<>();
            for (MetricSample sample : batch) {
                if (selector.matches(sample)) {
                    selected.add(sample);
                }
            }
            return selected;
        }

        private void reportUnmatched(List<MetricSample> batch, boolean unmatched, MetricSelector selector) {
            if (batch.isEmpty()) {
                return;
            }
            if (unmatched && !unmatchedReported) {
                LOGGER.warn("Alert '{}': no target exposes {}, its condition stays unknown", rule.name(), selector);
            }
            unmatchedReported = unmatched;
        }

        @Nullable
        private Condition observeValue(List<MetricSample> samples, Instant now) {
            if (samples.isEmpty()) {
                return null;
            }
            boolean holds = true;
            for (MetricSample sample : samples) {
                if (!(sample.value() > rule.threshold())) {
                    holds = false;
                    break;
                }
            }
            Instant earliest = samples.get(0).timestamp();
            Instant since = earliest.isAfter(now) ? now : earliest;
            return new Condition(holds, since, samples.get(samples.size() - 1).value());
        }

        /**
         * Ratio of the failed counter's increase to the total counter's
         * increase over the trailing window. Unknown until some total series
         * has a sample at or before the window start, i.e. until the whole
         * window has been observed.
         */
        @Nullable
        private Condition observePercentage(List<MetricSample> failed, List<MetricSample> totals, Instant now) {
            append(failedSeries, failed);
            append(totalSeries, totals);
            if (totals.isEmpty()) {
                return null;
            }

            Instant windowStart = now.minus(rule.duration());
            trim(failedSeries, windowStart);
            trim(totalSeries, windowStart);

            boolean fullWindow = false;
            for (Deque<MetricSample> series : totalSeries.values()) {
                if (!series.getFirst().timestamp().isAfter(windowStart)) {
                    fullWindow = true;
                    break;
                }
            }
            if (!fullWindow) {
                return null;
            }

            double failedIncrease = increase(failedSeries);
            double totalIncrease = increase(totalSeries);
            if (totalIncrease <= 0) {
                return new Condition(false, windowStart, 0.0);
            }
            double ratio = failedIncrease / totalIncrease;
            return new Condition(ratio > rule.threshold(), windowStart, ratio);
        }

        private static void append(Map<String, Deque<MetricSample>> series, List<MetricSample> samples) {
            for (MetricSample sample : samples) {
                series.computeIfAbsent(sample.seriesKey(), k -> new ArrayDeque<>()).addLast(sample);
            }
        }

        /**
         * Drop samples older than each series' last sample at or before the
         * window start, which is kept as the baseline of the increase.
         */
        private static void trim(Map<String, Deque<MetricSample>> series, Instant windowStart) {
            for (Deque<MetricSample> samples : series.values()) {
                while (samples.size() > 1) {
                    MetricSample first = samples.removeFirst();
                    if (samples.getFirst().timestamp().isAfter(windowStart)) {
                        samples.addFirst(first);
                        break;
                    }
                }
            }
        }

        /**
         * Sum of the counter increases of every series. A drop in value is a
         * counter reset, after which the new value is the increase.
         */
        private static double increase(Map<String, Deque<MetricSample>> series) {
            double sum = 0;
            for (Deque<MetricSample> samples : series.values()) {
                MetricSample previous = null;
                for (MetricSample sample : samples) {
                    if (previous != null) {
                        double delta = sample.value() - previous.value();
                        sum += delta >= 0 ? delta : sample.value();
                    }
                    previous = sample;
                }
            }
            return sum;
        }

        @Nullable
        private AlertTransitionEvent apply(Condition condition, Instant now) {
            AlertState before = state;
            AlertStatus previous = before.status();
            AlertStatus status;
            Instant since;

            if (condition.holds()) {
                if (previous == AlertStatus.OK || previous == AlertStatus.RESOLVED) {
                    since = condition.since();
                    status = AlertStatus.PENDING;
                } else {
                    since = before.conditionSince() != null ? before.conditionSince() : condition.since();
                    status = previous;
                }
                if (status == AlertStatus.PENDING && Duration.between(since, now).compareTo(rule.duration()) >= 0) {
                    status = AlertStatus.FIRING;
                }
            } else {
                since = null;
                status = switch (previous) {
                    case FIRING -> AlertStatus.RESOLVED;
                    default -> AlertStatus.OK;
                };
            }

            boolean changed = status != previous;
            state = new AlertState(rule.name(), status, since, condition.value(),
                    changed ? now : before.lastTransition());
            return changed ? new AlertTransitionEvent(rule, previous, state) : null;
        }
    }
}
