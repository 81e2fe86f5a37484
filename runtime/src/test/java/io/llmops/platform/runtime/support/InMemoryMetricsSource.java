package io.llmops.platform.runtime.support;

import io.llmops.platform.runtime.alert.MetricSample;
import io.llmops.platform.runtime.alert.MetricsSource;
import io.llmops.platform.runtime.alert.MetricsUnavailableException;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Metrics source the test feeds by hand.
 */
public class InMemoryMetricsSource implements MetricsSource {

    private final ConcurrentLinkedQueue<MetricSample> pending = new ConcurrentLinkedQueue<>();
    private volatile boolean available = true;

    /**
     * Record a sample.
     *
     * @param sample the sample
     */
    public void record(@Nonnull MetricSample sample) {
        pending.add(sample);
    }

    /**
     * Record an unlabelled sample.
     *
     * @param metric metric name
     * @param timestamp observation time
     * @param value observed value
     */
    public void record(@Nonnull String metric, @Nonnull Instant timestamp, double value) {
        record(MetricSample.of(metric, timestamp, value));
    }

    /**
     * Simulate the source going away or coming back. Samples recorded while
     * unavailable are delivered once it is available again.
     *
     * @param available false to make {@link #poll()} throw
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Nonnull
    @Override
    public List<MetricSample> poll() throws MetricsUnavailableException {
        if (!available) {
            throw new MetricsUnavailableException("in-memory metrics source is unavailable");
        }
        List<MetricSample> drained = new ArrayList<>();
        MetricSample sample;
        while ((sample = pending.poll()) != null) {
            drained.add(sample);
        }
        return drained;
    }
}
