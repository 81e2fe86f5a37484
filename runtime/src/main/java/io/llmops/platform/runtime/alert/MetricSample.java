package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One observation of a metric series.
 *
 * @param metric metric name
 * @param labels series labels, empty when the series has none
 * @param timestamp observation time
 * @param value observed value
 * @param source where the sample came from, e.g. the scraped target
 */
public record MetricSample(String metric, Map<String, String> labels, Instant timestamp, double value, String source) {

    public MetricSample {
        Objects.requireNonNull(metric, "metric");
        labels = Map.copyOf(labels);
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
    }

    @Nonnull
    public static MetricSample of(@Nonnull String metric, @Nonnull Instant timestamp, double value) {
        return new MetricSample(metric, Map.of(), timestamp, value, "local");
    }

    /**
     * Identify the series this sample belongs to, across polls.
     *
     * @return source, name and labels
     */
    @Nonnull
    public String seriesKey() {
        return source + "/" + metric + new TreeMap<>(labels);
    }
}
