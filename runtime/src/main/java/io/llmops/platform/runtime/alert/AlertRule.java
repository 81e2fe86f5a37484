package io.llmops.platform.runtime.alert;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.DurationParser;
import io.llmops.platform.runtime.config.RoleConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A threshold and duration condition over one metric.
 *
 * <p>Value rules compare the samples of {@code metric}; when no metric is
 * configured the rule name is used as the metric name. Percentage rules
 * compare the increase of a failed-requests counter ({@code metric}, default
 * {@value #DEFAULT_FAILED_METRIC}) against the increase of a total-requests
 * counter ({@code total_metric}, default {@value #DEFAULT_TOTAL_METRIC})
 * over the rule's duration.</p>
 *
 * @param name rule name
 * @param metric series the rule watches; the failed counter for percentages
 * @param totalMetric total counter, percentage rules only
 * @param kind how the threshold is compared
 * @param threshold threshold value; seconds for duration thresholds, a
 *                  fraction for percentages
 * @param duration how long the condition must hold before firing
 */
public record AlertRule(
        String name,
        MetricSelector metric,
        @Nullable MetricSelector totalMetric,
        Kind kind,
        double threshold,
        Duration duration
) {

    public static final String DEFAULT_FAILED_METRIC = "http_requests_failed_total";
    public static final String DEFAULT_TOTAL_METRIC = "http_requests_total";

    /**
     * How a rule's threshold is applied.
     */
    public enum Kind {
        /**
         * Every sample observed since the previous evaluation must exceed the threshold.
         */
        VALUE,

        /**
         * The failed share of the requests counted in the trailing duration
         * window must exceed the threshold.
         */
        PERCENTAGE
    }

    public AlertRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        if ((kind == Kind.PERCENTAGE) != (totalMetric != null)) {
            throw new IllegalArgumentException("a total metric is required by, and only by, percentage rules");
        }
    }

    @Nonnull
    public static AlertRule value(@Nonnull String name, @Nonnull String metric, double threshold,
                                  @Nonnull Duration duration) {
        return new AlertRule(name, MetricSelector.parse(metric), null, Kind.VALUE, threshold, duration);
    }

    @Nonnull
    public static AlertRule percentage(@Nonnull String name, @Nonnull String failedMetric,
                                       @Nonnull String totalMetric, double threshold, @Nonnull Duration duration) {
        return new AlertRule(name, MetricSelector.parse(failedMetric), MetricSelector.parse(totalMetric),
                Kind.PERCENTAGE, threshold, duration);
    }

    /**
     * Parse a rule from its config section.
     *
     * @param name rule name
     * @param section raw section
     * @return the rule
     * @throws ConfigException if the threshold, duration or a metric selector is malformed
     */
    @Nonnull
    public static AlertRule parse(@Nonnull String name, @Nullable RoleConfig.AlertRuleSection section)
            throws ConfigException {
        String field = "alert_rules." + name;
        if (section == null) {
            throw ConfigException.invalid(field, "rule body is required");
        }
        if (section.getThreshold() == null || section.getThreshold().isBlank()) {
            throw ConfigException.invalid(field + ".threshold", "is required");
        }
        if (section.getDuration() == null || section.getDuration().isBlank()) {
            throw ConfigException.invalid(field + ".duration", "is required");
        }

        Duration duration = DurationParser.parseField(field + ".duration", section.getDuration(), Duration.ZERO);
        String threshold = section.getThreshold().trim();
        boolean percentage = threshold.endsWith("%");
        if (!percentage && section.getTotalMetric() != null) {
            throw ConfigException.invalid(field + ".total_metric", "only applies to percentage thresholds");
        }

        MetricSelector metric = selector(field + ".metric", section.getMetric(),
                percentage ? DEFAULT_FAILED_METRIC : name);
        try {
            if (percentage) {
                double percent = Double.parseDouble(threshold.substring(0, threshold.length() - 1).trim());
                if (percent < 0 || percent > 100) {
                    throw ConfigException.invalid(field + ".threshold", "percentage must be within 0..100");
                }
                MetricSelector total = selector(field + ".total_metric", section.getTotalMetric(), DEFAULT_TOTAL_METRIC);
                return new AlertRule(name, metric, total, Kind.PERCENTAGE, percent / 100.0, duration);
            }
            if (DurationParser.hasUnit(threshold)) {
                return new AlertRule(name, metric, null, Kind.VALUE,
                        DurationParser.toSeconds(DurationParser.parse(threshold)), duration);
            }
            double value = Double.parseDouble(threshold);
            if (!Double.isFinite(value)) {
                throw new NumberFormatException("not finite");
            }
            return new AlertRule(name, metric, null, Kind.VALUE, value, duration);
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(field + ".threshold",
                    "expected a number, a duration or a percentage, got '" + threshold + "'");
        }
    }

    private static MetricSelector selector(String field, @Nullable String configured, String fallback)
            throws ConfigException {
        String text = configured == null || configured.isBlank() ? fallback : configured;
        try {
            return MetricSelector.parse(text);
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(field, e.getMessage());
        }
    }

    /**
     * Parse every rule of a monitoring config.
     *
     * @param sections raw {@code alert_rules} map
     * @return rules in document order
     * @throws ConfigException if the map is empty or any rule is malformed
     */
    @Nonnull
    public static List<AlertRule> parseAll(@Nonnull Map<String, RoleConfig.AlertRuleSection> sections)
            throws ConfigException {
        if (sections.isEmpty()) {
            throw ConfigException.invalid("alert_rules", "at least one rule is required");
        }
        List<AlertRule> rules = new ArrayList<>(sections.size());
        for (Map.Entry<String, RoleConfig.AlertRuleSection> entry : sections.entrySet()) {
            rules.add(parse(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(rules);
    }

    /**
     * Describe the threshold the way it was configured.
     *
     * @return e.g. {@code > 0.5} or {@code > 5.0%}
     */
    @Nonnull
    public String describeThreshold() {
        return kind == Kind.PERCENTAGE ? "> " + (threshold * 100) + "%" : "> " + threshold;
    }
}
