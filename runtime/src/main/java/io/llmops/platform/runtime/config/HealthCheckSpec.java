package io.llmops.platform.runtime.config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Validated health-check settings of the load balancer role.
 *
 * @param path HTTP path probed on every backend
 * @param interval delay between two probes of the same target
 * @param timeout upper bound of a single probe
 * @param retries consecutive failures that eject a healthy target
 * @param healthyThreshold consecutive successes that restore an unhealthy target
 */
public record HealthCheckSpec(
        @Nonnull String path,
        @Nonnull Duration interval,
        @Nonnull Duration timeout,
        int retries,
        int healthyThreshold
) {

    public static final String DEFAULT_PATH = "/health";

    public HealthCheckSpec {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(timeout, "timeout");
        if (retries < 1) {
            throw new IllegalArgumentException("retries must be at least 1");
        }
        if (healthyThreshold < 1) {
            throw new IllegalArgumentException("healthyThreshold must be at least 1");
        }
    }

    /**
     * Build the spec from the raw {@code health_check} section.
     *
     * @param section raw section, null when the document has none
     * @return validated spec
     * @throws ConfigException if the section is missing or malformed
     */
    @Nonnull
    public static HealthCheckSpec from(@Nullable RoleConfig.HealthCheckSection section) throws ConfigException {
        if (section == null) {
            throw ConfigException.invalid("health_check", "section is required");
        }

        String path = section.getPath() != null ? section.getPath().trim() : DEFAULT_PATH;
        if (!path.startsWith("/")) {
            throw ConfigException.invalid("health_check.path", "must start with '/', got '" + path + "'");
        }

        if (section.getInterval() == null) {
            throw ConfigException.invalid("health_check.interval", "is required");
        }
        if (section.getTimeout() == null) {
            throw ConfigException.invalid("health_check.timeout", "is required");
        }
        Duration interval = DurationParser.parseField("health_check.interval", section.getInterval(), Duration.ZERO);
        Duration timeout = DurationParser.parseField("health_check.timeout", section.getTimeout(), Duration.ZERO);
        if (interval.isZero()) {
            throw ConfigException.invalid("health_check.interval", "must be positive");
        }
        if (timeout.isZero()) {
            throw ConfigException.invalid("health_check.timeout", "must be positive");
        }
        if (timeout.compareTo(interval) > 0) {
            throw ConfigException.invalid("health_check.timeout",
                    "must not exceed the interval (" + section.getTimeout() + " > " + section.getInterval() + ")");
        }

        Integer retries = section.getRetries();
        if (retries == null || retries < 1) {
            throw ConfigException.invalid("health_check.retries", "must be an integer >= 1");
        }
        Integer healthyThreshold = section.getHealthyThreshold();
        if (healthyThreshold != null && healthyThreshold < 1) {
            throw ConfigException.invalid("health_check.healthy_threshold", "must be an integer >= 1");
        }

        return new HealthCheckSpec(path, interval, timeout, retries,
                healthyThreshold != null ? healthyThreshold : 1);
    }
}
