package io.llmops.platform.runtime.health;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single probe.
 *
 * @param address probed target, {@code host:port}
 * @param timestamp when the probe completed
 * @param success whether the target answered with a 2xx status
 * @param latency time the probe took
 * @param error failure description, null on success
 */
public record HealthCheckResult(
        String address,
        Instant timestamp,
        boolean success,
        Duration latency,
        @Nullable String error
) {

    public HealthCheckResult {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(latency, "latency");
    }

    @Nonnull
    public static HealthCheckResult success(@Nonnull String address, @Nonnull Instant timestamp, @Nonnull Duration latency) {
        return new HealthCheckResult(address, timestamp, true, latency, null);
    }

    @Nonnull
    public static HealthCheckResult failure(
            @Nonnull String address,
            @Nonnull Instant timestamp,
            @Nonnull Duration latency,
            @Nonnull String error) {
        return new HealthCheckResult(address, timestamp, false, latency, error);
    }
}
