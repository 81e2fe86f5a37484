package io.llmops.platform.runtime.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Published view of one backend target.
 *
 * @param address {@code host:port}
 * @param state pool membership
 * @param consecutiveFailures failed probes since the last success
 * @param consecutiveSuccesses successful probes since the last failure
 * @param lastResult most recent probe outcome, null before the first probe
 */
public record BackendTarget(
        String address,
        TargetState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        @Nullable HealthCheckResult lastResult
) {

    public BackendTarget {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(state, "state");
    }

    /**
     * A target that has not been probed yet. Targets start in the pool.
     *
     * @param address {@code host:port}
     * @return the initial view
     */
    @Nonnull
    public static BackendTarget initial(@Nonnull String address) {
        return new BackendTarget(address, TargetState.HEALTHY, 0, 0, null);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return state == TargetState.HEALTHY;
    }
}
