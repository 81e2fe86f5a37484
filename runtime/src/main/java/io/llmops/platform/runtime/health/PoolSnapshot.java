package io.llmops.platform.runtime.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of the backend pool, replaced as a whole on every change.
 *
 * @param targets every configured target, in configuration order
 * @param eligible addresses that should receive traffic; never empty while targets exist
 * @param degraded true when every target is unhealthy and all are routed to anyway
 * @param publishedAt when this snapshot was built
 * @param version increases with every publication
 */
public record PoolSnapshot(
        List<BackendTarget> targets,
        List<String> eligible,
        boolean degraded,
        Instant publishedAt,
        long version
) {

    public PoolSnapshot {
        targets = List.copyOf(targets);
        eligible = List.copyOf(eligible);
        Objects.requireNonNull(publishedAt, "publishedAt");
    }

    /**
     * Build a snapshot, computing the eligible list from the targets.
     *
     * @param targets all targets
     * @param publishedAt publication time
     * @param version publication counter
     * @return the snapshot
     */
    @Nonnull
    public static PoolSnapshot of(@Nonnull List<BackendTarget> targets, @Nonnull Instant publishedAt, long version) {
        List<String> healthy = targets.stream()
                .filter(BackendTarget::isHealthy)
                .map(BackendTarget::address)
                .toList();
        boolean degraded = healthy.isEmpty() && !targets.isEmpty();
        List<String> eligible = degraded
                ? targets.stream().map(BackendTarget::address).toList()
                : healthy;
        return new PoolSnapshot(targets, eligible, degraded, publishedAt, version);
    }

    @Nonnull
    public Optional<BackendTarget> target(@Nonnull String address) {
        return targets.stream().filter(t -> t.address().equals(address)).findFirst();
    }

    @JsonIgnore
    public long getUnhealthyCount() {
        return targets.stream().filter(t -> !t.isHealthy()).count();
    }
}
