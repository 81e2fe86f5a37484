package io.llmops.platform.runtime.support;

import io.llmops.platform.runtime.health.HealthCheckResult;
import io.llmops.platform.runtime.health.HealthProbe;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probe answering from a set of addresses marked down.
 */
public class ScriptedHealthProbe implements HealthProbe {

    private final Set<String> down = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> probes = new ConcurrentHashMap<>();

    public void down(String address) {
        down.add(address);
    }

    public void up(String address) {
        down.remove(address);
    }

    public int probeCount(String address) {
        AtomicInteger count = probes.get(address);
        return count != null ? count.get() : 0;
    }

    @Nonnull
    @Override
    public HealthCheckResult probe(@Nonnull String address, @Nonnull String path, @Nonnull Duration timeout) {
        probes.computeIfAbsent(address, k -> new AtomicInteger()).incrementAndGet();
        if (down.contains(address)) {
            return HealthCheckResult.failure(address, Instant.now(), Duration.ofMillis(1), "connection refused");
        }
        return HealthCheckResult.success(address, Instant.now(), Duration.ofMillis(1));
    }
}
