package io.llmops.platform.runtime.health;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Probes one backend target.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probe {@code http://<address><path>}.
     *
     * <p>Implementations report every failure, including timeouts and
     * connection errors, as an unsuccessful result instead of throwing.</p>
     *
     * @param address target {@code host:port}
     * @param path request path starting with {@code /}
     * @param timeout probe timeout
     * @return the outcome
     */
    @Nonnull
    HealthCheckResult probe(@Nonnull String address, @Nonnull String path, @Nonnull Duration timeout);
}
