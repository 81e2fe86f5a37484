package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Creates the metrics source for a monitoring role's targets.
 */
@FunctionalInterface
public interface MetricsSourceFactory {

    /**
     * Create a metrics source.
     *
     * @param targets monitored targets, {@code host:port}
     * @return the source
     */
    @Nonnull
    MetricsSource create(@Nonnull List<String> targets);
}
