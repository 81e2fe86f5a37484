package io.llmops.platform.runtime.health;

import io.llmops.platform.runtime.event.TargetHealthEvent;

import javax.annotation.Nonnull;

/**
 * Receives pool membership changes.
 */
@FunctionalInterface
public interface PoolListener {

    /**
     * Called after a target changed membership and the new snapshot was published.
     *
     * @param event the transition
     * @param snapshot the pool after the transition
     */
    void onPoolChange(@Nonnull TargetHealthEvent event, @Nonnull PoolSnapshot snapshot);
}
