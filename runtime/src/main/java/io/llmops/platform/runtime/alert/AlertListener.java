package io.llmops.platform.runtime.alert;

import io.llmops.platform.runtime.event.AlertTransitionEvent;

import javax.annotation.Nonnull;

/**
 * Receives alert status transitions, including the one-time RESOLVED notification.
 */
@FunctionalInterface
public interface AlertListener {

    void onTransition(@Nonnull AlertTransitionEvent event);
}
