package io.llmops.platform.runtime.event;

import javax.annotation.Nonnull;

/**
 * Receives role lifecycle events from the orchestrator. Both methods
 * default to doing nothing.
 */
public interface RoleEventListener {

    default void onRoleStarted(@Nonnull RoleStartedEvent event) {
    }

    default void onRoleShutdown(@Nonnull RoleShutdownEvent event) {
    }
}
