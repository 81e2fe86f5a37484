package io.llmops.platform.runtime.event;

import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event fired before a role is stopped.
 */
public class RoleShutdownEvent {

    private final Role role;
    private final ShutdownReason reason;

    /**
     * Create a role shutdown event.
     *
     * @param role the role being stopped
     * @param reason shutdown reason
     */
    public RoleShutdownEvent(@Nonnull Role role, @Nonnull ShutdownReason reason) {
        this.role = Objects.requireNonNull(role, "role");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Nonnull
    public Role getRole() {
        return role;
    }

    @Nonnull
    public ShutdownReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "RoleShutdownEvent{role=" + role + ", reason=" + reason + '}';
    }

    /**
     * Reasons for stopping a role.
     */
    public enum ShutdownReason {
        /**
         * Requested through the CLI or the API.
         */
        REQUESTED,

        /**
         * The runtime hosting the role's loops is shutting down.
         */
        RUNTIME_SHUTDOWN
    }
}
