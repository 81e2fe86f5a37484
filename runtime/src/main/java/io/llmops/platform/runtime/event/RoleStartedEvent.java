package io.llmops.platform.runtime.event;

import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.role.RoleInstance;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event fired when a role has started and is running.
 */
public class RoleStartedEvent {

    private final RoleInstance instance;

    public RoleStartedEvent(@Nonnull RoleInstance instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Nonnull
    public RoleInstance getInstance() {
        return instance;
    }

    @Nonnull
    public Role getRole() {
        return instance.getRole();
    }

    /**
     * Get the port the role is bound to.
     *
     * @return port number
     */
    public int getPort() {
        return instance.getServer().getPort();
    }

    @Override
    public String toString() {
        return "RoleStartedEvent{role=" + getRole() + ", port=" + getPort() + '}';
    }
}
