package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.instance.StopException;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;

/**
 * Lifecycle contract shared by every role.
 *
 * <p>{@link #validate} performs no side effects. {@link #start} either
 * returns a running instance or releases everything it created before
 * throwing.</p>
 */
public interface RoleLifecycle {

    /**
     * Get the role this lifecycle drives.
     *
     * @return the role
     */
    @Nonnull
    Role getRole();

    /**
     * Check a configuration before anything is started.
     *
     * @param config role configuration
     * @throws ConfigException if the configuration is incomplete or malformed
     * @throws StartException if the host cannot run the role (port taken,
     *                        executable missing)
     */
    void validate(@Nonnull RoleConfig config) throws ConfigException, StartException;

    /**
     * Start the role.
     *
     * @param config validated role configuration
     * @return the running instance
     * @throws StartException if the start failed; nothing is left behind
     */
    @Nonnull
    RoleInstance start(@Nonnull RoleConfig config) throws StartException;

    /**
     * Stop the role. Stopping an instance whose handle is already gone succeeds.
     *
     * @param instance the instance
     * @throws StopException if the OS handle survived termination
     */
    void stop(@Nonnull RoleInstance instance) throws StopException;

    /**
     * Query the role's status from its OS handle.
     *
     * @param instance the instance
     * @return current status
     */
    @Nonnull
    LifecycleStatus status(@Nonnull RoleInstance instance);
}
