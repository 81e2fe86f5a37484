package io.llmops.platform.runtime.registry;

import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.role.RoleInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory registry of the roles started by this runtime.
 *
 * <p>Holds at most one instance per role. Roles started by another
 * invocation are not listed here; they are found through their handle
 * records.</p>
 */
public class RoleRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoleRegistry.class);

    private final Map<Role, RoleInstance> instances = Collections.synchronizedMap(new EnumMap<>(Role.class));

    /**
     * Register a started role.
     *
     * @param instance the role instance
     * @throws IllegalStateException if the role is already registered
     */
    public void register(@Nonnull RoleInstance instance) {
        Objects.requireNonNull(instance, "instance");
        Role role = instance.getRole();
        synchronized (instances) {
            if (instances.containsKey(role)) {
                throw new IllegalStateException("Role already registered: " + role);
            }
            instances.put(role, instance);
        }
        LOGGER.debug("Registered role: {} on port {}", role, instance.getServer().getPort());
    }

    /**
     * Unregister a role.
     *
     * @param role the role
     * @return the removed instance, or null if not registered
     */
    @Nullable
    public RoleInstance unregister(@Nonnull Role role) {
        Objects.requireNonNull(role, "role");
        RoleInstance instance = instances.remove(role);
        if (instance != null) {
            LOGGER.debug("Unregistered role: {}", role);
        }
        return instance;
    }

    /**
     * Get a role's instance.
     *
     * @param role the role
     * @return the instance, or null if not registered
     */
    @Nullable
    public RoleInstance get(@Nonnull Role role) {
        return instances.get(Objects.requireNonNull(role, "role"));
    }

    public boolean has(@Nonnull Role role) {
        return instances.containsKey(role);
    }

    /**
     * Get all registered instances.
     *
     * @return snapshot of the registered instances
     */
    @Nonnull
    public Collection<RoleInstance> getAll() {
        synchronized (instances) {
            return List.copyOf(instances.values());
        }
    }

    public int size() {
        return instances.size();
    }

    /**
     * Count registered instances whose server reports running.
     *
     * @return running count
     */
    public int countRunning() {
        int running = 0;
        for (RoleInstance instance : getAll()) {
            if (instance.getServer().getStatus() == LifecycleStatus.RUNNING) {
                running++;
            }
        }
        return running;
    }

    public void clear() {
        instances.clear();
        LOGGER.debug("Registry cleared");
    }
}
