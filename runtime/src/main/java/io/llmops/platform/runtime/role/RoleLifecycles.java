package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The lifecycle of every role, keyed by role.
 */
public final class RoleLifecycles {

    private final Map<Role, RoleLifecycle> lifecycles;

    private RoleLifecycles(Map<Role, RoleLifecycle> lifecycles) {
        this.lifecycles = Collections.unmodifiableMap(lifecycles);
    }

    /**
     * Build the table for one invocation.
     *
     * @param context shared collaborators
     * @return a table covering every role
     */
    @Nonnull
    public static RoleLifecycles create(@Nonnull RoleContext context) {
        Objects.requireNonNull(context, "context");
        Map<Role, RoleLifecycle> table = new EnumMap<>(Role.class);
        table.put(Role.WEB, new WebRole(context));
        table.put(Role.API, new InferenceApiRole(context));
        table.put(Role.LOADBALANCER, new LoadBalancerRole(context));
        table.put(Role.DATABASE, new DatabaseRole(context));
        table.put(Role.MONITORING, new MonitoringRole(context));
        for (Role role : Role.values()) {
            if (!table.containsKey(role)) {
                throw new IllegalStateException("no lifecycle for role " + role);
            }
        }
        return new RoleLifecycles(table);
    }

    /**
     * Get a role's lifecycle.
     *
     * @param role the role
     * @return its lifecycle
     */
    @Nonnull
    public RoleLifecycle get(@Nonnull Role role) {
        return lifecycles.get(Objects.requireNonNull(role, "role"));
    }
}
