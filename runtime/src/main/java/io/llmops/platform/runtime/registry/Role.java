package io.llmops.platform.runtime.registry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * The closed set of server roles this runtime can orchestrate.
 *
 * <p>Each constant is a tag; its behaviour lives in the lifecycle table
 * ({@link io.llmops.platform.runtime.role.RoleLifecycles}), not in the enum.</p>
 */
public enum Role {
    /**
     * Web application front end.
     */
    WEB("web", 8080),

    /**
     * Model inference API.
     */
    API("api", 8000),

    /**
     * Reverse proxy balancing traffic across backend targets.
     */
    LOADBALANCER("loadbalancer", 80),

    /**
     * Application database.
     */
    DATABASE("database", 5432),

    /**
     * Metrics collection and alerting.
     */
    MONITORING("monitoring", 9090);

    private final String roleName;
    private final int defaultPort;

    Role(String roleName, int defaultPort) {
        this.roleName = roleName;
        this.defaultPort = defaultPort;
    }

    /**
     * Get the role name as used on the command line and in config files.
     *
     * @return role name
     */
    @Nonnull
    public String getRoleName() {
        return roleName;
    }

    /**
     * Get the port used when the config document does not declare one.
     *
     * @return default port
     */
    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Get the config file name for this role ({@code <role>_server.json}).
     *
     * @return file name
     */
    @Nonnull
    public String getConfigFileName() {
        return roleName + "_server.json";
    }

    /**
     * Check if the role runs background loops next to its OS handle.
     *
     * @return true for the load balancer and monitoring roles
     */
    public boolean hasBackgroundLoop() {
        return this == LOADBALANCER || this == MONITORING;
    }

    /**
     * Resolve a role by name (case-insensitive).
     *
     * @param name role name
     * @return the role, or null if unknown
     */
    @Nullable
    public static Role byName(@Nullable String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.roleName.equals(normalized)) {
                return role;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return roleName;
    }
}
