package io.llmops.platform.api.runtime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * API for driving server roles on this host.
 *
 * <p>Roles are addressed by their name ({@code web}, {@code api},
 * {@code loadbalancer}, {@code database}, {@code monitoring}).</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ServerRuntimeAPI runtime = ...;
 *
 * runtime.start("loadbalancer").thenAccept(info ->
 *     System.out.println(info.getRole() + " is " + info.getStatus()));
 *
 * List<String> pool = runtime.getStatus("loadbalancer").getEligibleTargets();
 *
 * runtime.stop("loadbalancer").join();
 * }</pre>
 */
public interface ServerRuntimeAPI {

    /**
     * Validate and start a role.
     *
     * @param role role name
     * @return future completing with the started role's info
     */
    @Nonnull
    CompletableFuture<RoleInfo> start(@Nonnull String role);

    /**
     * Stop a role. Stopping a role that is not running completes normally.
     *
     * @param role role name
     * @return future completing when the role and its background loops are stopped
     */
    @Nonnull
    CompletableFuture<Void> stop(@Nonnull String role);

    /**
     * Query the current status of a role.
     *
     * @param role role name
     * @return role info (status STOPPED when nothing runs)
     */
    @Nonnull
    RoleInfo getStatus(@Nonnull String role);

    /**
     * Get the roles started through this runtime that are still registered.
     *
     * @return collection of role info
     */
    @Nonnull
    Collection<RoleInfo> getActiveRoles();

    /**
     * Get all role names this runtime understands.
     *
     * @return role names
     */
    @Nonnull
    Collection<String> getRoles();

    /**
     * Check if a role name is known.
     *
     * @param role role name
     * @return true if known
     */
    boolean hasRole(@Nonnull String role);

    /**
     * Get runtime statistics.
     *
     * @return statistics
     */
    @Nonnull
    RuntimeStats getStats();

    /**
     * Role information.
     */
    interface RoleInfo {
        /**
         * Get the role name.
         */
        @Nonnull
        String getRole();

        /**
         * Get the lifecycle status (STOPPED, STARTING, RUNNING, STOPPING, FAILED).
         */
        @Nonnull
        String getStatus();

        /**
         * Get the configured port, or -1 if unknown.
         */
        int getPort();

        /**
         * Get the OS handle description (pid or service unit), if any.
         */
        @Nullable
        String getHandle();

        /**
         * Get role-specific details (config paths, connection URL...).
         */
        @Nonnull
        Map<String, String> getDetails();

        /**
         * Get the backend targets (load balancer only).
         */
        @Nonnull
        List<TargetInfo> getTargets();

        /**
         * Get the addresses currently eligible for routing (load balancer only).
         */
        @Nonnull
        List<String> getEligibleTargets();

        /**
         * Check if the backend pool is routing best-effort because every target is unhealthy.
         */
        boolean isDegraded();

        /**
         * Get the alert states (monitoring only).
         */
        @Nonnull
        List<AlertInfo> getAlerts();

        /**
         * Get the role uptime in milliseconds.
         */
        long getUptimeMillis();

        /**
         * Create a builder for role info.
         */
        @Nonnull
        static Builder builder(@Nonnull String role) {
            return new RoleInfoBuilder(role);
        }

        /**
         * Builder for role info.
         */
        interface Builder {
            Builder status(@Nonnull String status);
            Builder port(int port);
            Builder handle(@Nullable String handle);
            Builder detail(@Nonnull String key, @Nonnull String value);
            Builder details(@Nonnull Map<String, String> details);
            Builder target(@Nonnull TargetInfo target);
            Builder eligibleTargets(@Nonnull List<String> addresses);
            Builder degraded(boolean degraded);
            Builder alert(@Nonnull AlertInfo alert);
            Builder uptimeMillis(long uptimeMillis);
            RoleInfo build();
        }
    }

    /**
     * Backend target as seen by the health checker.
     *
     * @param address host:port
     * @param state HEALTHY or UNHEALTHY
     * @param consecutiveFailures current failure streak
     * @param consecutiveSuccesses current success streak
     * @param lastProbeAt time of the last completed probe, or null
     */
    record TargetInfo(
            @Nonnull String address,
            @Nonnull String state,
            int consecutiveFailures,
            int consecutiveSuccesses,
            @Nullable Instant lastProbeAt
    ) {}

    /**
     * Alert rule state as seen by the alert evaluator.
     *
     * @param rule rule name
     * @param status OK, PENDING, FIRING or RESOLVED
     * @param conditionSince when the condition became continuously true, or null
     * @param lastValue last evaluated value (NaN when unknown)
     */
    record AlertInfo(
            @Nonnull String rule,
            @Nonnull String status,
            @Nullable Instant conditionSince,
            double lastValue
    ) {}

    /**
     * Runtime statistics.
     */
    interface RuntimeStats {
        int getKnownRoles();
        int getActiveRoles();
        int getRunningRoles();
        int getFailedRoles();
        int getFiringAlerts();
        int getUnhealthyTargets();
    }
}
