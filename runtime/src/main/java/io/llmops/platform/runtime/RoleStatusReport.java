package io.llmops.platform.runtime;

import io.llmops.platform.api.runtime.ServerRuntimeAPI;
import io.llmops.platform.runtime.alert.AlertSnapshot;
import io.llmops.platform.runtime.alert.AlertState;
import io.llmops.platform.runtime.alert.AlertStatus;
import io.llmops.platform.runtime.config.DatabaseSpec;
import io.llmops.platform.runtime.health.BackendTarget;
import io.llmops.platform.runtime.health.PoolSnapshot;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of an orchestrator action: the role's status plus, for the load
 * balancer and monitoring roles, the latest pool or alert snapshot.
 *
 * @param role the role
 * @param status lifecycle status read from the OS handle
 * @param port bound port
 * @param handle OS handle description, or null when nothing runs
 * @param details instance details
 * @param uptimeMillis time since the role started, 0 when not running
 * @param pool backend pool, load balancer only
 * @param alerts alert states, monitoring only
 */
public record RoleStatusReport(
        Role role,
        LifecycleStatus status,
        int port,
        @Nullable String handle,
        Map<String, String> details,
        long uptimeMillis,
        @Nullable PoolSnapshot pool,
        @Nullable AlertSnapshot alerts
) {

    public RoleStatusReport {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(status, "status");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Get the targets eligible for routing.
     *
     * @return eligible addresses, empty for roles without a pool
     */
    @Nonnull
    public List<String> eligibleTargets() {
        return pool != null ? pool.eligible() : List.of();
    }

    public boolean degraded() {
        return pool != null && pool.degraded();
    }

    /**
     * Format the one-line summary the CLI prints. Connection URLs are redacted.
     *
     * @return summary line
     */
    @Nonnull
    public String summary() {
        StringBuilder line = new StringBuilder();
        line.append(role).append(' ').append(status);
        if (port > 0) {
            line.append(" port=").append(port);
        }
        if (handle != null) {
            line.append(" handle=[").append(handle).append(']');
        }
        if (pool != null) {
            line.append(" eligible=").append(pool.eligible());
            line.append(" unhealthy=").append(pool.getUnhealthyCount());
            if (pool.degraded()) {
                line.append(" degraded=true");
            }
        }
        if (alerts != null) {
            line.append(" alerts={").append(alerts.states().stream()
                    .map(state -> state.rule() + "=" + state.status())
                    .collect(Collectors.joining(", "))).append('}');
        }
        if (details.containsKey("DATABASE_URL")) {
            line.append(" url=").append(DatabaseSpec.redact(details.get("DATABASE_URL")));
        }
        return line.toString();
    }

    /**
     * Convert to the public API view.
     *
     * @return role info
     */
    @Nonnull
    public ServerRuntimeAPI.RoleInfo toRoleInfo() {
        ServerRuntimeAPI.RoleInfo.Builder builder = ServerRuntimeAPI.RoleInfo.builder(role.getRoleName())
                .status(status.name())
                .port(port)
                .handle(handle)
                .uptimeMillis(uptimeMillis);
        details.forEach((key, value) -> builder.detail(key, DatabaseSpec.redact(value)));
        if (pool != null) {
            for (BackendTarget target : pool.targets()) {
                builder.target(new ServerRuntimeAPI.TargetInfo(
                        target.address(),
                        target.state().name(),
                        target.consecutiveFailures(),
                        target.consecutiveSuccesses(),
                        target.lastResult() != null ? target.lastResult().timestamp() : null));
            }
            builder.eligibleTargets(pool.eligible()).degraded(pool.degraded());
        }
        if (alerts != null) {
            for (AlertState state : alerts.states()) {
                builder.alert(new ServerRuntimeAPI.AlertInfo(
                        state.rule(), state.status().name(), state.conditionSince(), state.lastValue()));
            }
        }
        return builder.build();
    }

    /**
     * Count the firing alerts in this report.
     *
     * @return firing alerts, 0 for roles without alerts
     */
    public long countFiring() {
        return alerts != null
                ? alerts.states().stream().filter(state -> state.status() == AlertStatus.FIRING).count()
                : 0;
    }
}
