package io.llmops.platform.runtime.api;

import io.llmops.platform.api.runtime.ServerRuntimeAPI;
import io.llmops.platform.runtime.ErrorCode;
import io.llmops.platform.runtime.OrchestrationException;
import io.llmops.platform.runtime.Orchestrator;
import io.llmops.platform.runtime.RoleStatusReport;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.role.RoleInstance;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Implementation of the ServerRuntimeAPI over an {@link Orchestrator}.
 *
 * <p>Starts and stops run on the given executor; their futures complete
 * exceptionally with the {@link OrchestrationException} on failure.</p>
 */
public class ServerRuntimeAPIImpl implements ServerRuntimeAPI {

    private final Orchestrator orchestrator;
    private final Executor executor;

    public ServerRuntimeAPIImpl(@Nonnull Orchestrator orchestrator, @Nonnull Executor executor) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    @Nonnull
    public CompletableFuture<RoleInfo> start(@Nonnull String role) {
        Objects.requireNonNull(role, "role");
        return supply(role, "start").thenApply(RoleStatusReport::toRoleInfo);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> stop(@Nonnull String role) {
        Objects.requireNonNull(role, "role");
        return supply(role, "stop").thenApply(report -> null);
    }

    private CompletableFuture<RoleStatusReport> supply(String role, String action) {
        CompletableFuture<RoleStatusReport> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(orchestrator.execute(role, action));
            } catch (OrchestrationException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the role is unknown
     * @throws IllegalStateException if the status could not be determined
     */
    @Override
    @Nonnull
    public RoleInfo getStatus(@Nonnull String role) {
        Objects.requireNonNull(role, "role");
        try {
            return orchestrator.execute(role, "status").toRoleInfo();
        } catch (OrchestrationException e) {
            if (e.getCode() == ErrorCode.UNKNOWN_ROLE) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    @Override
    @Nonnull
    public Collection<RoleInfo> getActiveRoles() {
        List<RoleInfo> roles = new ArrayList<>();
        for (RoleInstance instance : orchestrator.getRegistry().getAll()) {
            roles.add(getStatus(instance.getRole().getRoleName()));
        }
        return roles;
    }

    @Override
    @Nonnull
    public Collection<String> getRoles() {
        return Arrays.stream(Role.values())
                .map(Role::getRoleName)
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasRole(@Nonnull String role) {
        Objects.requireNonNull(role, "role");
        return Role.byName(role) != null;
    }

    @Override
    @Nonnull
    public RuntimeStats getStats() {
        int active = 0;
        int running = 0;
        int failed = 0;
        int firing = 0;
        int unhealthy = 0;
        for (RoleInstance instance : orchestrator.getRegistry().getAll()) {
            active++;
            RoleStatusReport report;
            try {
                report = orchestrator.status(instance.getRole());
            } catch (OrchestrationException e) {
                failed++;
                continue;
            }
            if (report.status() == LifecycleStatus.RUNNING) {
                running++;
            } else if (report.status() == LifecycleStatus.FAILED) {
                failed++;
            }
            firing += (int) report.countFiring();
            if (report.pool() != null) {
                unhealthy += (int) report.pool().getUnhealthyCount();
            }
        }
        return new RuntimeStatsImpl(Role.values().length, active, running, failed, firing, unhealthy);
    }

    private record RuntimeStatsImpl(
            int knownRoles,
            int activeRoles,
            int runningRoles,
            int failedRoles,
            int firingAlerts,
            int unhealthyTargets
    ) implements RuntimeStats {

        @Override
        public int getKnownRoles() {
            return knownRoles;
        }

        @Override
        public int getActiveRoles() {
            return activeRoles;
        }

        @Override
        public int getRunningRoles() {
            return runningRoles;
        }

        @Override
        public int getFailedRoles() {
            return failedRoles;
        }

        @Override
        public int getFiringAlerts() {
            return firingAlerts;
        }

        @Override
        public int getUnhealthyTargets() {
            return unhealthyTargets;
        }
    }
}
