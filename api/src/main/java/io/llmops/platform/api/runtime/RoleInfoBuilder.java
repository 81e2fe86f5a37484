package io.llmops.platform.api.runtime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builder implementation for role info.
 */
public class RoleInfoBuilder implements ServerRuntimeAPI.RoleInfo.Builder {

    private final String role;
    private String status = "STOPPED";
    private int port = -1;
    private String handle;
    private final Map<String, String> details = new LinkedHashMap<>();
    private final List<ServerRuntimeAPI.TargetInfo> targets = new ArrayList<>();
    private final List<String> eligibleTargets = new ArrayList<>();
    private boolean degraded;
    private final List<ServerRuntimeAPI.AlertInfo> alerts = new ArrayList<>();
    private long uptimeMillis;

    public RoleInfoBuilder(@Nonnull String role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder status(@Nonnull String status) {
        this.status = Objects.requireNonNull(status, "status");
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder port(int port) {
        this.port = port;
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder handle(@Nullable String handle) {
        this.handle = handle;
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder detail(@Nonnull String key, @Nonnull String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        this.details.put(key, value);
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder details(@Nonnull Map<String, String> details) {
        Objects.requireNonNull(details, "details");
        this.details.putAll(details);
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder target(@Nonnull ServerRuntimeAPI.TargetInfo target) {
        this.targets.add(Objects.requireNonNull(target, "target"));
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder eligibleTargets(@Nonnull List<String> addresses) {
        Objects.requireNonNull(addresses, "addresses");
        this.eligibleTargets.clear();
        this.eligibleTargets.addAll(addresses);
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder degraded(boolean degraded) {
        this.degraded = degraded;
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder alert(@Nonnull ServerRuntimeAPI.AlertInfo alert) {
        this.alerts.add(Objects.requireNonNull(alert, "alert"));
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo.Builder uptimeMillis(long uptimeMillis) {
        this.uptimeMillis = uptimeMillis;
        return this;
    }

    @Override
    public ServerRuntimeAPI.RoleInfo build() {
        return new RoleInfoImpl(role, status, port, handle,
                Collections.unmodifiableMap(new LinkedHashMap<>(details)),
                List.copyOf(targets), List.copyOf(eligibleTargets), degraded,
                List.copyOf(alerts), uptimeMillis);
    }

    private record RoleInfoImpl(
            String role,
            String status,
            int port,
            String handle,
            Map<String, String> details,
            List<ServerRuntimeAPI.TargetInfo> targets,
            List<String> eligibleTargets,
            boolean degraded,
            List<ServerRuntimeAPI.AlertInfo> alerts,
            long uptimeMillis
    ) implements ServerRuntimeAPI.RoleInfo {

        @Override
        @Nonnull
        public String getRole() {
            return role;
        }

        @Override
        @Nonnull
        public String getStatus() {
            return status;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        @Nullable
        public String getHandle() {
            return handle;
        }

        @Override
        @Nonnull
        public Map<String, String> getDetails() {
            return details;
        }

        @Override
        @Nonnull
        public List<ServerRuntimeAPI.TargetInfo> getTargets() {
            return targets;
        }

        @Override
        @Nonnull
        public List<String> getEligibleTargets() {
            return eligibleTargets;
        }

        @Override
        public boolean isDegraded() {
            return degraded;
        }

        @Override
        @Nonnull
        public List<ServerRuntimeAPI.AlertInfo> getAlerts() {
            return alerts;
        }

        @Override
        public long getUptimeMillis() {
            return uptimeMillis;
        }
    }
}
