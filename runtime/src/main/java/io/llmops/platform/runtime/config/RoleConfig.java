package io.llmops.platform.runtime.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed configuration of one role, loaded from {@code <role>_server.json}.
 *
 * <p>Instances are produced by {@link ConfigStore} and never change after
 * loading: there are no setters and collection getters return unmodifiable
 * views. Role-specific sections are present only when the document
 * declares them; the role's lifecycle decides which ones are required.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoleConfig {

    static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    @JsonProperty("server_type")
    private String serverType;

    @JsonProperty("port")
    private Integer port;

    @JsonProperty("environment")
    private Map<String, String> environment = new LinkedHashMap<>();

    @JsonProperty("dependencies")
    private List<String> dependencies = new ArrayList<>();

    @JsonProperty("workers")
    private Integer workers;

    @JsonProperty("startup_timeout")
    private String startupTimeout;

    @JsonProperty("shutdown_timeout")
    private String shutdownTimeout;

    // load balancer
    @JsonProperty("backend_servers")
    private List<String> backendServers;

    @JsonProperty("health_check")
    private HealthCheckSection healthCheck;

    // monitoring
    @JsonProperty("targets")
    private List<String> targets;

    @JsonProperty("alert_rules")
    private Map<String, AlertRuleSection> alertRules;

    @JsonProperty("monitoring_type")
    private String monitoringType;

    @JsonProperty("evaluation_interval")
    private String evaluationInterval;

    @JsonProperty("start_grafana")
    private boolean startGrafana;

    @JsonProperty("grafana_port")
    private Integer grafanaPort;

    // database
    @JsonProperty("db_type")
    private String dbType;

    @JsonProperty("db_name")
    private String dbName;

    @JsonProperty("db_user")
    private String dbUser;

    @JsonProperty("db_password")
    private String dbPassword;

    @JsonProperty("data_dir")
    private String dataDir;

    @JsonIgnore
    private Role role;

    @JsonIgnore
    private Path applicationDirectory;

    @JsonIgnore
    private Path source;

    @JsonIgnore
    private Duration startupTimeoutValue = DEFAULT_STARTUP_TIMEOUT;

    @JsonIgnore
    private Duration shutdownTimeoutValue = DEFAULT_SHUTDOWN_TIMEOUT;

    RoleConfig() {
        // bound by Jackson
    }

    /**
     * Attach the invocation context and check the fields every role shares.
     */
    void bind(@Nonnull Role role, @Nonnull Path applicationDirectory, @Nonnull Path source) throws ConfigException {
        this.role = Objects.requireNonNull(role, "role");
        this.applicationDirectory = Objects.requireNonNull(applicationDirectory, "applicationDirectory");
        this.source = Objects.requireNonNull(source, "source");

        if (serverType != null && Role.byName(serverType) != role) {
            throw ConfigException.invalid("server_type",
                    "document declares '" + serverType + "' but role '" + role + "' was requested");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw ConfigException.invalid("port", "must be between 1 and 65535, got " + port);
        }
        if (workers != null && workers < 1) {
            throw ConfigException.invalid("workers", "must be at least 1, got " + workers);
        }
        if (environment == null) {
            environment = new LinkedHashMap<>();
        }
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().isBlank()) {
                throw ConfigException.invalid("environment", "variable names must not be blank");
            }
            if (entry.getValue() == null) {
                throw ConfigException.invalid("environment." + entry.getKey(), "value must be a string, got null");
            }
        }
        if (dependencies == null) {
            dependencies = new ArrayList<>();
        }
        startupTimeoutValue = DurationParser.parseField("startup_timeout", startupTimeout, DEFAULT_STARTUP_TIMEOUT);
        shutdownTimeoutValue = DurationParser.parseField("shutdown_timeout", shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    // ==================== Common ====================

    @Nonnull
    public Role getRole() {
        return role;
    }

    /**
     * Get the configured port, falling back to the role default.
     *
     * @return port number
     */
    public int getPort() {
        return port != null ? port : role.getDefaultPort();
    }

    @Nonnull
    public Map<String, String> getEnvironment() {
        return Collections.unmodifiableMap(environment);
    }

    @Nonnull
    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Get the worker count.
     *
     * @param fallback value used when the document has none
     * @return worker count
     */
    public int getWorkers(int fallback) {
        return workers != null ? workers : fallback;
    }

    @Nonnull
    public Duration getStartupTimeout() {
        return startupTimeoutValue;
    }

    @Nonnull
    public Duration getShutdownTimeout() {
        return shutdownTimeoutValue;
    }

    @Nonnull
    public Path getApplicationDirectory() {
        return applicationDirectory;
    }

    /**
     * Get the file this configuration was read from.
     *
     * @return config file path
     */
    @Nonnull
    public Path getSource() {
        return source;
    }

    // ==================== Load balancer ====================

    @Nonnull
    public List<String> getBackendServers() {
        return backendServers != null ? Collections.unmodifiableList(backendServers) : List.of();
    }

    @Nullable
    public HealthCheckSection getHealthCheck() {
        return healthCheck;
    }

    // ==================== Monitoring ====================

    @Nonnull
    public List<String> getTargets() {
        return targets != null ? Collections.unmodifiableList(targets) : List.of();
    }

    @Nonnull
    public Map<String, AlertRuleSection> getAlertRules() {
        return alertRules != null ? Collections.unmodifiableMap(alertRules) : Map.of();
    }

    @Nonnull
    public String getMonitoringType() {
        return monitoringType != null ? monitoringType : "prometheus";
    }

    @Nullable
    public String getEvaluationInterval() {
        return evaluationInterval;
    }

    public boolean isStartGrafana() {
        return startGrafana;
    }

    public int getGrafanaPort() {
        return grafanaPort != null ? grafanaPort : 3000;
    }

    // ==================== Database ====================

    @Nonnull
    public String getDbType() {
        return dbType != null ? dbType : "sqlite";
    }

    @Nullable
    public String getDbName() {
        return dbName;
    }

    @Nullable
    public String getDbUser() {
        return dbUser;
    }

    @Nullable
    public String getDbPassword() {
        return dbPassword;
    }

    @Nullable
    public String getDataDir() {
        return dataDir;
    }

    @Override
    public String toString() {
        return "RoleConfig{" +
                "role=" + role +
                ", port=" + getPort() +
                ", source=" + source +
                '}';
    }

    /**
     * The {@code health_check} section of a load balancer document.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HealthCheckSection {
        @JsonProperty("path")
        private String path;

        @JsonProperty("interval")
        private String interval;

        @JsonProperty("timeout")
        private String timeout;

        @JsonProperty("retries")
        private Integer retries;

        @JsonProperty("healthy_threshold")
        private Integer healthyThreshold;

        HealthCheckSection() {
        }

        @Nullable
        public String getPath() {
            return path;
        }

        @Nullable
        public String getInterval() {
            return interval;
        }

        @Nullable
        public String getTimeout() {
            return timeout;
        }

        @Nullable
        public Integer getRetries() {
            return retries;
        }

        @Nullable
        public Integer getHealthyThreshold() {
            return healthyThreshold;
        }
    }

    /**
     * One entry of the {@code alert_rules} map of a monitoring document.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlertRuleSection {
        @JsonProperty("threshold")
        private String threshold;

        @JsonProperty("duration")
        private String duration;

        @JsonProperty("metric")
        private String metric;

        @JsonProperty("total_metric")
        private String totalMetric;

        AlertRuleSection() {
        }

        @Nullable
        public String getThreshold() {
            return threshold;
        }

        @Nullable
        public String getDuration() {
            return duration;
        }

        @Nullable
        public String getMetric() {
            return metric;
        }

        @Nullable
        public String getTotalMetric() {
            return totalMetric;
        }
    }
}
