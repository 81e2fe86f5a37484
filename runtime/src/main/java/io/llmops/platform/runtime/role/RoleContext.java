package io.llmops.platform.runtime.role;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmops.platform.runtime.alert.MetricsSourceFactory;
import io.llmops.platform.runtime.alert.ScrapeMetricsSource;
import io.llmops.platform.runtime.config.JsonMappers;
import io.llmops.platform.runtime.health.HealthProbe;
import io.llmops.platform.runtime.health.HttpHealthProbe;
import io.llmops.platform.runtime.process.ProcessSupervisor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Collaborators shared by the role lifecycles of one invocation.
 */
public final class RoleContext {

    public static final Path DEFAULT_SITES_AVAILABLE = Path.of("/etc/nginx/sites-available");
    public static final Path DEFAULT_SITES_ENABLED = Path.of("/etc/nginx/sites-enabled");
    public static final String DEFAULT_SITE_NAME = "llm_platform";

    private final ProcessSupervisor supervisor;
    private final ObjectMapper mapper;
    private final HealthProbe healthProbe;
    private final MetricsSourceFactory metricsSourceFactory;
    private final Clock clock;
    private final PortProbe portProbe;
    private final DependencyResolver dependencyResolver;
    private final Path sitesAvailable;
    private final Path sitesEnabled;
    private final String siteName;
    private final boolean hostingLoops;
    private final Duration readinessPollInterval;

    private RoleContext(Builder builder) {
        this.supervisor = Objects.requireNonNull(builder.supervisor, "supervisor");
        this.mapper = builder.mapper != null ? builder.mapper : JsonMappers.create();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.healthProbe = builder.healthProbe != null ? builder.healthProbe : new HttpHealthProbe();
        this.metricsSourceFactory = builder.metricsSourceFactory != null
                ? builder.metricsSourceFactory
                : targets -> new ScrapeMetricsSource(targets, HttpClient.newHttpClient(), Duration.ofSeconds(5), clock);
        this.portProbe = builder.portProbe != null ? builder.portProbe : new PortProbe();
        this.dependencyResolver = builder.dependencyResolver != null
                ? builder.dependencyResolver
                : DependencyResolver.fromPath(System.getenv("PATH"));
        this.sitesAvailable = builder.sitesAvailable != null ? builder.sitesAvailable : DEFAULT_SITES_AVAILABLE;
        this.sitesEnabled = builder.sitesEnabled != null ? builder.sitesEnabled : DEFAULT_SITES_ENABLED;
        this.siteName = builder.siteName != null ? builder.siteName : DEFAULT_SITE_NAME;
        this.hostingLoops = builder.hostingLoops;
        this.readinessPollInterval = builder.readinessPollInterval != null
                ? builder.readinessPollInterval
                : Duration.ofMillis(200);
    }

    @Nonnull
    public static Builder builder(@Nonnull ProcessSupervisor supervisor) {
        return new Builder(supervisor);
    }

    @Nonnull
    public ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    @Nonnull
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Nonnull
    public HealthProbe getHealthProbe() {
        return healthProbe;
    }

    @Nonnull
    public MetricsSourceFactory getMetricsSourceFactory() {
        return metricsSourceFactory;
    }

    @Nonnull
    public Clock getClock() {
        return clock;
    }

    @Nonnull
    public PortProbe getPortProbe() {
        return portProbe;
    }

    @Nonnull
    public DependencyResolver getDependencyResolver() {
        return dependencyResolver;
    }

    @Nonnull
    public Path getSitesAvailable() {
        return sitesAvailable;
    }

    @Nonnull
    public Path getSitesEnabled() {
        return sitesEnabled;
    }

    @Nonnull
    public String getSiteName() {
        return siteName;
    }

    /**
     * Check if this runtime stays in the foreground hosting background loops.
     *
     * @return true when started attached
     */
    public boolean isHostingLoops() {
        return hostingLoops;
    }

    /**
     * Get the pid recorded as the owner of a role's loops.
     *
     * @return this runtime's pid when hosting loops, otherwise null
     */
    @Nullable
    public Long getLoopOwnerPid() {
        return hostingLoops ? ProcessHandle.current().pid() : null;
    }

    @Nonnull
    public Duration getReadinessPollInterval() {
        return readinessPollInterval;
    }

    /**
     * Builder for {@link RoleContext}. Unset collaborators get production defaults.
     */
    public static final class Builder {
        private final ProcessSupervisor supervisor;
        private ObjectMapper mapper;
        private HealthProbe healthProbe;
        private MetricsSourceFactory metricsSourceFactory;
        private Clock clock;
        private PortProbe portProbe;
        private DependencyResolver dependencyResolver;
        private Path sitesAvailable;
        private Path sitesEnabled;
        private String siteName;
        private boolean hostingLoops;
        private Duration readinessPollInterval;

        private Builder(ProcessSupervisor supervisor) {
            this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        }

        public Builder mapper(@Nullable ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder healthProbe(@Nullable HealthProbe healthProbe) {
            this.healthProbe = healthProbe;
            return this;
        }

        public Builder metricsSourceFactory(@Nullable MetricsSourceFactory metricsSourceFactory) {
            this.metricsSourceFactory = metricsSourceFactory;
            return this;
        }

        public Builder clock(@Nullable Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder portProbe(@Nullable PortProbe portProbe) {
            this.portProbe = portProbe;
            return this;
        }

        public Builder dependencyResolver(@Nullable DependencyResolver dependencyResolver) {
            this.dependencyResolver = dependencyResolver;
            return this;
        }

        public Builder nginxSites(@Nullable Path sitesAvailable, @Nullable Path sitesEnabled) {
            this.sitesAvailable = sitesAvailable;
            this.sitesEnabled = sitesEnabled;
            return this;
        }

        public Builder siteName(@Nullable String siteName) {
            this.siteName = siteName;
            return this;
        }

        public Builder hostingLoops(boolean hostingLoops) {
            this.hostingLoops = hostingLoops;
            return this;
        }

        public Builder readinessPollInterval(@Nullable Duration readinessPollInterval) {
            this.readinessPollInterval = readinessPollInterval;
            return this;
        }

        @Nonnull
        public RoleContext build() {
            return new RoleContext(this);
        }
    }
}
