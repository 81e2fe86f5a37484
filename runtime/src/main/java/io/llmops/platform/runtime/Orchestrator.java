package io.llmops.platform.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmops.platform.runtime.alert.AlertEvaluator;
import io.llmops.platform.runtime.alert.AlertSnapshot;
import io.llmops.platform.runtime.alert.MetricsSourceFactory;
import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.ConfigStore;
import io.llmops.platform.runtime.config.JsonMappers;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.event.RoleEventListener;
import io.llmops.platform.runtime.event.RoleShutdownEvent;
import io.llmops.platform.runtime.event.RoleStartedEvent;
import io.llmops.platform.runtime.health.HealthChecker;
import io.llmops.platform.runtime.health.HealthProbe;
import io.llmops.platform.runtime.health.PoolSnapshot;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.instance.StopException;
import io.llmops.platform.runtime.process.HandleRecord;
import io.llmops.platform.runtime.process.HandleStore;
import io.llmops.platform.runtime.process.OsHandle;
import io.llmops.platform.runtime.process.ProcessBuilderLauncher;
import io.llmops.platform.runtime.process.ProcessLauncher;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.process.ServiceController;
import io.llmops.platform.runtime.process.SystemctlServiceController;
import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.registry.RoleRegistry;
import io.llmops.platform.runtime.role.DependencyResolver;
import io.llmops.platform.runtime.role.PortProbe;
import io.llmops.platform.runtime.role.RoleContext;
import io.llmops.platform.runtime.role.RoleInstance;
import io.llmops.platform.runtime.role.RoleLifecycle;
import io.llmops.platform.runtime.role.RoleLifecycles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Entry point of the runtime: starts, stops and reports the roles of one
 * application directory.
 *
 * <p>Coordinates the config store, the role lifecycles, the process
 * supervisor and the registry of roles started by this runtime.</p>
 *
 * <h2>Directory Structure</h2>
 * <pre>
 * configs/                     # config directory
 * ├── web_server.json
 * ├── loadbalancer_server.json
 * └── ...
 * &lt;app-dir&gt;/                   # application directory
 * ├── descriptor.json
 * ├── run/                     # handle records and loop snapshots
 * │   ├── loadbalancer.json
 * │   └── loadbalancer-state.json
 * └── logs/                    # child process output
 *     └── web.log
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Orchestrator orchestrator = Orchestrator.builder(Path.of("configs"), Path.of("/srv/app")).build();
 *
 * RoleStatusReport report = orchestrator.execute("loadbalancer", "start");
 * List<String> pool = orchestrator.status(Role.LOADBALANCER).eligibleTargets();
 *
 * orchestrator.stop(Role.LOADBALANCER);
 * }</pre>
 */
public class Orchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Orchestrator.class);

    public static final String RUN_DIR = "run";
    public static final String LOGS_DIR = "logs";

    private static final Duration WATCH_INTERVAL = Duration.ofSeconds(2);

    private final Path applicationDirectory;
    private final ConfigStore configStore;
    private final ProcessSupervisor supervisor;
    private final RoleLifecycles lifecycles;
    private final RoleRegistry registry = new RoleRegistry();
    private final List<RoleEventListener> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private volatile boolean shutdown = false;

    private Orchestrator(Builder builder) {
        this.applicationDirectory = builder.applicationDirectory;
        ObjectMapper mapper = builder.mapper != null ? builder.mapper : JsonMappers.create();
        this.configStore = new ConfigStore(builder.configDirectory, applicationDirectory, builder.environment, mapper);

        HandleStore store = new HandleStore(applicationDirectory.resolve(RUN_DIR), mapper);
        this.supervisor = new ProcessSupervisor(store,
                builder.launcher != null ? builder.launcher : new ProcessBuilderLauncher(),
                builder.services != null ? builder.services : new SystemctlServiceController(),
                applicationDirectory.resolve(LOGS_DIR));

        RoleContext context = RoleContext.builder(supervisor)
                .mapper(mapper)
                .healthProbe(builder.healthProbe)
                .metricsSourceFactory(builder.metricsSourceFactory)
                .clock(builder.clock)
                .portProbe(builder.portProbe)
                .dependencyResolver(builder.dependencyResolver != null
                        ? builder.dependencyResolver
                        : DependencyResolver.fromPath(builder.environment.get("PATH")))
                .nginxSites(builder.sitesAvailable, builder.sitesEnabled)
                .hostingLoops(builder.hostingLoops)
                .readinessPollInterval(builder.readinessPollInterval)
                .build();
        this.lifecycles = RoleLifecycles.create(context);
    }

    @Nonnull
    public static Builder builder(@Nonnull Path configDirectory, @Nonnull Path applicationDirectory) {
        return new Builder(configDirectory, applicationDirectory);
    }

    // ==================== Dispatch ====================

    /**
     * Run an action given by name. The role and the action are checked
     * before anything else happens.
     *
     * @param roleName role name
     * @param actionName action name
     * @return the resulting status
     * @throws OrchestrationException if the role or action is unknown, or the action failed
     */
    @Nonnull
    public RoleStatusReport execute(@Nullable String roleName, @Nullable String actionName)
            throws OrchestrationException {
        Role role = Role.byName(roleName);
        if (role == null) {
            throw new OrchestrationException(ErrorCode.UNKNOWN_ROLE, roleName, actionName,
                    "unknown role '" + roleName + "', expected one of " + Arrays.stream(Role.values())
                            .map(Role::getRoleName).collect(Collectors.joining(", ")));
        }
        Action action = Action.byName(actionName);
        if (action == null) {
            throw new OrchestrationException(ErrorCode.UNKNOWN_ACTION, role.getRoleName(), actionName,
                    "unknown action '" + actionName + "', expected start, stop or status");
        }

        switch (action) {
            case START:
                return start(role);
            case STOP:
                return stop(role);
            case STATUS:
            default:
                return status(role);
        }
    }

    // ==================== Start ====================

    /**
     * Load, validate and start a role.
     *
     * @param role the role
     * @return the running role's status
     * @throws OrchestrationException if the config is missing or invalid, or the start failed
     */
    @Nonnull
    public RoleStatusReport start(@Nonnull Role role) throws OrchestrationException {
        Objects.requireNonNull(role, "role");
        checkNotShutdown(role, Action.START);
        checkApplicationDirectory(role, Action.START);

        RoleConfig config = loadConfig(role, Action.START);
        RoleLifecycle lifecycle = lifecycles.get(role);

        RoleInstance instance;
        try {
            RoleInstance existing = registry.get(role);
            if (existing != null && existing.getServer().getStatus() == LifecycleStatus.RUNNING) {
                throw new StartException(StartException.Reason.ALREADY_RUNNING,
                        "role " + role + " is already running in this runtime");
            }
            supervisor.ensureNotRunning(role);
            lifecycle.validate(config);
            instance = lifecycle.start(config);
        } catch (ConfigException e) {
            throw new OrchestrationException(ErrorCode.CONFIG_INVALID, role.getRoleName(), Action.START.getActionName(),
                    e.getMessage(), e);
        } catch (StartException e) {
            throw new OrchestrationException(ErrorCode.START_FAILED, role.getRoleName(), Action.START.getActionName(),
                    e.getMessage(), e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure starting role '{}'", role, e);
            throw new OrchestrationException(ErrorCode.START_FAILED, role.getRoleName(), Action.START.getActionName(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        registry.unregister(role);
        registry.register(instance);
        fire(new RoleStartedEvent(instance));
        return report(role, instance, lifecycle.status(instance));
    }

    // ==================== Stop ====================

    /**
     * Stop a role, its background loops first. Stopping a role that is not
     * running succeeds. The role's config file must exist; when it cannot be
     * read the default shutdown timeout is used.
     *
     * @param role the role
     * @return the stopped role's status
     * @throws OrchestrationException if the config file is missing or the OS
     *                                handle survived termination
     */
    @Nonnull
    public RoleStatusReport stop(@Nonnull Role role) throws OrchestrationException {
        Objects.requireNonNull(role, "role");
        checkApplicationDirectory(role, Action.STOP);
        checkConfigPresent(role, Action.STOP);
        return stop(role, RoleShutdownEvent.ShutdownReason.REQUESTED);
    }

    private RoleStatusReport stop(Role role, RoleShutdownEvent.ShutdownReason reason) throws OrchestrationException {
        RoleInstance instance = registry.get(role);
        if (instance == null) {
            instance = recover(role, shutdownTimeout(role));
        }

        fire(new RoleShutdownEvent(role, reason));
        try {
            lifecycles.get(role).stop(instance);
        } catch (StopException e) {
            throw new OrchestrationException(ErrorCode.STOP_FAILED, role.getRoleName(), Action.STOP.getActionName(),
                    e.getMessage(), e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure stopping role '{}'", role, e);
            throw new OrchestrationException(ErrorCode.STOP_FAILED, role.getRoleName(), Action.STOP.getActionName(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            registry.unregister(role);
        }
        return report(role, instance, LifecycleStatus.STOPPED);
    }

    private Duration shutdownTimeout(Role role) {
        try {
            return configStore.load(role).getShutdownTimeout();
        } catch (ConfigException e) {
            LOGGER.warn("Cannot read shutdown timeout of role '{}', using 30s: {}", role, e.getMessage());
            return Duration.ofSeconds(30);
        }
    }

    /**
     * Stop every role started by this runtime. Called from the JVM shutdown
     * hook when the runtime hosts background loops.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LOGGER.info("Shutting down runtime, stopping {} roles", registry.size());
        for (RoleInstance instance : registry.getAll()) {
            try {
                stop(instance.getRole(), RoleShutdownEvent.ShutdownReason.RUNTIME_SHUTDOWN);
            } catch (OrchestrationException e) {
                LOGGER.error("Failed to stop role '{}' during shutdown: {}", instance.getRole(), e.getMessage());
            }
        }
        shutdownLatch.countDown();
        LOGGER.info("Runtime shut down");
    }

    /**
     * Block while a role runs in this runtime: until {@link #shutdown()} is
     * called or the role's OS handle dies.
     *
     * @param role the role
     * @return the role's final status
     * @throws InterruptedException if interrupted while waiting
     */
    @Nonnull
    public LifecycleStatus awaitTermination(@Nonnull Role role) throws InterruptedException {
        while (!shutdownLatch.await(WATCH_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
            RoleInstance instance = registry.get(role);
            if (instance == null) {
                return LifecycleStatus.STOPPED;
            }
            LifecycleStatus status = lifecycles.get(role).status(instance);
            if (status != LifecycleStatus.RUNNING) {
                LOGGER.error("Role '{}' is no longer running ({})", role, status);
                return status;
            }
        }
        return LifecycleStatus.STOPPED;
    }

    // ==================== Status ====================

    /**
     * Report a role's status from its OS handle, with the pool or alert
     * states of its background loop.
     *
     * @param role the role
     * @return the status
     * @throws OrchestrationException if the status could not be determined
     */
    @Nonnull
    public RoleStatusReport status(@Nonnull Role role) throws OrchestrationException {
        Objects.requireNonNull(role, "role");
        checkApplicationDirectory(role, Action.STATUS);
        checkConfigPresent(role, Action.STATUS);
        try {
            RoleInstance instance = registry.get(role);
            if (instance == null) {
                instance = recover(role, Duration.ofSeconds(30));
            }
            return report(role, instance, lifecycles.get(role).status(instance));
        } catch (RuntimeException e) {
            throw new OrchestrationException(ErrorCode.STATUS_FAILED, role.getRoleName(), Action.STATUS.getActionName(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rebuild the instance of a role started by another invocation from its
     * handle record.
     */
    private RoleInstance recover(Role role, Duration shutdownTimeout) {
        Optional<HandleRecord> record = supervisor.getRecord(role);
        int port = record.map(HandleRecord::port).filter(p -> p > 0).orElse(role.getDefaultPort());
        ServerInstance server = new ServerInstance(role, applicationDirectory, port);
        if (record.isPresent()) {
            record.get().details().forEach(server::setDetail);
            Optional<OsHandle> handle = supervisor.find(role);
            handle.ifPresent(server::attach);
            if (handle.isPresent() && handle.get().isAlive()) {
                server.markRunningSince(Instant.ofEpochMilli(record.get().startedAtMillis()));
            }
        }
        return new RoleInstance(server, shutdownTimeout);
    }

    private RoleStatusReport report(Role role, RoleInstance instance, LifecycleStatus status) {
        ServerInstance server = instance.getServer();
        boolean active = status == LifecycleStatus.RUNNING || status == LifecycleStatus.FAILED;

        PoolSnapshot pool = null;
        AlertSnapshot alerts = null;
        if (active && role == Role.LOADBALANCER) {
            pool = instance.getHealthChecker()
                    .map(HealthChecker::getSnapshot)
                    .orElseGet(() -> supervisor.getStore().readSnapshot(role, PoolSnapshot.class).orElse(null));
        } else if (active && role == Role.MONITORING) {
            alerts = instance.getAlertEvaluator()
                    .map(AlertEvaluator::getSnapshot)
                    .orElseGet(() -> supervisor.getStore().readSnapshot(role, AlertSnapshot.class).orElse(null));
        }

        String handle = active && server.getHandle() != null ? server.getHandle().describe() : null;
        Map<String, String> details = active ? server.getDetails() : Map.of();
        long uptime = status == LifecycleStatus.RUNNING ? server.getUptimeMillis() : 0;
        return new RoleStatusReport(role, status, server.getPort(), handle, details, uptime, pool, alerts);
    }

    // ==================== Helpers ====================

    private RoleConfig loadConfig(Role role, Action action) throws OrchestrationException {
        try {
            return configStore.load(role);
        } catch (ConfigException e) {
            ErrorCode code = e.getReason() == ConfigException.Reason.MISSING_FILE
                    ? ErrorCode.CONFIG_MISSING
                    : ErrorCode.CONFIG_INVALID;
            throw new OrchestrationException(code, role.getRoleName(), action.getActionName(), e.getMessage(), e);
        }
    }

    private void checkConfigPresent(Role role, Action action) throws OrchestrationException {
        Path file = configStore.resolve(role);
        if (!Files.isRegularFile(file)) {
            throw new OrchestrationException(ErrorCode.CONFIG_MISSING, role.getRoleName(), action.getActionName(),
                    "configuration file not found: " + file);
        }
    }

    private void checkApplicationDirectory(Role role, Action action) throws OrchestrationException {
        if (!Files.isDirectory(applicationDirectory)) {
            throw new OrchestrationException(ErrorCode.APP_DIR_MISSING, role.getRoleName(), action.getActionName(),
                    "application directory not found: " + applicationDirectory);
        }
    }

    private void checkNotShutdown(Role role, Action action) throws OrchestrationException {
        if (shutdown) {
            throw new OrchestrationException(ErrorCode.START_FAILED, role.getRoleName(), action.getActionName(),
                    "runtime is shutting down");
        }
    }

    private void fire(RoleStartedEvent event) {
        for (RoleEventListener listener : listeners) {
            try {
                listener.onRoleStarted(event);
            } catch (RuntimeException e) {
                LOGGER.error("Role event listener failed for {}", event, e);
            }
        }
    }

    private void fire(RoleShutdownEvent event) {
        for (RoleEventListener listener : listeners) {
            try {
                listener.onRoleShutdown(event);
            } catch (RuntimeException e) {
                LOGGER.error("Role event listener failed for {}", event, e);
            }
        }
    }

    // ==================== Accessors ====================

    public void addListener(@Nonnull RoleEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Get the instance of a role started by this runtime.
     *
     * @param role the role
     * @return the instance, or empty
     */
    @Nonnull
    public Optional<RoleInstance> getInstance(@Nonnull Role role) {
        return Optional.ofNullable(registry.get(role));
    }

    @Nonnull
    public RoleRegistry getRegistry() {
        return registry;
    }

    @Nonnull
    public ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    @Nonnull
    public ConfigStore getConfigStore() {
        return configStore;
    }

    @Nonnull
    public Path getApplicationDirectory() {
        return applicationDirectory;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Builder for {@link Orchestrator}. Unset collaborators get production defaults.
     */
    public static final class Builder {
        private final Path configDirectory;
        private final Path applicationDirectory;
        private Map<String, String> environment = System.getenv();
        private ObjectMapper mapper;
        private ProcessLauncher launcher;
        private ServiceController services;
        private HealthProbe healthProbe;
        private MetricsSourceFactory metricsSourceFactory;
        private Clock clock;
        private PortProbe portProbe;
        private DependencyResolver dependencyResolver;
        private Path sitesAvailable;
        private Path sitesEnabled;
        private boolean hostingLoops;
        private Duration readinessPollInterval;

        private Builder(Path configDirectory, Path applicationDirectory) {
            this.configDirectory = Objects.requireNonNull(configDirectory, "configDirectory");
            this.applicationDirectory = Objects.requireNonNull(applicationDirectory, "applicationDirectory");
        }

        /**
         * Set the environment used for {@code ${NAME}} references in config
         * documents and for {@code PATH} lookups.
         */
        public Builder environment(@Nonnull Map<String, String> environment) {
            this.environment = Map.copyOf(environment);
            return this;
        }

        public Builder mapper(@Nullable ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder launcher(@Nullable ProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder services(@Nullable ServiceController services) {
            this.services = services;
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

        /**
         * Keep background loops in this runtime and record it as their owner.
         */
        public Builder hostingLoops(boolean hostingLoops) {
            this.hostingLoops = hostingLoops;
            return this;
        }

        public Builder readinessPollInterval(@Nullable Duration readinessPollInterval) {
            this.readinessPollInterval = readinessPollInterval;
            return this;
        }

        @Nonnull
        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}
