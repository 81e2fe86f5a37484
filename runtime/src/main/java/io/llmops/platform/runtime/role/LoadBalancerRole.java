package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.HealthCheckSpec;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.event.TargetHealthEvent;
import io.llmops.platform.runtime.health.HealthChecker;
import io.llmops.platform.runtime.health.PoolSnapshot;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.process.ServiceOsHandle;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The reverse proxy in front of the backends, kept in step with a
 * {@link HealthChecker}: each pool change rewrites the upstream block with
 * the eligible targets and reloads the proxy.
 */
public class LoadBalancerRole extends AbstractRoleLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoadBalancerRole.class);

    static final String PROXY_SERVICE = "nginx";
    static final String CONFIG_FILE = "nginx.conf";

    private static final Pattern BACKEND = Pattern.compile("^([A-Za-z0-9][A-Za-z0-9.-]*):(\\d{1,5})$");

    public LoadBalancerRole(@Nonnull RoleContext context) {
        super(Role.LOADBALANCER, context);
    }

    @Override
    public void validate(@Nonnull RoleConfig config) throws ConfigException, StartException {
        checkCommon(config);
        checkBackends(config.getBackendServers());
        HealthCheckSpec.from(config.getHealthCheck());
        checkPortFree(config.getPort());
    }

    static void checkBackends(@Nonnull List<String> backends) throws ConfigException {
        if (backends.isEmpty()) {
            throw ConfigException.invalid("backend_servers", "at least one backend is required");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < backends.size(); i++) {
            String backend = backends.get(i);
            String field = "backend_servers[" + i + "]";
            Matcher matcher = backend != null ? BACKEND.matcher(backend.trim()) : null;
            if (matcher == null || !matcher.matches()) {
                throw ConfigException.invalid(field, "expected host:port, got '" + backend + "'");
            }
            int port = Integer.parseInt(matcher.group(2));
            if (port < 1 || port > 65535) {
                throw ConfigException.invalid(field, "port must be between 1 and 65535, got " + port);
            }
            if (!seen.add(backend.trim())) {
                throw ConfigException.invalid(field, "duplicate backend '" + backend + "'");
            }
        }
    }

    @Nonnull
    @Override
    public RoleInstance start(@Nonnull RoleConfig config) throws StartException {
        Objects.requireNonNull(config, "config");
        HealthCheckSpec spec;
        try {
            spec = HealthCheckSpec.from(config.getHealthCheck());
        } catch (ConfigException e) {
            throw invalidAtStart(e);
        }
        List<String> backends = config.getBackendServers().stream().map(String::trim).toList();

        ProcessSupervisor supervisor = context.getSupervisor();
        RoleInstance instance = begin(config);
        ServerInstance server = instance.getServer();
        StartRollback rollback = new StartRollback(role);

        Path localConfig = config.getApplicationDirectory().resolve(CONFIG_FILE);
        Path site = context.getSitesAvailable().resolve(context.getSiteName());
        Path enabled = context.getSitesEnabled().resolve(context.getSiteName());
        SiteWriter writer = new SiteWriter(localConfig, site, config.getPort());
        try {
            try {
                rollback.createDirectories(context.getSitesAvailable());
                rollback.createDirectories(context.getSitesEnabled());
                rollback.writeFile(localConfig, NginxConfig.render(backends, config.getPort()));
                rollback.copyFile(localConfig, site);
                rollback.replaceSymlink(enabled, site);
            } catch (IOException e) {
                throw resourceFailure("write proxy configuration", e);
            }
            LOGGER.info("Wrote proxy configuration {} ({} backends)", site, backends.size());

            ServiceOsHandle proxy = supervisor.startService(role, PROXY_SERVICE, true);
            rollback.add("stop " + proxy.describe(), () -> supervisor.release(proxy, config.getShutdownTimeout()));
            server.attach(proxy);

            HealthChecker checker = new HealthChecker(backends, spec, context.getHealthProbe(), context.getClock());
            checker.addListener((event, snapshot) -> writer.onPoolChange(event, snapshot));
            checker.addSnapshotListener(this::writeSnapshot);
            writeSnapshot(checker.getSnapshot());
            rollback.add("delete state snapshot", () -> supervisor.getStore().deleteSnapshot(role));

            instance.addLoop(checker);
            if (context.isHostingLoops()) {
                checker.start();
            } else {
                checker.checkNow();
            }

            server.setDetail("proxy_config", localConfig.toString());
            server.setDetail("site", site.toString());
            server.setDetail("health_check", spec.path() + " every " + spec.interval().toMillis() + "ms");
            supervisor.register(role, proxy, config.getPort(), server.getDetails(), context.getLoopOwnerPid());
        } catch (StartException e) {
            throw fail(instance, rollback, e);
        }
        complete(instance, rollback);
        return instance;
    }

    /**
     * Rewrites the site on pool changes. Snapshots can arrive out of order
     * from different probe threads; older versions are skipped.
     */
    private final class SiteWriter {
        private final Path localConfig;
        private final Path site;
        private final int port;
        private long writtenVersion = -1;

        SiteWriter(Path localConfig, Path site, int port) {
            this.localConfig = localConfig;
            this.site = site;
            this.port = port;
        }

        synchronized void onPoolChange(TargetHealthEvent event, PoolSnapshot snapshot) {
            if (snapshot.version() <= writtenVersion) {
                return;
            }
            writtenVersion = snapshot.version();
            LOGGER.info("Pool changed ({} {} -> {}), upstream now {}{}", event.getAddress(),
                    event.getPreviousState(), event.getNewState(), snapshot.eligible(),
                    snapshot.degraded() ? " (degraded)" : "");
            try {
                Files.writeString(localConfig, NginxConfig.render(snapshot.eligible(), port), StandardCharsets.UTF_8);
                Files.copy(localConfig, site, StandardCopyOption.REPLACE_EXISTING);
                context.getSupervisor().reloadService(PROXY_SERVICE);
            } catch (IOException e) {
                LOGGER.warn("Cannot apply pool change to the proxy: {}", e.getMessage());
            }
        }
    }
}
