package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.alert.AlertEvaluator;
import io.llmops.platform.runtime.alert.AlertRule;
import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.DurationParser;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.process.CompositeOsHandle;
import io.llmops.platform.runtime.process.OsHandle;
import io.llmops.platform.runtime.process.ProcessOsHandle;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.process.ServiceOsHandle;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The monitoring stack: a Prometheus collector scraping the targets, an
 * optional Grafana service, and an {@link AlertEvaluator} over the targets'
 * metrics.
 */
public class MonitoringRole extends AbstractRoleLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringRole.class);

    static final String COLLECTOR = "prometheus";
    static final String GRAFANA_SERVICE = "grafana-server";
    static final String CONFIG_FILE = "prometheus.yml";
    static final String DATA_DIR = "prometheus_data";

    public MonitoringRole(@Nonnull RoleContext context) {
        super(Role.MONITORING, context);
    }

    @Override
    public void validate(@Nonnull RoleConfig config) throws ConfigException, StartException {
        checkCommon(config);
        String type = config.getMonitoringType().trim().toLowerCase(Locale.ROOT);
        if (!COLLECTOR.equals(type)) {
            throw ConfigException.invalid("monitoring_type", "only 'prometheus' is supported, got '" + type + "'");
        }
        if (config.getTargets().isEmpty()) {
            throw ConfigException.invalid("targets", "at least one target is required");
        }
        AlertRule.parseAll(config.getAlertRules());
        evaluationInterval(config);
        checkPortFree(config.getPort());
        context.getDependencyResolver().requireExecutable(COLLECTOR);
    }

    private static Duration evaluationInterval(RoleConfig config) throws ConfigException {
        Duration interval = DurationParser.parseField("evaluation_interval", config.getEvaluationInterval(),
                AlertEvaluator.DEFAULT_EVALUATION_INTERVAL);
        if (interval.isZero()) {
            throw ConfigException.invalid("evaluation_interval", "must be positive");
        }
        return interval;
    }

    @Nonnull
    @Override
    public RoleInstance start(@Nonnull RoleConfig config) throws StartException {
        Objects.requireNonNull(config, "config");
        List<AlertRule> rules;
        Duration interval;
        try {
            rules = AlertRule.parseAll(config.getAlertRules());
            interval = evaluationInterval(config);
        } catch (ConfigException e) {
            throw invalidAtStart(e);
        }
        List<String> targets = config.getTargets();
        Path appDir = config.getApplicationDirectory();
        Path configFile = appDir.resolve(CONFIG_FILE).toAbsolutePath();
        Path dataDir = appDir.resolve(DATA_DIR).toAbsolutePath();

        ProcessSupervisor supervisor = context.getSupervisor();
        RoleInstance instance = begin(config);
        ServerInstance server = instance.getServer();
        StartRollback rollback = new StartRollback(role);
        try {
            Path executable = context.getDependencyResolver().requireExecutable(COLLECTOR);
            try {
                rollback.writeFile(configFile, PrometheusConfig.render(targets));
                rollback.createDirectories(dataDir);
            } catch (IOException e) {
                throw resourceFailure("write collector configuration", e);
            }

            List<String> command = List.of(
                    executable.toString(),
                    "--config.file=" + configFile,
                    "--storage.tsdb.path=" + dataDir,
                    "--web.listen-address=0.0.0.0:" + config.getPort());
            ProcessOsHandle collector = supervisor.spawn(role, command, appDir, config.getEnvironment());
            rollback.add("terminate " + collector.describe(),
                    () -> supervisor.release(collector, config.getShutdownTimeout()));
            server.attach(collector);
            awaitReady(collector, config.getPort(), config.getStartupTimeout());

            OsHandle handle = collector;
            if (config.isStartGrafana()) {
                ServiceOsHandle grafana = supervisor.startService(role, GRAFANA_SERVICE, false);
                if (grafana.isStartedHere()) {
                    rollback.add("stop " + grafana.describe(),
                            () -> supervisor.release(grafana, config.getShutdownTimeout()));
                    handle = new CompositeOsHandle(collector, List.of(grafana));
                } else {
                    LOGGER.info("Grafana was already running and stays unmanaged");
                }
                server.setDetail("grafana_port", String.valueOf(config.getGrafanaPort()));
            }
            server.attach(handle);

            AlertEvaluator evaluator = new AlertEvaluator(rules,
                    context.getMetricsSourceFactory().create(targets), interval, context.getClock());
            evaluator.addSnapshotListener(this::writeSnapshot);
            writeSnapshot(evaluator.getSnapshot());
            rollback.add("delete state snapshot", () -> supervisor.getStore().deleteSnapshot(role));
            instance.addLoop(evaluator);
            if (context.isHostingLoops()) {
                evaluator.start();
                LOGGER.info("Evaluating {} alert rules every {}ms", rules.size(), evaluator.getTickInterval().toMillis());
            }

            server.setDetail("collector_config", configFile.toString());
            server.setDetail("log_file", collector.getLogFile().toString());
            supervisor.register(role, handle, config.getPort(), server.getDetails(), context.getLoopOwnerPid());
        } catch (StartException e) {
            throw fail(instance, rollback, e);
        }
        complete(instance, rollback);
        return instance;
    }
}
