package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.AppDescriptor;
import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.process.ProcessOsHandle;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of the roles that launch application code from the application
 * directory: validate the descriptor, spawn one process, wait for its port.
 */
abstract class ApplicationRole extends AbstractRoleLifecycle {

    /**
     * How to launch the application.
     *
     * @param command executable name followed by its arguments
     * @param environment variables added to the configured environment
     * @param details instance details recorded once running
     */
    record LaunchPlan(List<String> command, Map<String, String> environment, Map<String, String> details) {

        LaunchPlan {
            command = List.copyOf(command);
            environment = Map.copyOf(environment);
            details = Map.copyOf(details);
            if (command.isEmpty()) {
                throw new IllegalArgumentException("command must not be empty");
            }
        }

        String executable() {
            return command.get(0);
        }
    }

    protected ApplicationRole(@Nonnull Role role, @Nonnull RoleContext context) {
        super(role, context);
    }

    /**
     * Build the launch plan from the configuration and the application descriptor.
     *
     * @throws ConfigException if the descriptor selects something unsupported
     */
    @Nonnull
    protected abstract LaunchPlan plan(@Nonnull RoleConfig config, @Nonnull AppDescriptor descriptor)
            throws ConfigException;

    @Override
    public void validate(@Nonnull RoleConfig config) throws ConfigException, StartException {
        LaunchPlan plan = plan(config, checkCommon(config));
        checkPortFree(config.getPort());
        context.getDependencyResolver().requireExecutable(plan.executable());
    }

    @Nonnull
    @Override
    public RoleInstance start(@Nonnull RoleConfig config) throws StartException {
        Objects.requireNonNull(config, "config");
        LaunchPlan plan;
        try {
            plan = plan(config, AppDescriptor.load(config.getApplicationDirectory(), context.getMapper()));
        } catch (ConfigException e) {
            throw invalidAtStart(e);
        }

        ProcessSupervisor supervisor = context.getSupervisor();
        RoleInstance instance = begin(config);
        ServerInstance server = instance.getServer();
        StartRollback rollback = new StartRollback(role);
        try {
            Path executable = context.getDependencyResolver().requireExecutable(plan.executable());
            List<String> command = new ArrayList<>(plan.command());
            command.set(0, executable.toString());

            Map<String, String> environment = new LinkedHashMap<>(config.getEnvironment());
            environment.putAll(plan.environment());

            ProcessOsHandle handle = supervisor.spawn(role, command, config.getApplicationDirectory(), environment);
            rollback.add("terminate " + handle.describe(),
                    () -> supervisor.release(handle, config.getShutdownTimeout()));
            server.attach(handle);

            awaitReady(handle, config.getPort(), config.getStartupTimeout());

            plan.details().forEach(server::setDetail);
            server.setDetail("log_file", handle.getLogFile().toString());
            supervisor.register(role, handle, config.getPort(), server.getDetails(), null);
        } catch (StartException e) {
            throw fail(instance, rollback, e);
        }
        complete(instance, rollback);
        return instance;
    }
}
