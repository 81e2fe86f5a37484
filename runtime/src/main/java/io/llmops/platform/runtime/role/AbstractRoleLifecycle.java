package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.AppDescriptor;
import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.instance.StopException;
import io.llmops.platform.runtime.process.HandleRecord;
import io.llmops.platform.runtime.process.ProcessOsHandle;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stop, status and start plumbing shared by the role lifecycles.
 *
 * <p>Subclasses implement {@link #validate} and {@link #start}; a start
 * begins with {@link #begin}, registers an undo for every OS resource it
 * creates, and funnels any failure through {@link #fail}.</p>
 */
abstract class AbstractRoleLifecycle implements RoleLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRoleLifecycle.class);

    static final String LOCALHOST = "127.0.0.1";

    protected final Role role;
    protected final RoleContext context;

    protected AbstractRoleLifecycle(@Nonnull Role role, @Nonnull RoleContext context) {
        this.role = Objects.requireNonNull(role, "role");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Nonnull
    @Override
    public Role getRole() {
        return role;
    }

    // ==================== Stop / Status ====================

    @Override
    public void stop(@Nonnull RoleInstance instance) throws StopException {
        ServerInstance server = instance.getServer();
        ProcessSupervisor supervisor = context.getSupervisor();
        Duration timeout = instance.getShutdownTimeout();

        server.markStopping("stop requested");
        instance.stopLoops();
        try {
            Optional<HandleRecord> record = supervisor.getRecord(role);
            if (record.isPresent() && supervisor.stopOwner(record.get(), timeout.plusSeconds(10))) {
                LOGGER.info("Runtime hosting role '{}' has exited", role);
            }
            supervisor.stop(role, timeout);
        } catch (StopException e) {
            server.markFailed(e.getMessage());
            throw e;
        }
        server.markStopped();
        LOGGER.info("Role '{}' stopped", role);
    }

    @Nonnull
    @Override
    public LifecycleStatus status(@Nonnull RoleInstance instance) {
        LifecycleStatus status = context.getSupervisor().status(role);
        ServerInstance server = instance.getServer();
        if (status == LifecycleStatus.FAILED && server.getStatus() != LifecycleStatus.FAILED) {
            server.markFailed("OS handle is no longer alive");
        }
        return status;
    }

    // ==================== Validation Helpers ====================

    /**
     * Reject a start when the role's port is held by something else.
     */
    protected void checkPortFree(int port) throws StartException {
        if (!context.getPortProbe().isFree(port)) {
            throw new StartException(StartException.Reason.PORT_IN_USE,
                    "port " + port + " required by role " + role + " is already in use");
        }
    }

    /**
     * Check what every role validates: the dependency constraints and the
     * application's {@code descriptor.json}.
     *
     * @return the application descriptor
     */
    @Nonnull
    protected AppDescriptor checkCommon(@Nonnull RoleConfig config) throws ConfigException {
        DependencyResolver.checkConstraints(config.getDependencies());
        return AppDescriptor.load(config.getApplicationDirectory(), context.getMapper());
    }

    // ==================== Start Helpers ====================

    /**
     * Create the instance of a start attempt.
     */
    @Nonnull
    protected RoleInstance begin(@Nonnull RoleConfig config) {
        ServerInstance server = new ServerInstance(role, config.getApplicationDirectory(), config.getPort());
        server.markStarting();
        LOGGER.info("Starting role '{}' on port {}", role, config.getPort());
        return new RoleInstance(server, config.getShutdownTimeout());
    }

    /**
     * Mark a start attempt failed and undo what it created.
     *
     * @return {@code cause}, for rethrowing
     */
    @Nonnull
    protected StartException fail(
            @Nonnull RoleInstance instance,
            @Nonnull StartRollback rollback,
            @Nonnull StartException cause) {
        instance.stopLoops();
        rollback.rollback(cause);
        instance.getServer().markFailed(cause.getMessage());
        LOGGER.error("Failed to start role '{}': {}", role, cause.getMessage());
        return cause;
    }

    /**
     * Finish a successful start.
     */
    protected void complete(@Nonnull RoleInstance instance, @Nonnull StartRollback rollback) {
        rollback.commit();
        instance.getServer().markRunning();
        LOGGER.info("Role '{}' running on port {}", role, instance.getServer().getPort());
    }

    /**
     * Wrap a filesystem failure during start.
     */
    @Nonnull
    protected StartException resourceFailure(@Nonnull String what, @Nonnull IOException e) {
        return new StartException(StartException.Reason.RESOURCE_FAILURE,
                "cannot " + what + ": " + e.getMessage(), e);
    }

    /**
     * Wrap a configuration problem found again at start time.
     */
    @Nonnull
    protected StartException invalidAtStart(@Nonnull ConfigException e) {
        return new StartException(StartException.Reason.STARTUP_FAILED, e.getMessage(), e);
    }

    /**
     * Wait until a spawned process accepts connections on its port.
     *
     * @param handle the process
     * @param port the port it binds
     * @param timeout startup timeout
     * @throws StartException if the process exits or the timeout elapses first
     */
    protected void awaitReady(@Nonnull ProcessOsHandle handle, int port, @Nonnull Duration timeout)
            throws StartException {
        Duration poll = context.getReadinessPollInterval();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (!handle.isAlive()) {
                throw new StartException(StartException.Reason.STARTUP_FAILED,
                        "process " + handle.getPid() + " exited with code " + handle.getExitCode()
                                + " before listening on port " + port + lastOutput(handle));
            }
            if (context.getPortProbe().isListening(LOCALHOST, port, poll)) {
                LOGGER.debug("Role '{}' is listening on port {}", role, port);
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new StartException(StartException.Reason.STARTUP_FAILED,
                        "role " + role + " did not listen on port " + port
                                + " within " + timeout.toMillis() + "ms" + lastOutput(handle));
            }
            try {
                Thread.sleep(poll.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StartException(StartException.Reason.STARTUP_FAILED,
                        "interrupted while waiting for role " + role, e);
            }
        }
    }

    private static String lastOutput(ProcessOsHandle handle) {
        List<String> lines = handle.getRecentLogs(5);
        return lines.isEmpty() ? "" : "; last output: " + String.join(" | ", lines);
    }

    /**
     * Persist the latest loop snapshot. Failures are logged, the loop keeps running.
     */
    protected void writeSnapshot(@Nonnull Object snapshot) {
        try {
            context.getSupervisor().getStore().writeSnapshot(role, snapshot);
        } catch (IOException e) {
            LOGGER.warn("Cannot write state snapshot of role '{}': {}", role, e.getMessage());
        }
    }
}
