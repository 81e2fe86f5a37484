package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.instance.StopException;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the OS handle of every role.
 *
 * <p>Holds at most one handle per role. Handles created in this runtime are
 * kept in memory; handles created by an earlier invocation are re-derived from
 * the records in the {@link HandleStore}. Status is always read from the OS,
 * never from a cached flag.</p>
 */
public class ProcessSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final HandleStore store;
    private final ProcessLauncher launcher;
    private final ServiceController services;
    private final Path logsDirectory;
    private final Map<Role, OsHandle> handles = new ConcurrentHashMap<>();

    /**
     * Create a process supervisor.
     *
     * @param store handle record store
     * @param launcher process launcher
     * @param services service controller
     * @param logsDirectory directory receiving {@code <role>.log}
     */
    public ProcessSupervisor(
            @Nonnull HandleStore store,
            @Nonnull ProcessLauncher launcher,
            @Nonnull ServiceController services,
            @Nonnull Path logsDirectory) {
        this.store = Objects.requireNonNull(store, "store");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.services = Objects.requireNonNull(services, "services");
        this.logsDirectory = Objects.requireNonNull(logsDirectory, "logsDirectory");
    }

    // ==================== Start ====================

    /**
     * Reject a start when the role's handle is alive, and clear a stale record
     * left by a handle that died.
     *
     * @param role the role about to start
     * @throws StartException with {@code ALREADY_RUNNING} if the handle is alive
     */
    public void ensureNotRunning(@Nonnull Role role) throws StartException {
        Optional<OsHandle> existing = find(role);
        if (existing.isEmpty()) {
            return;
        }
        OsHandle handle = existing.get();
        if (handle.isAlive()) {
            throw new StartException(StartException.Reason.ALREADY_RUNNING,
                    "role " + role + " is already running (" + handle.describe() + ")");
        }

        LOGGER.warn("Clearing stale handle for role '{}' ({})", role, handle.describe());
        try {
            forget(role);
        } catch (IOException e) {
            throw new StartException(StartException.Reason.RESOURCE_FAILURE,
                    "cannot clear stale handle record for " + role + ": " + e.getMessage(), e);
        }
    }

    /**
     * Spawn a process for a role. The handle is not registered until
     * {@link #register} is called.
     *
     * @param role owning role
     * @param command executable and arguments
     * @param workingDirectory working directory
     * @param environment extra environment variables
     * @return the process handle
     * @throws StartException if the process could not be started
     */
    @Nonnull
    public ProcessOsHandle spawn(
            @Nonnull Role role,
            @Nonnull List<String> command,
            @Nonnull Path workingDirectory,
            @Nonnull Map<String, String> environment) throws StartException {
        Objects.requireNonNull(role, "role");
        Path logFile = logFile(role);

        LOGGER.info("Spawning {} process in {}", role, workingDirectory);
        Process process;
        try {
            process = launcher.launch(new ProcessLauncher.LaunchRequest(command, workingDirectory, environment, logFile));
        } catch (IOException e) {
            throw new StartException(StartException.Reason.RESOURCE_FAILURE,
                    "cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        ProcessOsHandle handle = ProcessOsHandle.launched(role, process, logFile);
        LOGGER.info("Role '{}' started with PID {}", role, handle.getPid());
        return handle;
    }

    /**
     * Start (or restart) a service unit for a role.
     *
     * @param role owning role
     * @param unit service unit
     * @param restart restart even if the unit is already active
     * @return the service handle
     * @throws StartException if the service manager refused
     */
    @Nonnull
    public ServiceOsHandle startService(@Nonnull Role role, @Nonnull String unit, boolean restart)
            throws StartException {
        boolean startedHere = true;
        try {
            if (restart) {
                LOGGER.info("Restarting service '{}' for role '{}'", unit, role);
                services.restart(unit);
            } else if (services.isActive(unit)) {
                LOGGER.info("Service '{}' is already active", unit);
                startedHere = false;
            } else {
                LOGGER.info("Starting service '{}' for role '{}'", unit, role);
                services.start(unit);
            }
        } catch (IOException e) {
            throw new StartException(StartException.Reason.RESOURCE_FAILURE,
                    "cannot start service " + unit + ": " + e.getMessage(), e);
        }
        return new ServiceOsHandle(role, unit, services, Instant.now(), startedHere);
    }

    /**
     * Create the activation marker for a role without a long-lived process.
     *
     * @param role owning role
     * @param marker marker file
     * @return the marker handle
     * @throws StartException if the marker could not be written
     */
    @Nonnull
    public MarkerOsHandle activateMarker(@Nonnull Role role, @Nonnull Path marker) throws StartException {
        MarkerOsHandle handle = new MarkerOsHandle(role, marker, Instant.now());
        try {
            handle.activate();
        } catch (IOException e) {
            throw new StartException(StartException.Reason.RESOURCE_FAILURE,
                    "cannot write activation marker " + marker + ": " + e.getMessage(), e);
        }
        return handle;
    }

    /**
     * Reload a service unit's configuration.
     *
     * @param unit service unit
     * @throws IOException if the reload failed
     */
    public void reloadService(@Nonnull String unit) throws IOException {
        services.reload(unit);
    }

    /**
     * Register a role's handle and persist its record.
     *
     * @param role owning role
     * @param handle the handle
     * @param port bound port
     * @param details instance details
     * @param ownerPid pid of the runtime hosting the role's loop, or null
     * @throws StartException if the record could not be written
     */
    public void register(
            @Nonnull Role role,
            @Nonnull OsHandle handle,
            int port,
            @Nonnull Map<String, String> details,
            @Nullable Long ownerPid) throws StartException {
        HandleRecord record = handle.toRecord().withRegistration(port, details, ownerPid);
        try {
            store.save(role, record);
        } catch (IOException e) {
            throw new StartException(StartException.Reason.RESOURCE_FAILURE,
                    "cannot write handle record for " + role + ": " + e.getMessage(), e);
        }
        handles.put(role, handle);
        LOGGER.debug("Registered {} handle: {}", role, handle.describe());
    }

    /**
     * Release a handle that was never registered, or whose start is being
     * rolled back.
     *
     * @param handle the handle
     * @param timeout graceful shutdown timeout
     * @throws IOException if the resource could not be released
     */
    public void release(@Nonnull OsHandle handle, @Nonnull Duration timeout) throws IOException {
        handle.terminate(timeout);
    }

    // ==================== Stop ====================

    /**
     * Stop a role's handle and forget it.
     *
     * @param role the role
     * @param timeout graceful shutdown timeout
     * @return true if a live handle was terminated, false if there was nothing to stop
     * @throws StopException if the handle survived termination
     */
    public boolean stop(@Nonnull Role role, @Nonnull Duration timeout) throws StopException {
        Optional<OsHandle> found = find(role);
        boolean terminated = false;
        if (found.isEmpty() || !found.get().isAlive()) {
            LOGGER.info("No live handle for role '{}', nothing to stop", role);
        } else {
            OsHandle handle = found.get();
            LOGGER.info("Stopping role '{}' ({})", role, handle.describe());
            try {
                handle.terminate(timeout);
            } catch (IOException e) {
                throw new StopException("cannot stop " + role + " (" + handle.describe() + "): " + e.getMessage(), e);
            }
            terminated = true;
        }

        try {
            forget(role);
        } catch (IOException e) {
            throw new StopException("cannot remove handle record for " + role + ": " + e.getMessage(), e);
        }
        return terminated;
    }

    /**
     * Ask the runtime that hosts a role's background loop to shut down, and
     * wait for it to exit.
     *
     * @param record the role's handle record
     * @param timeout how long to wait
     * @return true if another live runtime was signalled
     * @throws StopException if it did not exit in time
     */
    public boolean stopOwner(@Nonnull HandleRecord record, @Nonnull Duration timeout) throws StopException {
        Long ownerPid = record.ownerPid();
        if (ownerPid == null || ownerPid == ProcessHandle.current().pid()) {
            return false;
        }
        Optional<ProcessHandle> owner = ProcessHandle.of(ownerPid).filter(ProcessHandle::isAlive);
        if (owner.isEmpty()) {
            return false;
        }

        LOGGER.info("Signalling runtime {} hosting role '{}'", ownerPid, record.role());
        owner.get().destroy();
        try {
            owner.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new StopException("runtime " + ownerPid + " hosting " + record.role()
                    + " did not exit within " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw new StopException("cannot wait for runtime " + ownerPid + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StopException("interrupted while waiting for runtime " + ownerPid, e);
        }
        return true;
    }

    // ==================== Status ====================

    /**
     * Derive a role's lifecycle status from its OS handle.
     *
     * @param role the role
     * @return RUNNING if the handle is alive, FAILED if a record remains for a
     *         dead handle, STOPPED otherwise
     */
    @Nonnull
    public LifecycleStatus status(@Nonnull Role role) {
        Optional<OsHandle> handle = find(role);
        if (handle.isEmpty()) {
            return LifecycleStatus.STOPPED;
        }
        if (handle.get().isAlive()) {
            return LifecycleStatus.RUNNING;
        }
        return store.load(role).isPresent() ? LifecycleStatus.FAILED : LifecycleStatus.STOPPED;
    }

    /**
     * Find a role's handle, in memory or re-derived from its record.
     *
     * @param role the role
     * @return the handle, or empty
     */
    @Nonnull
    public Optional<OsHandle> find(@Nonnull Role role) {
        OsHandle handle = handles.get(role);
        if (handle != null) {
            return Optional.of(handle);
        }
        return store.load(role).map(record -> attach(role, record));
    }

    @Nonnull
    public Optional<HandleRecord> getRecord(@Nonnull Role role) {
        return store.load(role);
    }

    /**
     * Rebuild a handle from its record.
     *
     * @param role owning role
     * @param record persisted record
     * @return the handle, possibly dead
     */
    @Nonnull
    public OsHandle attach(@Nonnull Role role, @Nonnull HandleRecord record) {
        OsHandle primary = attachSingle(role, record);
        if (record.companions().isEmpty()) {
            return primary;
        }
        List<OsHandle> companions = new ArrayList<>();
        for (HandleRecord companion : record.companions()) {
            companions.add(attachSingle(role, companion));
        }
        return new CompositeOsHandle(primary, companions);
    }

    private OsHandle attachSingle(Role role, HandleRecord record) {
        Instant startedAt = Instant.ofEpochMilli(record.startedAtMillis());
        switch (record.kind()) {
            case SERVICE:
                return new ServiceOsHandle(role, Objects.requireNonNull(record.unit(), "unit"), services, startedAt, true);
            case MARKER:
                return new MarkerOsHandle(role, Path.of(Objects.requireNonNull(record.marker(), "marker")), startedAt);
            case PROCESS:
            default:
                return ProcessOsHandle.reattach(role, record, logFile(role));
        }
    }

    /**
     * Drop a role's in-memory handle, record and state snapshot.
     *
     * @param role the role
     * @throws IOException if the files could not be removed
     */
    public void forget(@Nonnull Role role) throws IOException {
        handles.remove(role);
        store.delete(role);
        store.deleteSnapshot(role);
    }

    /**
     * Read recent log lines for a role's process.
     *
     * @param role the role
     * @param lines number of lines
     * @return log lines, most recent last
     */
    @Nonnull
    public List<String> getRecentLogs(@Nonnull Role role, int lines) {
        return ProcessOsHandle.readTail(logFile(role), lines);
    }

    @Nonnull
    public Path logFile(@Nonnull Role role) {
        return logsDirectory.resolve(role.getRoleName() + ".log");
    }

    @Nonnull
    public HandleStore getStore() {
        return store;
    }
}
