package io.llmops.platform.runtime.instance;

import io.llmops.platform.runtime.process.OsHandle;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents the running (or last run) instance of one role.
 *
 * <p>Tracks the instance's lifecycle, OS handle and details such as the
 * connection URL or the paths of generated config files.</p>
 *
 * <h2>Lifecycle States</h2>
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓
 *            FAILED     FAILED (handle died)
 * </pre>
 */
public class ServerInstance {

    private final Role role;
    private final Path applicationDirectory;
    private final int port;
    private final Instant createdAt;
    private final Map<String, String> details = Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile LifecycleStatus status = LifecycleStatus.STOPPED;
    private volatile OsHandle handle;
    private volatile Instant startedAt;
    private volatile Instant stoppedAt;
    private volatile String stopReason;

    /**
     * Create a server instance.
     *
     * @param role the role this instance serves
     * @param applicationDirectory application directory
     * @param port bound port
     */
    public ServerInstance(@Nonnull Role role, @Nonnull Path applicationDirectory, int port) {
        this.role = Objects.requireNonNull(role, "role");
        this.applicationDirectory = Objects.requireNonNull(applicationDirectory, "applicationDirectory");
        this.port = port;
        this.createdAt = Instant.now();
    }

    // ==================== Lifecycle ====================

    /**
     * Mark the instance as starting.
     */
    public void markStarting() {
        this.status = LifecycleStatus.STARTING;
        this.startedAt = Instant.now();
        this.stoppedAt = null;
        this.stopReason = null;
    }

    /**
     * Attach the OS handle once it exists.
     *
     * @param handle the OS handle
     */
    public void attach(@Nonnull OsHandle handle) {
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    /**
     * Mark the instance as running.
     */
    public void markRunning() {
        this.status = LifecycleStatus.RUNNING;
    }

    /**
     * Mark the instance as running with a known original start time.
     *
     * @param startedAt when the handle was created
     */
    public void markRunningSince(@Nonnull Instant startedAt) {
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.status = LifecycleStatus.RUNNING;
    }

    /**
     * Mark the instance as stopping.
     *
     * @param reason reason for shutdown
     */
    public void markStopping(@Nullable String reason) {
        this.status = LifecycleStatus.STOPPING;
        this.stopReason = reason;
    }

    /**
     * Mark the instance as stopped.
     */
    public void markStopped() {
        this.status = LifecycleStatus.STOPPED;
        this.stoppedAt = Instant.now();
    }

    /**
     * Mark the instance as failed.
     *
     * @param reason failure reason
     */
    public void markFailed(@Nullable String reason) {
        this.status = LifecycleStatus.FAILED;
        this.stopReason = reason;
        this.stoppedAt = Instant.now();
    }

    // ==================== Details ====================

    /**
     * Set a detail value, or remove it when {@code value} is null.
     *
     * @param key detail key
     * @param value detail value
     */
    public void setDetail(@Nonnull String key, @Nullable String value) {
        if (value == null) {
            details.remove(key);
        } else {
            details.put(key, value);
        }
    }

    /**
     * Get a detail value.
     *
     * @param key detail key
     * @return value, or null if not set
     */
    @Nullable
    public String getDetail(@Nonnull String key) {
        return details.get(key);
    }

    /**
     * Get all details.
     *
     * @return snapshot of the details in insertion order
     */
    @Nonnull
    public Map<String, String> getDetails() {
        synchronized (details) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }

    // ==================== Status Checks ====================

    /**
     * Check if the instance's handle is alive while it is expected to be.
     *
     * @return true if the status expects a process and the handle is alive
     */
    public boolean isHealthy() {
        if (!status.isProcessExpected()) {
            return false;
        }
        return handle != null && handle.isAlive();
    }

    // ==================== Getters ====================

    @Nonnull
    public Role getRole() {
        return role;
    }

    @Nonnull
    public Path getApplicationDirectory() {
        return applicationDirectory;
    }

    public int getPort() {
        return port;
    }

    @Nonnull
    public LifecycleStatus getStatus() {
        return status;
    }

    /**
     * Get the OS handle.
     *
     * @return handle, or null before one was attached
     */
    @Nullable
    public OsHandle getHandle() {
        return handle;
    }

    @Nonnull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nullable
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nullable
    public Instant getStoppedAt() {
        return stoppedAt;
    }

    @Nullable
    public String getStopReason() {
        return stopReason;
    }

    /**
     * Get the uptime in milliseconds.
     *
     * @return uptime, or 0 if not started
     */
    public long getUptimeMillis() {
        if (startedAt == null) {
            return 0;
        }
        Instant end = stoppedAt != null ? stoppedAt : Instant.now();
        return Math.max(0, end.toEpochMilli() - startedAt.toEpochMilli());
    }

    @Override
    public String toString() {
        return "ServerInstance{" +
                "role=" + role +
                ", status=" + status +
                ", port=" + port +
                ", handle=" + (handle != null ? handle.describe() : "none") +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerInstance that = (ServerInstance) o;
        return role == that.role && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, createdAt);
    }
}
