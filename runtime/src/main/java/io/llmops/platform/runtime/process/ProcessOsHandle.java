package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a role's OS process.
 *
 * <p>Either wraps a {@link Process} started by this runtime, or a
 * {@link ProcessHandle} re-attached by pid from a handle record written by an
 * earlier invocation.</p>
 */
public class ProcessOsHandle implements OsHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessOsHandle.class);

    private static final int TAIL_BYTES = 64 * 1024;
    private static final Duration START_TOLERANCE = Duration.ofSeconds(5);
    private static final Duration FORCE_WAIT = Duration.ofSeconds(5);

    private final Role role;
    private final long pid;
    private final Instant startedAt;
    private final Path logFile;

    @Nullable
    private final Process process;
    @Nullable
    private final ProcessHandle processHandle;

    private volatile Integer exitCode;

    private ProcessOsHandle(
            Role role,
            long pid,
            Instant startedAt,
            Path logFile,
            @Nullable Process process,
            @Nullable ProcessHandle processHandle) {
        this.role = role;
        this.pid = pid;
        this.startedAt = startedAt;
        this.logFile = logFile;
        this.process = process;
        this.processHandle = processHandle;
    }

    /**
     * Wrap a process this runtime just started.
     *
     * @param role owning role
     * @param process the process
     * @param logFile file receiving its output
     * @return the handle
     */
    @Nonnull
    public static ProcessOsHandle launched(@Nonnull Role role, @Nonnull Process process, @Nonnull Path logFile) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(process, "process");
        Objects.requireNonNull(logFile, "logFile");
        long pid;
        try {
            pid = process.pid();
        } catch (UnsupportedOperationException e) {
            pid = -1;
        }
        return new ProcessOsHandle(role, pid, Instant.now(), logFile, process, null);
    }

    /**
     * Re-attach to a process described by a handle record.
     *
     * <p>A pid that no longer exists, or that now belongs to a process started
     * at a different time, yields a dead handle.</p>
     *
     * @param role owning role
     * @param record the persisted record
     * @param logFile file receiving its output
     * @return the handle
     */
    @Nonnull
    public static ProcessOsHandle reattach(@Nonnull Role role, @Nonnull HandleRecord record, @Nonnull Path logFile) {
        long pid = record.pid() != null ? record.pid() : -1;
        Instant startedAt = Instant.ofEpochMilli(record.startedAtMillis());
        ProcessHandle handle = pid > 0
                ? ProcessHandle.of(pid).filter(h -> sameStart(h, startedAt)).orElse(null)
                : null;
        return new ProcessOsHandle(role, pid, startedAt, logFile, null, handle);
    }

    private static boolean sameStart(ProcessHandle handle, Instant expected) {
        Optional<Instant> actual = handle.info().startInstant();
        if (actual.isEmpty()) {
            return true;
        }
        Duration drift = Duration.between(actual.get(), expected).abs();
        return drift.compareTo(START_TOLERANCE) <= 0;
    }

    // ==================== OsHandle ====================

    @Nonnull
    @Override
    public String describe() {
        return "pid " + pid;
    }

    @Override
    public boolean isAlive() {
        if (process != null) {
            return process.isAlive();
        }
        return processHandle != null && processHandle.isAlive();
    }

    @Override
    public void terminate(@Nonnull Duration timeout) throws IOException {
        if (!isAlive()) {
            return;
        }
        try {
            if (process != null) {
                process.destroy();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    process.waitFor(FORCE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                }
            } else if (processHandle != null) {
                processHandle.destroy();
                if (!awaitExit(processHandle, timeout)) {
                    processHandle.destroyForcibly();
                    awaitExit(processHandle, FORCE_WAIT);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while terminating " + describe(), e);
        }

        if (isAlive()) {
            throw new IOException("Process " + pid + " for role " + role + " survived forced termination");
        }
    }

    private static boolean awaitExit(ProcessHandle handle, Duration timeout) throws InterruptedException {
        try {
            handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return !handle.isAlive();
        }
    }

    @Nonnull
    @Override
    public HandleRecord toRecord() {
        return HandleRecord.process(role.getRoleName(), pid, startedAt.toEpochMilli());
    }

    // ==================== Process Details ====================

    public long getPid() {
        return pid;
    }

    @Nonnull
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nonnull
    public Path getLogFile() {
        return logFile;
    }

    /**
     * Get the exit code if this runtime started the process and it has exited.
     *
     * @return exit code, or null if still running or unknown
     */
    @Nullable
    public Integer getExitCode() {
        if (exitCode != null) {
            return exitCode;
        }
        if (process != null && !process.isAlive()) {
            exitCode = process.exitValue();
        }
        return exitCode;
    }

    /**
     * Read the last lines of the process log.
     *
     * @param count number of lines to retrieve
     * @return log lines, most recent last
     */
    @Nonnull
    public List<String> getRecentLogs(int count) {
        return readTail(logFile, count);
    }

    /**
     * Read the last lines of a log file.
     *
     * @param logFile the file
     * @param count number of lines to retrieve
     * @return log lines, most recent last
     */
    @Nonnull
    public static List<String> readTail(@Nonnull Path logFile, int count) {
        if (count <= 0 || !Files.isRegularFile(logFile)) {
            return Collections.emptyList();
        }
        String text;
        try (SeekableByteChannel channel = Files.newByteChannel(logFile)) {
            long size = channel.size();
            int length = (int) Math.min(size, TAIL_BYTES);
            channel.position(size - length);
            ByteBuffer buffer = ByteBuffer.allocate(length);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.warn("Cannot read log tail of {}: {}", logFile, e.getMessage());
            return Collections.emptyList();
        }

        Deque<String> tail = new ArrayDeque<>(count);
        for (String line : text.split("\\R")) {
            tail.addLast(line);
            if (tail.size() > count) {
                tail.removeFirst();
            }
        }
        return new ArrayList<>(tail);
    }

    @Override
    public String toString() {
        return "ProcessOsHandle{" +
                "role=" + role +
                ", pid=" + pid +
                ", alive=" + isAlive() +
                '}';
    }
}
