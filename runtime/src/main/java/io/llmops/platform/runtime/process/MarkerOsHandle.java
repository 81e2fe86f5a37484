package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Handle for roles with no long-lived process, such as an embedded
 * file-backed database. The role counts as running while its activation
 * marker exists.
 */
public class MarkerOsHandle implements OsHandle {

    private final Role role;
    private final Path marker;
    private final Instant startedAt;

    public MarkerOsHandle(@Nonnull Role role, @Nonnull Path marker, @Nonnull Instant startedAt) {
        this.role = Objects.requireNonNull(role, "role");
        this.marker = Objects.requireNonNull(marker, "marker");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    /**
     * Create the marker file if it does not exist.
     *
     * @throws IOException if the marker could not be written
     */
    public void activate() throws IOException {
        Files.createDirectories(marker.toAbsolutePath().getParent());
        if (!Files.exists(marker)) {
            Files.createFile(marker);
        }
    }

    @Nonnull
    @Override
    public String describe() {
        return "marker " + marker;
    }

    @Override
    public boolean isAlive() {
        return Files.exists(marker);
    }

    @Override
    public void terminate(@Nonnull Duration timeout) throws IOException {
        Files.deleteIfExists(marker);
    }

    @Nonnull
    @Override
    public HandleRecord toRecord() {
        return HandleRecord.marker(role.getRoleName(), marker.toString(), startedAt.toEpochMilli());
    }

    @Nonnull
    public Path getMarker() {
        return marker;
    }
}
