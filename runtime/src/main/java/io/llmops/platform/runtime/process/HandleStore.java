package io.llmops.platform.runtime.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists handle records and state snapshots under {@code <app-dir>/run}.
 *
 * <p>Every write goes to a temporary file that is then moved over the target,
 * so readers never see a half-written document.</p>
 */
public class HandleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(HandleStore.class);

    private final Path runDirectory;
    private final ObjectMapper mapper;

    public HandleStore(@Nonnull Path runDirectory, @Nonnull ObjectMapper mapper) {
        this.runDirectory = Objects.requireNonNull(runDirectory, "runDirectory");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ==================== Handle Records ====================

    /**
     * Load a role's handle record.
     *
     * <p>An unreadable record is logged and treated as absent.</p>
     *
     * @param role the role
     * @return the record, or empty
     */
    @Nonnull
    public Optional<HandleRecord> load(@Nonnull Role role) {
        return read(recordFile(role), HandleRecord.class);
    }

    public void save(@Nonnull Role role, @Nonnull HandleRecord record) throws IOException {
        write(recordFile(role), record);
    }

    public void delete(@Nonnull Role role) throws IOException {
        Files.deleteIfExists(recordFile(role));
    }

    // ==================== State Snapshots ====================

    /**
     * Publish a background loop's state for other invocations.
     *
     * @param role the role owning the loop
     * @param snapshot JSON-serialisable snapshot
     * @throws IOException if the snapshot could not be written
     */
    public void writeSnapshot(@Nonnull Role role, @Nonnull Object snapshot) throws IOException {
        write(snapshotFile(role), snapshot);
    }

    @Nonnull
    public <T> Optional<T> readSnapshot(@Nonnull Role role, @Nonnull Class<T> type) {
        return read(snapshotFile(role), type);
    }

    public void deleteSnapshot(@Nonnull Role role) throws IOException {
        Files.deleteIfExists(snapshotFile(role));
    }

    // ==================== Files ====================

    @Nonnull
    public Path recordFile(@Nonnull Role role) {
        return runDirectory.resolve(role.getRoleName() + ".json");
    }

    @Nonnull
    public Path snapshotFile(@Nonnull Role role) {
        return runDirectory.resolve(role.getRoleName() + "-state.json");
    }

    @Nonnull
    public Path getRunDirectory() {
        return runDirectory;
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            LOGGER.warn("Ignoring unreadable {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Path file, Object value) throws IOException {
        Files.createDirectories(runDirectory);
        byte[] bytes;
        try {
            bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IOException("Cannot serialise " + file.getFileName() + ": " + e.getOriginalMessage(), e);
        }

        Path temp = Files.createTempFile(runDirectory, file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
