package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Records how to undo each OS resource a start creates, so a failed start
 * can release them in reverse order.
 *
 * <p>File helpers register their own undo: a file that existed before is
 * restored to its previous content, a new one is deleted.</p>
 */
public final class StartRollback {

    private static final Logger LOGGER = LoggerFactory.getLogger(StartRollback.class);

    /**
     * One undo action.
     */
    @FunctionalInterface
    public interface Undo {
        void run() throws Exception;
    }

    private record Step(String description, Undo undo) {
    }

    private final Role role;
    private final Deque<Step> steps = new ArrayDeque<>();

    public StartRollback(@Nonnull Role role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    /**
     * Register an undo action.
     *
     * @param description what is undone, for logs
     * @param undo the action
     */
    public void add(@Nonnull String description, @Nonnull Undo undo) {
        steps.push(new Step(description, undo));
    }

    /**
     * Undo every registered step, most recent first. Undo failures are
     * logged and attached to {@code cause} as suppressed exceptions.
     *
     * @param cause the failure being rolled back
     */
    public void rollback(@Nonnull StartException cause) {
        if (steps.isEmpty()) {
            return;
        }
        LOGGER.warn("Start of role '{}' failed ({}), rolling back {} steps", role, cause.getMessage(), steps.size());
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.undo().run();
                LOGGER.debug("Rolled back: {}", step.description());
            } catch (Exception e) {
                LOGGER.error("Rollback step '{}' failed for role '{}'", step.description(), role, e);
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * Forget every step once the start has succeeded.
     */
    public void commit() {
        steps.clear();
    }

    public int size() {
        return steps.size();
    }

    // ==================== File Helpers ====================

    /**
     * Write a text file.
     *
     * @param file target file
     * @param content file content
     * @throws IOException if the file could not be written
     */
    public void writeFile(@Nonnull Path file, @Nonnull String content) throws IOException {
        registerRestore(file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * Copy a file over a target.
     *
     * @param source source file
     * @param target target file
     * @throws IOException if the copy failed
     */
    public void copyFile(@Nonnull Path source, @Nonnull Path target) throws IOException {
        registerRestore(target);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Point a symbolic link at a target, replacing whatever was at the link path.
     *
     * @param link link path
     * @param target link target
     * @throws IOException if the link could not be created
     */
    public void replaceSymlink(@Nonnull Path link, @Nonnull Path target) throws IOException {
        Path parent = link.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.isSymbolicLink(link)) {
            Path previous = Files.readSymbolicLink(link);
            add("restore link " + link, () -> {
                Files.deleteIfExists(link);
                Files.createSymbolicLink(link, previous);
            });
        } else if (Files.exists(link, LinkOption.NOFOLLOW_LINKS)) {
            byte[] previous = Files.readAllBytes(link);
            add("restore " + link, () -> {
                Files.deleteIfExists(link);
                Files.write(link, previous);
            });
        } else {
            add("remove link " + link, () -> Files.deleteIfExists(link));
        }
        Files.deleteIfExists(link);
        Files.createSymbolicLink(link, target);
    }

    /**
     * Create a directory tree, removing the directories this call created on
     * rollback as long as they are still empty.
     *
     * @param directory directory to create
     * @throws IOException if the directory could not be created
     */
    public void createDirectories(@Nonnull Path directory) throws IOException {
        Path absolute = directory.toAbsolutePath();
        Path firstMissing = null;
        for (Path current = absolute; current != null && !Files.exists(current); current = current.getParent()) {
            firstMissing = current;
        }
        Files.createDirectories(absolute);
        if (firstMissing == null) {
            return;
        }
        Path top = firstMissing;
        add("remove directory " + top, () -> {
            for (Path current = absolute; current != null && current.startsWith(top); current = current.getParent()) {
                if (!isEmptyDirectory(current)) {
                    break;
                }
                Files.delete(current);
            }
        });
    }

    private static boolean isEmptyDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (var entries = Files.list(directory)) {
            return entries.findAny().isEmpty();
        }
    }

    private void registerRestore(Path file) throws IOException {
        if (Files.exists(file)) {
            byte[] previous = Files.readAllBytes(file);
            add("restore " + file, () -> Files.write(file, previous));
        } else {
            add("delete " + file, () -> Files.deleteIfExists(file));
        }
    }
}
