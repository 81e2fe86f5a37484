package io.llmops.platform.runtime.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The application's {@code descriptor.json}, found at the root of the
 * application directory.
 *
 * <p>Keys are looked up at the top level first, then under
 * {@code components.<section>} so both flat and component-grouped
 * descriptors work.</p>
 */
public class AppDescriptor {

    public static final String FILE_NAME = "descriptor.json";

    private final Path path;
    private final JsonNode root;

    private AppDescriptor(@Nonnull Path path, @Nonnull JsonNode root) {
        this.path = Objects.requireNonNull(path, "path");
        this.root = Objects.requireNonNull(root, "root");
    }

    /**
     * Load the descriptor of an application directory.
     *
     * @param applicationDirectory application directory
     * @param mapper JSON mapper
     * @return the descriptor
     * @throws ConfigException if the descriptor is missing or unreadable
     */
    @Nonnull
    public static AppDescriptor load(@Nonnull Path applicationDirectory, @Nonnull ObjectMapper mapper)
            throws ConfigException {
        Path path = applicationDirectory.resolve(FILE_NAME);
        if (!Files.isRegularFile(path)) {
            throw ConfigException.invalid(FILE_NAME, "application descriptor not found at " + path);
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                throw new ConfigException(ConfigException.Reason.MALFORMED,
                        FILE_NAME + ": expected a JSON object at " + path);
            }
            return new AppDescriptor(path, root);
        } catch (IOException e) {
            throw new ConfigException(ConfigException.Reason.MALFORMED,
                    FILE_NAME + ": " + e.getMessage(), e);
        }
    }

    /**
     * Look up a string value.
     *
     * @param section component section ({@code web}, {@code api}, {@code model})
     * @param key key name
     * @param fallback value returned when the key is absent
     * @return the value
     */
    @Nonnull
    public String getString(@Nonnull String section, @Nonnull String key, @Nonnull String fallback) {
        String value = find(section, key);
        return value != null ? value : fallback;
    }

    @Nullable
    private String find(String section, String key) {
        JsonNode direct = root.get(key);
        if (direct != null && direct.isValueNode()) {
            return direct.asText();
        }
        JsonNode nested = root.path("components").path(section).get(key);
        if (nested != null && nested.isValueNode()) {
            return nested.asText();
        }
        return null;
    }

    @Nonnull
    public Path getPath() {
        return path;
    }
}
