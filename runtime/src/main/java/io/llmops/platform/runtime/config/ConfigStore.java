package io.llmops.platform.runtime.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads role configuration documents from the config directory.
 *
 * <p>A role's document lives at {@code <config-dir>/<role>_server.json}.
 * Before binding, string values are interpolated: {@code ${APP_DIR}} becomes
 * the application directory and {@code ${NAME}} the environment variable
 * {@code NAME}. Unknown references are left untouched.</p>
 */
public class ConfigStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigStore.class);

    public static final String APP_DIR_VARIABLE = "APP_DIR";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final Path configDirectory;
    private final Path applicationDirectory;
    private final Map<String, String> environment;
    private final ObjectMapper mapper;

    /**
     * Create a config store.
     *
     * @param configDirectory directory holding the role documents
     * @param applicationDirectory application directory used for {@code ${APP_DIR}}
     * @param environment variables available for interpolation
     * @param mapper JSON mapper
     */
    public ConfigStore(
            @Nonnull Path configDirectory,
            @Nonnull Path applicationDirectory,
            @Nonnull Map<String, String> environment,
            @Nonnull ObjectMapper mapper) {
        this.configDirectory = Objects.requireNonNull(configDirectory, "configDirectory");
        this.applicationDirectory = Objects.requireNonNull(applicationDirectory, "applicationDirectory");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Get the path of a role's config document.
     *
     * @param role the role
     * @return config file path
     */
    @Nonnull
    public Path resolve(@Nonnull Role role) {
        return configDirectory.resolve(role.getConfigFileName());
    }

    /**
     * Load and bind a role's configuration.
     *
     * @param role the role
     * @return the configuration
     * @throws ConfigException if the file is missing, malformed or invalid
     */
    @Nonnull
    public RoleConfig load(@Nonnull Role role) throws ConfigException {
        Objects.requireNonNull(role, "role");
        Path path = resolve(role);
        if (!Files.isRegularFile(path)) {
            throw new ConfigException(ConfigException.Reason.MISSING_FILE,
                    "configuration file not found: " + path);
        }

        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigException(ConfigException.Reason.MISSING_FILE,
                    "cannot read configuration file " + path + ": " + e.getMessage(), e);
        }

        RoleConfig config = parse(role, json, path);
        LOGGER.info("Loaded {} configuration from {}", role, path);
        return config;
    }

    /**
     * Bind a configuration document that is already in memory.
     *
     * @param role the role
     * @param json document text
     * @param source where the text came from
     * @return the configuration
     * @throws ConfigException if the document is malformed or invalid
     */
    @Nonnull
    public RoleConfig parse(@Nonnull Role role, @Nonnull String json, @Nonnull Path source) throws ConfigException {
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException(ConfigException.Reason.MALFORMED,
                    "malformed JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ConfigException(ConfigException.Reason.MALFORMED,
                    "expected a JSON object in " + source);
        }

        interpolate(tree);

        RoleConfig config;
        try {
            config = mapper.treeToValue(tree, RoleConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(ConfigException.Reason.INVALID,
                    "invalid field in " + source + ": " + e.getOriginalMessage(), e);
        }
        config.bind(role, applicationDirectory, source);
        return config;
    }

    private void interpolate(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(substitute(field.getValue().asText())));
                } else {
                    interpolate(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (element.isTextual()) {
                    array.set(i, TextNode.valueOf(substitute(element.asText())));
                } else {
                    interpolate(element);
                }
            }
        }
    }

    /**
     * Replace {@code ${NAME}} references in a string.
     *
     * @param value raw value
     * @return interpolated value
     */
    @Nonnull
    String substitute(@Nonnull String value) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement;
            if (APP_DIR_VARIABLE.equals(name)) {
                replacement = applicationDirectory.toString();
            } else {
                replacement = environment.getOrDefault(name, matcher.group(0));
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Nonnull
    public Path getConfigDirectory() {
        return configDirectory;
    }

    @Nonnull
    public Path getApplicationDirectory() {
        return applicationDirectory;
    }
}
