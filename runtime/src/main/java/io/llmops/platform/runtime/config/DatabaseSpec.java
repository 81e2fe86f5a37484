package io.llmops.platform.runtime.config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validated database settings of the database role.
 *
 * @param engine database engine
 * @param dataDirectory directory holding the data files
 * @param name database name, postgres only
 * @param user login, postgres only
 * @param password password, postgres only
 * @param port server port, postgres only
 */
public record DatabaseSpec(
        Engine engine,
        Path dataDirectory,
        @Nullable String name,
        @Nullable String user,
        @Nullable String password,
        int port
) {

    public static final String DEFAULT_DATA_DIR = "database";
    public static final String SQLITE_FILE = "app.db";

    private static final Pattern URL_PASSWORD = Pattern.compile("(://[^:/@]+:)[^@]*@");

    /**
     * Supported engines.
     */
    public enum Engine {
        SQLITE,
        POSTGRES
    }

    public DatabaseSpec {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(dataDirectory, "dataDirectory");
    }

    /**
     * Validate the database fields of a config.
     *
     * <p>{@code data_dir} defaults to {@code database} and relative paths are
     * resolved against the application directory.</p>
     *
     * @param config database role config
     * @return the spec
     * @throws ConfigException if the engine is unknown or postgres credentials are missing
     */
    @Nonnull
    public static DatabaseSpec from(@Nonnull RoleConfig config) throws ConfigException {
        Engine engine;
        switch (config.getDbType().trim().toLowerCase(Locale.ROOT)) {
            case "sqlite":
                engine = Engine.SQLITE;
                break;
            case "postgres":
            case "postgresql":
                engine = Engine.POSTGRES;
                break;
            default:
                throw ConfigException.invalid("db_type",
                        "must be 'sqlite' or 'postgres', got '" + config.getDbType() + "'");
        }

        String dataDir = config.getDataDir() != null && !config.getDataDir().isBlank()
                ? config.getDataDir().trim()
                : DEFAULT_DATA_DIR;
        Path dataDirectory = config.getApplicationDirectory().resolve(dataDir).normalize();

        if (engine == Engine.POSTGRES) {
            require("db_user", config.getDbUser());
            require("db_password", config.getDbPassword());
            require("db_name", config.getDbName());
        }
        return new DatabaseSpec(engine, dataDirectory, config.getDbName(), config.getDbUser(),
                config.getDbPassword(), config.getPort());
    }

    private static void require(String field, @Nullable String value) throws ConfigException {
        if (value == null || value.isBlank()) {
            throw ConfigException.invalid(field, "is required for postgres");
        }
    }

    /**
     * Get the SQLite database file.
     *
     * @return {@code <data-dir>/app.db}
     */
    @Nonnull
    public Path sqliteFile() {
        return dataDirectory.resolve(SQLITE_FILE);
    }

    /**
     * Build the connection URL handed to the application.
     *
     * @return the URL, including the password for postgres
     */
    @Nonnull
    public String connectionUrl() {
        return url(password);
    }

    /**
     * Build the connection URL with the password masked, for logs and status output.
     *
     * @return the redacted URL
     */
    @Nonnull
    public String redactedUrl() {
        return url(password != null ? "****" : null);
    }

    /**
     * Mask the password of any connection URL.
     *
     * @param url a URL, possibly carrying {@code user:password@}
     * @return the URL with the password replaced by {@code ****}
     */
    @Nonnull
    public static String redact(@Nonnull String url) {
        return URL_PASSWORD.matcher(url).replaceFirst("$1****@");
    }

    private String url(@Nullable String secret) {
        if (engine == Engine.SQLITE) {
            return "sqlite:///" + sqliteFile().toAbsolutePath();
        }
        return "postgresql://" + user + ":" + secret + "@localhost:" + port + "/" + name;
    }

    @Override
    public String toString() {
        return "DatabaseSpec{engine=" + engine + ", url=" + redactedUrl() + '}';
    }
}
