package io.llmops.platform.runtime.config;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Raised when a role configuration cannot be loaded or is not acceptable.
 */
public class ConfigException extends Exception {

    /**
     * Why the configuration was rejected.
     */
    public enum Reason {
        /**
         * The config file does not exist.
         */
        MISSING_FILE,

        /**
         * The document is not parseable JSON.
         */
        MALFORMED,

        /**
         * A field is missing, has the wrong type or an unacceptable value.
         */
        INVALID
    }

    private final Reason reason;

    public ConfigException(@Nonnull Reason reason, @Nonnull String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ConfigException(@Nonnull Reason reason, @Nonnull String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Shortcut for an {@link Reason#INVALID} field.
     *
     * @param field offending field
     * @param problem what is wrong with it
     * @return the exception
     */
    @Nonnull
    public static ConfigException invalid(@Nonnull String field, @Nonnull String problem) {
        return new ConfigException(Reason.INVALID, field + ": " + problem);
    }

    @Nonnull
    public Reason getReason() {
        return reason;
    }
}
