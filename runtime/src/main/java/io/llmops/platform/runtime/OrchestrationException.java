package io.llmops.platform.runtime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An invocation-fatal error, classified by {@link ErrorCode} and tagged
 * with the role and action it occurred in.
 */
public class OrchestrationException extends Exception {

    private final ErrorCode code;
    private final String role;
    private final String action;

    public OrchestrationException(
            @Nonnull ErrorCode code,
            @Nullable String role,
            @Nullable String action,
            @Nonnull String message) {
        this(code, role, action, message, null);
    }

    public OrchestrationException(
            @Nonnull ErrorCode code,
            @Nullable String role,
            @Nullable String action,
            @Nonnull String message,
            @Nullable Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.role = role;
        this.action = action;
    }

    @Nonnull
    public ErrorCode getCode() {
        return code;
    }

    @Nullable
    public String getRole() {
        return role;
    }

    @Nullable
    public String getAction() {
        return action;
    }

    /**
     * Format the single line the CLI prints for this error.
     *
     * @return {@code error: <classification> role=<role> action=<action>: <message>}
     */
    @Nonnull
    public String toErrorLine() {
        return "error: " + code.getClassification()
                + " role=" + (role != null ? role : "-")
                + " action=" + (action != null ? action : "-")
                + ": " + getMessage();
    }
}
