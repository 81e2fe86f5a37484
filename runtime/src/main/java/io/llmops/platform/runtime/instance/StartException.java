package io.llmops.platform.runtime.instance;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Thrown when a role cannot be started.
 *
 * <p>By the time this propagates out of a role's {@code start}, every OS
 * resource created by that attempt has been released.</p>
 */
public class StartException extends Exception {

    /**
     * Why the start failed.
     */
    public enum Reason {
        ALREADY_RUNNING,
        PORT_IN_USE,
        DEPENDENCY_UNRESOLVED,
        RESOURCE_FAILURE,
        STARTUP_FAILED
    }

    private final Reason reason;

    public StartException(@Nonnull Reason reason, @Nonnull String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public StartException(@Nonnull Reason reason, @Nonnull String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Nonnull
    public Reason getReason() {
        return reason;
    }
}
