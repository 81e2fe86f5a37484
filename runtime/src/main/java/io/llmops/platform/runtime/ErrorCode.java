package io.llmops.platform.runtime;

import javax.annotation.Nonnull;

/**
 * Classification of invocation-fatal errors, with the process exit code
 * the CLI reports for each.
 */
public enum ErrorCode {
    OK(0, "ok"),
    UNKNOWN_ROLE(2, "unknown-role"),
    UNKNOWN_ACTION(3, "unknown-action"),
    CONFIG_MISSING(4, "config-missing"),
    CONFIG_INVALID(5, "config-invalid"),
    APP_DIR_MISSING(6, "app-dir-missing"),
    START_FAILED(7, "start-failed"),
    STOP_FAILED(8, "stop-failed"),
    STATUS_FAILED(9, "status-failed"),
    USAGE(64, "usage");

    private final int exitCode;
    private final String classification;

    ErrorCode(int exitCode, String classification) {
        this.exitCode = exitCode;
        this.classification = classification;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Get the short name printed in error lines.
     *
     * @return classification, e.g. {@code unknown-role}
     */
    @Nonnull
    public String getClassification() {
        return classification;
    }
}
