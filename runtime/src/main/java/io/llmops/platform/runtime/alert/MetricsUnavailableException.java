package io.llmops.platform.runtime.alert;

/**
 * Thrown when a metrics source cannot be reached. Rules evaluated against an
 * unavailable source keep their state.
 */
public class MetricsUnavailableException extends Exception {

    public MetricsUnavailableException(String message) {
        super(message);
    }

    public MetricsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
