package io.llmops.platform.runtime.instance;

/**
 * Thrown when a role's OS handle could not be torn down.
 *
 * <p>A missing or already dead handle is not an error and never raises this.</p>
 */
public class StopException extends Exception {

    public StopException(String message) {
        super(message);
    }

    public StopException(String message, Throwable cause) {
        super(message, cause);
    }
}
