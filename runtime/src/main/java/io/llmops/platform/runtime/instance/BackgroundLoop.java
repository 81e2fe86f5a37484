package io.llmops.platform.runtime.instance;

import javax.annotation.Nonnull;

/**
 * Handle to a periodic loop owned by a role instance.
 *
 * <p>The loop is returned to whoever started it; nothing else holds a
 * reference to it.</p>
 */
public interface BackgroundLoop {

    /**
     * Get a short name for logs.
     *
     * @return loop name
     */
    @Nonnull
    String getName();

    /**
     * Schedule the loop. Calling this on a running loop has no effect.
     */
    void start();

    /**
     * Stop scheduling and wait for the tick in progress, if any, to finish.
     */
    void stop();

    /**
     * Check if the loop is scheduled.
     *
     * @return true between {@link #start()} and {@link #stop()}
     */
    boolean isRunning();
}
