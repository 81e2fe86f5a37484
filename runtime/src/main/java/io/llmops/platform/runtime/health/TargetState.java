package io.llmops.platform.runtime.health;

/**
 * Pool membership of a backend target.
 */
public enum TargetState {
    /**
     * Receives traffic.
     */
    HEALTHY,

    /**
     * Ejected after the configured number of consecutive failed probes.
     */
    UNHEALTHY
}
