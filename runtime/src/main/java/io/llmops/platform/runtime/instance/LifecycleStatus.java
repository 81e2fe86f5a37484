package io.llmops.platform.runtime.instance;

/**
 * Observable lifecycle status of a role instance.
 */
public enum LifecycleStatus {
    /**
     * No OS resource is held for the role.
     */
    STOPPED,

    /**
     * The role's OS resources are being created.
     */
    STARTING,

    /**
     * The role's OS handle is alive.
     */
    RUNNING,

    /**
     * Background loops and the OS handle are being torn down.
     */
    STOPPING,

    /**
     * The role failed to start, or its handle died without a stop.
     */
    FAILED;

    /**
     * Check if the status cannot transition without a new start.
     *
     * @return true for STOPPED and FAILED
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }

    /**
     * Check if the OS handle is expected to be alive.
     *
     * @return true if a process or service should be running
     */
    public boolean isProcessExpected() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }
}
