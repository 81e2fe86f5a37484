package io.llmops.platform.runtime.event;

import io.llmops.platform.runtime.health.HealthCheckResult;
import io.llmops.platform.runtime.health.TargetState;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event fired when a backend target changes pool membership.
 */
public class TargetHealthEvent {

    private final String address;
    private final TargetState previousState;
    private final TargetState newState;
    private final HealthCheckResult result;

    /**
     * Create a target health event.
     *
     * @param address target address
     * @param previousState previous membership
     * @param newState new membership
     * @param result the probe that caused the transition
     */
    public TargetHealthEvent(
            @Nonnull String address,
            @Nonnull TargetState previousState,
            @Nonnull TargetState newState,
            @Nonnull HealthCheckResult result) {
        this.address = Objects.requireNonNull(address, "address");
        this.previousState = Objects.requireNonNull(previousState, "previousState");
        this.newState = Objects.requireNonNull(newState, "newState");
        this.result = Objects.requireNonNull(result, "result");
    }

    @Nonnull
    public String getAddress() {
        return address;
    }

    @Nonnull
    public TargetState getPreviousState() {
        return previousState;
    }

    @Nonnull
    public TargetState getNewState() {
        return newState;
    }

    /**
     * Get the probe that caused the transition.
     *
     * @return the probe result
     */
    @Nonnull
    public HealthCheckResult getResult() {
        return result;
    }

    /**
     * Check if the target was ejected from the pool.
     *
     * @return true if now unhealthy
     */
    public boolean becameUnhealthy() {
        return newState == TargetState.UNHEALTHY;
    }

    /**
     * Check if the target rejoined the pool.
     *
     * @return true if recovered from unhealthy
     */
    public boolean recovered() {
        return previousState == TargetState.UNHEALTHY && newState == TargetState.HEALTHY;
    }

    @Override
    public String toString() {
        return "TargetHealthEvent{" + address + ": " + previousState + " -> " + newState + '}';
    }
}
