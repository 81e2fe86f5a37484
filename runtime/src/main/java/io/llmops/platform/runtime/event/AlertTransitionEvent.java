package io.llmops.platform.runtime.event;

import io.llmops.platform.runtime.alert.AlertRule;
import io.llmops.platform.runtime.alert.AlertState;
import io.llmops.platform.runtime.alert.AlertStatus;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Event fired when an alert rule changes status.
 */
public class AlertTransitionEvent {

    private final AlertRule rule;
    private final AlertStatus previousStatus;
    private final AlertState state;

    /**
     * Create an alert transition event.
     *
     * @param rule the rule
     * @param previousStatus status before the transition
     * @param state state after the transition
     */
    public AlertTransitionEvent(@Nonnull AlertRule rule, @Nonnull AlertStatus previousStatus, @Nonnull AlertState state) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.previousStatus = Objects.requireNonNull(previousStatus, "previousStatus");
        this.state = Objects.requireNonNull(state, "state");
    }

    @Nonnull
    public AlertRule getRule() {
        return rule;
    }

    @Nonnull
    public AlertStatus getPreviousStatus() {
        return previousStatus;
    }

    @Nonnull
    public AlertStatus getNewStatus() {
        return state.status();
    }

    @Nonnull
    public AlertState getState() {
        return state;
    }

    /**
     * Check if the rule started firing.
     *
     * @return true if now firing
     */
    public boolean fired() {
        return state.status() == AlertStatus.FIRING;
    }

    /**
     * Check if this is the one-time resolution notice.
     *
     * @return true if the rule was resolved
     */
    public boolean resolved() {
        return state.status() == AlertStatus.RESOLVED;
    }

    @Override
    public String toString() {
        return "AlertTransitionEvent{" + rule.name() + ": " + previousStatus + " -> " + state.status() + '}';
    }
}
