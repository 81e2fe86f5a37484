package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Published evaluation state of one rule.
 *
 * @param rule rule name
 * @param status current status
 * @param conditionSince when the condition became continuously true, null when it does not hold
 * @param lastValue last observed value; a ratio for percentage rules
 * @param lastTransition when the status last changed, null if it never did
 */
public record AlertState(
        String rule,
        AlertStatus status,
        @Nullable Instant conditionSince,
        double lastValue,
        @Nullable Instant lastTransition
) {

    public AlertState {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(status, "status");
    }

    @Nonnull
    public static AlertState initial(@Nonnull String rule) {
        return new AlertState(rule, AlertStatus.OK, null, Double.NaN, null);
    }
}
