package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of every rule's state after an evaluation.
 *
 * @param states one entry per rule, in rule order
 * @param evaluatedAt time of the evaluation, or of creation before the first one
 * @param version increases with every publication
 */
public record AlertSnapshot(List<AlertState> states, Instant evaluatedAt, long version) {

    public AlertSnapshot {
        states = List.copyOf(states);
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
    }

    @Nonnull
    public Optional<AlertState> state(@Nonnull String rule) {
        return states.stream().filter(s -> s.rule().equals(rule)).findFirst();
    }

    public long countFiring() {
        return states.stream().filter(s -> s.status() == AlertStatus.FIRING).count();
    }
}
