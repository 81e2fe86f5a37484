package io.llmops.platform.runtime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Actions the orchestrator performs on a role.
 */
public enum Action {
    START,
    STOP,
    STATUS;

    /**
     * Resolve an action by name (case-insensitive).
     *
     * @param name action name
     * @return the action, or null if unknown
     */
    @Nullable
    public static Action byName(@Nullable String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Action action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        return null;
    }

    @Nonnull
    public String getActionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return getActionName();
    }
}
