package io.llmops.platform.runtime.process;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A primary handle plus companion handles started alongside it, e.g. the
 * metrics collector and its dashboard service.
 *
 * <p>Liveness follows the primary handle. Companions are terminated first,
 * in reverse start order.</p>
 */
public class CompositeOsHandle implements OsHandle {

    private final OsHandle primary;
    private final List<OsHandle> companions;

    public CompositeOsHandle(@Nonnull OsHandle primary, @Nonnull List<OsHandle> companions) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.companions = List.copyOf(companions);
    }

    @Nonnull
    @Override
    public String describe() {
        StringBuilder builder = new StringBuilder(primary.describe());
        for (OsHandle companion : companions) {
            builder.append(" + ").append(companion.describe());
        }
        return builder.toString();
    }

    @Override
    public boolean isAlive() {
        return primary.isAlive();
    }

    @Override
    public void terminate(@Nonnull Duration timeout) throws IOException {
        IOException failure = null;
        List<OsHandle> reversed = new ArrayList<>(companions);
        Collections.reverse(reversed);
        for (OsHandle companion : reversed) {
            try {
                companion.terminate(timeout);
            } catch (IOException e) {
                failure = e;
            }
        }
        primary.terminate(timeout);
        if (failure != null) {
            throw failure;
        }
    }

    @Nonnull
    @Override
    public HandleRecord toRecord() {
        List<HandleRecord> records = new ArrayList<>(companions.size());
        for (OsHandle companion : companions) {
            records.add(companion.toRecord());
        }
        return primary.toRecord().withCompanions(records);
    }

    @Nonnull
    public OsHandle getPrimary() {
        return primary;
    }

    @Nonnull
    public List<OsHandle> getCompanions() {
        return companions;
    }
}
