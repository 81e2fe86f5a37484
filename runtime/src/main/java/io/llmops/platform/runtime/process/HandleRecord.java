package io.llmops.platform.runtime.process;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted description of a role's OS handle.
 *
 * <p>Written to {@code <app-dir>/run/<role>.json} so that a later invocation
 * can re-derive the handle and stop or inspect it.</p>
 *
 * @param role role name
 * @param kind handle kind
 * @param pid process id for {@link Kind#PROCESS}
 * @param unit service unit for {@link Kind#SERVICE}
 * @param marker marker file path for {@link Kind#MARKER}
 * @param startedAtMillis creation time of the handle
 * @param ownerPid pid of the runtime hosting the role's background loop, if any
 * @param port port the role is bound to
 * @param details instance details
 * @param companions secondary handles stopped together with this one
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record HandleRecord(
        @JsonProperty("role") String role,
        @JsonProperty("kind") Kind kind,
        @JsonProperty("pid") @Nullable Long pid,
        @JsonProperty("unit") @Nullable String unit,
        @JsonProperty("marker") @Nullable String marker,
        @JsonProperty("started_at") long startedAtMillis,
        @JsonProperty("owner_pid") @Nullable Long ownerPid,
        @JsonProperty("port") int port,
        @JsonProperty("details") Map<String, String> details,
        @JsonProperty("companions") List<HandleRecord> companions
) {

    /**
     * Kind of OS resource a handle points to.
     */
    public enum Kind {
        PROCESS,
        SERVICE,
        MARKER
    }

    public HandleRecord {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(kind, "kind");
        details = details == null ? Map.of() : Map.copyOf(details);
        companions = companions == null ? List.of() : List.copyOf(companions);
    }

    @Nonnull
    public static HandleRecord process(@Nonnull String role, long pid, long startedAtMillis) {
        return new HandleRecord(role, Kind.PROCESS, pid, null, null, startedAtMillis, null, 0, null, null);
    }

    @Nonnull
    public static HandleRecord service(@Nonnull String role, @Nonnull String unit, long startedAtMillis) {
        return new HandleRecord(role, Kind.SERVICE, null, unit, null, startedAtMillis, null, 0, null, null);
    }

    @Nonnull
    public static HandleRecord marker(@Nonnull String role, @Nonnull String marker, long startedAtMillis) {
        return new HandleRecord(role, Kind.MARKER, null, null, marker, startedAtMillis, null, 0, null, null);
    }

    @Nonnull
    public HandleRecord withCompanions(@Nonnull List<HandleRecord> companions) {
        return new HandleRecord(role, kind, pid, unit, marker, startedAtMillis, ownerPid, port, details, companions);
    }

    @Nonnull
    public HandleRecord withRegistration(int port, @Nonnull Map<String, String> details, @Nullable Long ownerPid) {
        return new HandleRecord(role, kind, pid, unit, marker, startedAtMillis, ownerPid, port, details, companions);
    }
}
