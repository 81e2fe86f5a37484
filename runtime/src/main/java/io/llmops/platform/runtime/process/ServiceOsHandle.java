package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Handle to a system service unit started for a role.
 */
public class ServiceOsHandle implements OsHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceOsHandle.class);

    private final Role role;
    private final String unit;
    private final ServiceController controller;
    private final Instant startedAt;
    private final boolean startedHere;

    /**
     * Create a service handle.
     *
     * @param role owning role
     * @param unit service unit
     * @param controller service controller
     * @param startedAt when the handle was created
     * @param startedHere false if the unit was already active before this runtime touched it
     */
    public ServiceOsHandle(
            @Nonnull Role role,
            @Nonnull String unit,
            @Nonnull ServiceController controller,
            @Nonnull Instant startedAt,
            boolean startedHere) {
        this.role = Objects.requireNonNull(role, "role");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.startedHere = startedHere;
    }

    @Nonnull
    @Override
    public String describe() {
        return "service " + unit;
    }

    @Override
    public boolean isAlive() {
        try {
            return controller.isActive(unit);
        } catch (IOException e) {
            LOGGER.warn("Cannot query service '{}': {}", unit, e.getMessage());
            return false;
        }
    }

    @Override
    public void terminate(@Nonnull Duration timeout) throws IOException {
        if (!isAlive()) {
            return;
        }
        controller.stop(unit);
    }

    @Nonnull
    @Override
    public HandleRecord toRecord() {
        return HandleRecord.service(role.getRoleName(), unit, startedAt.toEpochMilli());
    }

    @Nonnull
    public String getUnit() {
        return unit;
    }

    /**
     * Check if this runtime started or restarted the unit.
     *
     * @return false if the unit was found already active
     */
    public boolean isStartedHere() {
        return startedHere;
    }

    @Override
    public String toString() {
        return "ServiceOsHandle{role=" + role + ", unit='" + unit + "'}";
    }
}
