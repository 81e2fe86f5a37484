package io.llmops.platform.runtime.process;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;

/**
 * The OS-level resource backing a role: a process, a service unit or an
 * activation marker.
 */
public interface OsHandle {

    /**
     * Describe the handle for logs and status output.
     *
     * @return e.g. {@code pid 4242} or {@code service nginx}
     */
    @Nonnull
    String describe();

    /**
     * Query the OS for liveness. Never cached.
     *
     * @return true if the resource is alive
     */
    boolean isAlive();

    /**
     * Release the resource. Terminating a dead handle is a no-op.
     *
     * @param timeout how long to wait for a graceful exit before forcing
     * @throws IOException if the resource could not be released
     */
    void terminate(@Nonnull Duration timeout) throws IOException;

    /**
     * Build the persisted description of this handle.
     *
     * @return the record, without registration data
     */
    @Nonnull
    HandleRecord toRecord();
}
