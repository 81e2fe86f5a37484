package io.llmops.platform.runtime.process;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Controls system service units such as the reverse proxy or the database
 * engine.
 */
public interface ServiceController {

    /**
     * Check if a unit is active.
     *
     * @param unit unit name
     * @return true if active
     * @throws IOException if the service manager could not be queried
     */
    boolean isActive(@Nonnull String unit) throws IOException;

    void start(@Nonnull String unit) throws IOException;

    void stop(@Nonnull String unit) throws IOException;

    void restart(@Nonnull String unit) throws IOException;

    /**
     * Ask a unit to re-read its configuration without dropping connections.
     *
     * @param unit unit name
     * @throws IOException if the reload failed
     */
    void reload(@Nonnull String unit) throws IOException;
}
