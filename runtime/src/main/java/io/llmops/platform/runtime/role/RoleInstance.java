package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.alert.AlertEvaluator;
import io.llmops.platform.runtime.health.HealthChecker;
import io.llmops.platform.runtime.instance.BackgroundLoop;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A started role: its server instance plus the background loops it owns.
 */
public class RoleInstance {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoleInstance.class);

    private final ServerInstance server;
    private final Duration shutdownTimeout;
    private final List<BackgroundLoop> loops = new CopyOnWriteArrayList<>();

    /**
     * Create a role instance.
     *
     * @param server the server instance
     * @param shutdownTimeout graceful shutdown timeout
     */
    public RoleInstance(@Nonnull ServerInstance server, @Nonnull Duration shutdownTimeout) {
        this.server = Objects.requireNonNull(server, "server");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Attach a loop started for this instance.
     *
     * @param loop the loop
     */
    public void addLoop(@Nonnull BackgroundLoop loop) {
        loops.add(Objects.requireNonNull(loop, "loop"));
    }

    /**
     * Stop every loop, most recently added first, waiting for each one's
     * current tick.
     */
    public void stopLoops() {
        List<BackgroundLoop> reversed = new ArrayList<>(loops);
        Collections.reverse(reversed);
        for (BackgroundLoop loop : reversed) {
            LOGGER.info("Stopping {} of role '{}'", loop.getName(), getRole());
            loop.stop();
        }
        loops.clear();
    }

    @Nonnull
    public List<BackgroundLoop> getLoops() {
        return Collections.unmodifiableList(loops);
    }

    @Nonnull
    public Optional<HealthChecker> getHealthChecker() {
        return findLoop(HealthChecker.class);
    }

    @Nonnull
    public Optional<AlertEvaluator> getAlertEvaluator() {
        return findLoop(AlertEvaluator.class);
    }

    private <T> Optional<T> findLoop(Class<T> type) {
        return loops.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    @Nonnull
    public Role getRole() {
        return server.getRole();
    }

    @Nonnull
    public ServerInstance getServer() {
        return server;
    }

    @Nonnull
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "RoleInstance{" + server + ", loops=" + loops.size() + '}';
    }
}
