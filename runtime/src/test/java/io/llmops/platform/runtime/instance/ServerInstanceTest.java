package io.llmops.platform.runtime.instance;

import io.llmops.platform.runtime.registry.Role;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ServerInstanceTest {

    private final ServerInstance server = new ServerInstance(Role.API, Path.of("/srv/app"), 8000);

    @Test
    void startsStopped() {
        assertThat(server.getStatus()).isEqualTo(LifecycleStatus.STOPPED);
        assertThat(server.getUptimeMillis()).isZero();
        assertThat(server.isHealthy()).isFalse();
    }

    @Test
    void tracksLifecycle() {
        server.markStarting();
        assertThat(server.getStartedAt()).isNotNull();

        server.markRunning();
        assertThat(server.getStatus()).isEqualTo(LifecycleStatus.RUNNING);

        server.markStopping("stop requested");
        server.markStopped();
        assertThat(server.getStatus()).isEqualTo(LifecycleStatus.STOPPED);
        assertThat(server.getStopReason()).isEqualTo("stop requested");
        assertThat(server.getStoppedAt()).isNotNull();
    }

    @Test
    void runningSinceKeepsOriginalStart() {
        Instant startedAt = Instant.now().minusSeconds(60);

        server.markRunningSince(startedAt);

        assertThat(server.getUptimeMillis()).isGreaterThanOrEqualTo(60_000);
    }

    @Test
    void nullDetailRemovesKey() {
        server.setDetail("MODEL_PATH", "/srv/app/model");
        server.setDetail("MODEL_PATH", null);

        assertThat(server.getDetails()).doesNotContainKey("MODEL_PATH");
        assertThat(server.getDetail("MODEL_PATH")).isNull();
    }
}
