package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.config.JsonMappers;
import io.llmops.platform.runtime.health.BackendTarget;
import io.llmops.platform.runtime.health.HealthCheckResult;
import io.llmops.platform.runtime.health.PoolSnapshot;
import io.llmops.platform.runtime.health.TargetState;
import io.llmops.platform.runtime.registry.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HandleStoreTest {

    @TempDir
    Path root;

    private HandleStore store;

    @BeforeEach
    void setUp() {
        store = new HandleStore(root.resolve("run"), JsonMappers.create());
    }

    @Test
    void savesAndLoadsRecordWithCompanions() throws IOException {
        HandleRecord record = HandleRecord.process("monitoring", 4242, 1_714_564_800_000L)
                .withCompanions(List.of(HandleRecord.service("monitoring", "grafana-server", 1_714_564_801_000L)))
                .withRegistration(9090, Map.of("collector_config", "/srv/app/prometheus.yml"), 777L);

        store.save(Role.MONITORING, record);

        assertThat(store.recordFile(Role.MONITORING)).hasFileName("monitoring.json");
        assertThat(store.load(Role.MONITORING)).contains(record);
    }

    @Test
    void missingRecordIsEmpty() {
        assertThat(store.load(Role.WEB)).isEmpty();
    }

    @Test
    void unreadableRecordIsTreatedAsAbsent() throws IOException {
        Files.createDirectories(root.resolve("run"));
        Files.writeString(store.recordFile(Role.WEB), "{not json");

        assertThat(store.load(Role.WEB)).isEmpty();
    }

    @Test
    void snapshotRoundTripKeepsPool() throws IOException {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        PoolSnapshot pool = PoolSnapshot.of(List.of(
                BackendTarget.initial("a:8080"),
                new BackendTarget("b:8080", TargetState.UNHEALTHY, 3, 0,
                        HealthCheckResult.failure("b:8080", now, Duration.ofMillis(12), "HTTP 503"))), now, 7);

        store.writeSnapshot(Role.LOADBALANCER, pool);

        assertThat(store.snapshotFile(Role.LOADBALANCER)).hasFileName("loadbalancer-state.json");
        assertThat(store.readSnapshot(Role.LOADBALANCER, PoolSnapshot.class)).contains(pool);
    }

    @Test
    void writesLeaveNoTemporaryFiles() throws IOException {
        store.save(Role.WEB, HandleRecord.process("web", 1, 0));
        store.save(Role.WEB, HandleRecord.process("web", 2, 0));

        try (var files = Files.list(root.resolve("run"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("web.json");
        }
        assertThat(store.load(Role.WEB).orElseThrow().pid()).isEqualTo(2L);
    }

    @Test
    void deleteRemovesRecordAndSnapshot() throws IOException {
        store.save(Role.LOADBALANCER, HandleRecord.service("loadbalancer", "nginx", 0));
        store.writeSnapshot(Role.LOADBALANCER, Map.of("version", 1));

        store.delete(Role.LOADBALANCER);
        store.deleteSnapshot(Role.LOADBALANCER);

        assertThat(store.recordFile(Role.LOADBALANCER)).doesNotExist();
        assertThat(store.snapshotFile(Role.LOADBALANCER)).doesNotExist();
    }
}
