package io.llmops.platform.runtime.process;

import io.llmops.platform.runtime.config.JsonMappers;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.instance.StopException;
import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.support.FakeLauncher;
import io.llmops.platform.runtime.support.FakeProcess;
import io.llmops.platform.runtime.support.FakeServiceController;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessSupervisorTest {

    @TempDir
    Path root;

    private FakeLauncher launcher;
    private FakeServiceController services;
    private HandleStore store;
    private ProcessSupervisor supervisor;

    @BeforeEach
    void setUp() {
        launcher = new FakeLauncher();
        services = new FakeServiceController();
        store = new HandleStore(root.resolve("run"), JsonMappers.create());
        supervisor = new ProcessSupervisor(store, launcher, services, root.resolve("logs"));
    }

    private ProcessOsHandle spawnWeb() throws StartException {
        return supervisor.spawn(Role.WEB, List.of("/usr/bin/gunicorn", "app:app"), root, Map.of("A", "1"));
    }

    @Test
    void spawnSendsOutputToRoleLog() throws StartException {
        ProcessOsHandle handle = spawnWeb();

        assertThat(launcher.lastRequest().logFile()).isEqualTo(root.resolve("logs/web.log"));
        assertThat(launcher.lastRequest().environment()).containsEntry("A", "1");
        assertThat(handle.isAlive()).isTrue();
        assertThat(supervisor.getRecentLogs(Role.WEB, 5)).singleElement().asString().startsWith("started");
    }

    @Test
    void launchFailureIsAResourceFailure() {
        launcher.failWith(new IOException("No such file"));

        assertThatThrownBy(this::spawnWeb)
                .isInstanceOf(StartException.class)
                .satisfies(e -> assertThat(((StartException) e).getReason()).isEqualTo(StartException.Reason.RESOURCE_FAILURE));
    }

    @Test
    void statusFollowsTheOsHandle() throws StartException {
        assertThat(supervisor.status(Role.WEB)).isEqualTo(LifecycleStatus.STOPPED);

        ProcessOsHandle handle = spawnWeb();
        supervisor.register(Role.WEB, handle, 8080, Map.of(), null);
        assertThat(supervisor.status(Role.WEB)).isEqualTo(LifecycleStatus.RUNNING);

        launcher.lastProcess().exit(1);
        assertThat(supervisor.status(Role.WEB)).isEqualTo(LifecycleStatus.FAILED);
    }

    @Test
    void registerPersistsRecord() throws StartException {
        ProcessOsHandle handle = spawnWeb();

        supervisor.register(Role.WEB, handle, 8080, Map.of("app_module", "app:app"), 99L);

        HandleRecord record = store.load(Role.WEB).orElseThrow();
        assertThat(record.kind()).isEqualTo(HandleRecord.Kind.PROCESS);
        assertThat(record.port()).isEqualTo(8080);
        assertThat(record.ownerPid()).isEqualTo(99L);
        assertThat(record.details()).containsEntry("app_module", "app:app");
    }

    @Test
    void ensureNotRunningRejectsLiveHandle() throws StartException {
        supervisor.register(Role.WEB, spawnWeb(), 8080, Map.of(), null);

        assertThatThrownBy(() -> supervisor.ensureNotRunning(Role.WEB))
                .isInstanceOf(StartException.class)
                .satisfies(e -> assertThat(((StartException) e).getReason()).isEqualTo(StartException.Reason.ALREADY_RUNNING));
    }

    @Test
    void ensureNotRunningClearsStaleRecord() throws Exception {
        store.save(Role.WEB, HandleRecord.process("web", Long.MAX_VALUE - 1, 0));

        supervisor.ensureNotRunning(Role.WEB);

        assertThat(store.recordFile(Role.WEB)).doesNotExist();
    }

    @Test
    void stopTerminatesAndForgets() throws Exception {
        supervisor.register(Role.WEB, spawnWeb(), 8080, Map.of(), null);

        assertThat(supervisor.stop(Role.WEB, Duration.ofSeconds(1))).isTrue();

        assertThat(launcher.lastProcess().isAlive()).isFalse();
        assertThat(store.recordFile(Role.WEB)).doesNotExist();
        assertThat(supervisor.status(Role.WEB)).isEqualTo(LifecycleStatus.STOPPED);
    }

    @Test
    void stopEscalatesToForcedKill() throws Exception {
        FakeProcess stubborn = new FakeProcess(true);
        ProcessOsHandle handle = ProcessOsHandle.launched(Role.WEB, stubborn, root.resolve("logs/web.log"));
        supervisor.register(Role.WEB, handle, 8080, Map.of(), null);

        supervisor.stop(Role.WEB, Duration.ofMillis(50));

        assertThat(stubborn.exitValue()).isEqualTo(137);
    }

    @Test
    void stoppingRoleWithoutHandleReportsNothingStopped() throws StopException {
        assertThat(supervisor.stop(Role.API, Duration.ofSeconds(1))).isFalse();
        assertThat(supervisor.stop(Role.API, Duration.ofSeconds(1))).isFalse();
    }

    @Test
    void serviceAlreadyActiveIsNotStartedHere() throws StartException {
        services.setActive("postgresql", true);

        ServiceOsHandle handle = supervisor.startService(Role.DATABASE, "postgresql", false);

        assertThat(handle.isStartedHere()).isFalse();
        assertThat(services.getCalls()).isEmpty();
    }

    @Test
    void restartAlwaysRestarts() throws StartException {
        services.setActive("nginx", true);

        ServiceOsHandle handle = supervisor.startService(Role.LOADBALANCER, "nginx", true);

        assertThat(handle.isStartedHere()).isTrue();
        assertThat(services.getCalls()).containsExactly("restart nginx");
    }

    @Test
    void serviceFailureIsAResourceFailure() {
        services.failOn("nginx");

        assertThatThrownBy(() -> supervisor.startService(Role.LOADBALANCER, "nginx", true))
                .isInstanceOf(StartException.class)
                .hasMessageContaining("nginx");
    }

    @Test
    void markerHandleLivesWithItsFile() throws Exception {
        Path marker = root.resolve("run/database.active");

        MarkerOsHandle handle = supervisor.activateMarker(Role.DATABASE, marker);
        supervisor.register(Role.DATABASE, handle, 0, Map.of(), null);

        assertThat(Files.exists(marker)).isTrue();
        assertThat(supervisor.status(Role.DATABASE)).isEqualTo(LifecycleStatus.RUNNING);

        supervisor.stop(Role.DATABASE, Duration.ZERO);
        assertThat(Files.exists(marker)).isFalse();
    }

    @Test
    void reattachesCompositeFromRecord() throws Exception {
        services.setActive("grafana-server", true);
        MarkerOsHandle primary = new MarkerOsHandle(Role.MONITORING, root.resolve("run/m.active"), Instant.now());
        primary.activate();
        ServiceOsHandle grafana = new ServiceOsHandle(Role.MONITORING, "grafana-server", services, Instant.now(), true);
        store.save(Role.MONITORING, new CompositeOsHandle(primary, List.of(grafana)).toRecord());

        ProcessSupervisor fresh = new ProcessSupervisor(store, launcher, services, root.resolve("logs"));
        OsHandle handle = fresh.find(Role.MONITORING).orElseThrow();

        assertThat(handle).isInstanceOf(CompositeOsHandle.class);
        assertThat(handle.describe()).contains("service grafana-server");
        fresh.stop(Role.MONITORING, Duration.ofSeconds(1));
        assertThat(services.getCalls()).containsExactly("stop grafana-server");
        assertThat(primary.isAlive()).isFalse();
    }

    @Test
    void stopOwnerIgnoresOwnPid() throws StopException {
        HandleRecord record = HandleRecord.service("loadbalancer", "nginx", 0)
                .withRegistration(80, Map.of(), ProcessHandle.current().pid());

        assertThat(supervisor.stopOwner(record, Duration.ofSeconds(1))).isFalse();
    }
}
