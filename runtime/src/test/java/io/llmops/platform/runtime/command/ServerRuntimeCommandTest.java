package io.llmops.platform.runtime.command;

import io.llmops.platform.runtime.Orchestrator;
import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.support.RuntimeFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.llmops.platform.runtime.support.RuntimeFixture.loadBalancerConfig;
import static org.assertj.core.api.Assertions.assertThat;

class ServerRuntimeCommandTest {

    @TempDir
    Path root;

    private RuntimeFixture fixture;
    private final List<Orchestrator> created = new ArrayList<>();
    private final List<Boolean> attachFlags = new ArrayList<>();
    private final List<Path> configDirectories = new ArrayList<>();

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new RuntimeFixture(root);
    }

    @AfterEach
    void tearDown() {
        created.forEach(Orchestrator::shutdown);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        ServerRuntimeCommand command = new ServerRuntimeCommand((configDirectory, applicationDirectory, attached) -> {
            configDirectories.add(configDirectory);
            attachFlags.add(attached);
            Orchestrator orchestrator = fixture.orchestrator(attached);
            created.add(orchestrator);
            return orchestrator;
        });
        return new CommandLine(command)
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }

    private String[] withDirs(String... args) {
        List<String> all = new ArrayList<>(List.of(
                "-c", fixture.getConfigDir().toString(),
                "-a", fixture.getAppDir().toString()));
        all.addAll(List.of(args));
        return all.toArray(new String[0]);
    }

    @Test
    void startsRoleAndPrintsStatusLine() throws IOException {
        fixture.writeConfig(Role.DATABASE, "{\"server_type\": \"database\"}");

        int exitCode = run(withDirs("database"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("database RUNNING port=5432 handle=[marker ");
        assertThat(err.toString()).isEmpty();
        assertThat(configDirectories).containsExactly(fixture.getConfigDir());
    }

    @Test
    void reportsStatusOfEarlierStart() throws IOException {
        fixture.writeConfig(Role.DATABASE, "{\"server_type\": \"database\"}");
        run(withDirs("database"));

        int exitCode = run(withDirs("-A", "status", "database"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("database RUNNING");
    }

    @Test
    void stopsRole() throws IOException {
        fixture.writeConfig(Role.DATABASE, "{\"server_type\": \"database\"}");
        run(withDirs("database"));

        assertThat(run(withDirs("--action", "stop", "database"))).isZero();
        assertThat(out.toString()).startsWith("database STOPPED");
        assertThat(fixture.runFile("database.active")).doesNotExist();
    }

    @Test
    void unknownRoleExitsWithTwo() {
        int exitCode = run(withDirs("cache"));

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("error: unknown-role role=cache action=start: ");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownActionExitsWithThree() {
        assertThat(run(withDirs("-A", "restart", "web"))).isEqualTo(3);
    }

    @Test
    void missingConfigExitsWithFour() {
        assertThat(run(withDirs("api"))).isEqualTo(4);
        assertThat(err.toString()).contains("error: config-missing role=api action=start:");
    }

    @Test
    void invalidConfigExitsWithFive() throws IOException {
        fixture.writeConfig(Role.WEB, "{\"server_type\": \"web\", \"port\": 70000}");

        assertThat(run(withDirs("web"))).isEqualTo(5);
    }

    @Test
    void failedStartExitsWithSeven() throws IOException {
        fixture.writeConfig(Role.WEB, "{\"server_type\": \"web\"}");
        fixture.getLauncher().crashWith(1, "Traceback (most recent call last):\n");

        assertThat(run(withDirs("web"))).isEqualTo(7);
        assertThat(err.toString()).contains("error: start-failed role=web action=start:", "exited with code 1");
    }

    @Test
    void missingRoleIsUsageError() {
        assertThat(run()).isEqualTo(64);
        assertThat(err.toString()).contains("ROLE");
        assertThat(created).isEmpty();
    }

    @Test
    void detachedLoadBalancerReturnsAfterStart() throws IOException {
        fixture.writeConfig(Role.LOADBALANCER, loadBalancerConfig(80, "5s", "1s", "127.0.0.1:8080"));

        int exitCode = run(withDirs("--no-attach", "loadbalancer"));

        assertThat(exitCode).isZero();
        assertThat(attachFlags).containsExactly(false);
        assertThat(out.toString()).contains("loadbalancer RUNNING", "eligible=[127.0.0.1:8080]");
    }

    @Test
    void printsVersion() {
        assertThat(run("--version")).isZero();
        assertThat(out.toString()).contains("server-runtime 1.0.0");
    }
}
