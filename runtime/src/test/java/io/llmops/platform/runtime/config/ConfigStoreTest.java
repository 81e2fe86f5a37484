package io.llmops.platform.runtime.config;

import io.llmops.platform.runtime.registry.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigStoreTest {

    @TempDir
    Path root;

    private Path configDir;
    private Path appDir;
    private ConfigStore store;

    @BeforeEach
    void setUp() throws IOException {
        configDir = Files.createDirectories(root.resolve("configs"));
        appDir = Files.createDirectories(root.resolve("app"));
        store = new ConfigStore(configDir, appDir, Map.of("DB_PASSWORD", "s3cret"), JsonMappers.create());
    }

    private void write(Role role, String json) throws IOException {
        Files.writeString(configDir.resolve(role.getConfigFileName()), json);
    }

    @Test
    void missingFileIsReportedAsMissing() {
        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getReason()).isEqualTo(ConfigException.Reason.MISSING_FILE))
                .hasMessageContaining("web_server.json");
    }

    @Test
    void malformedJsonIsReportedAsMalformed() throws IOException {
        write(Role.WEB, "{\"port\": 80,");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getReason()).isEqualTo(ConfigException.Reason.MALFORMED));
    }

    @Test
    void appliesDefaults() throws Exception {
        write(Role.API, "{\"server_type\": \"api\"}");

        RoleConfig config = store.load(Role.API);

        assertThat(config.getRole()).isEqualTo(Role.API);
        assertThat(config.getPort()).isEqualTo(8000);
        assertThat(config.getStartupTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getEnvironment()).isEmpty();
        assertThat(config.getDependencies()).isEmpty();
        assertThat(config.getWorkers(2)).isEqualTo(2);
        assertThat(config.getApplicationDirectory()).isEqualTo(appDir);
    }

    @Test
    void interpolatesAppDirAndEnvironment() throws Exception {
        write(Role.DATABASE, "{\n"
                + "  \"db_type\": \"postgres\",\n"
                + "  \"db_password\": \"${DB_PASSWORD}\",\n"
                + "  \"data_dir\": \"${APP_DIR}/db\",\n"
                + "  \"environment\": {\"HOME_DIR\": \"${APP_DIR}\", \"KEEP\": \"${NOT_SET}\"}\n"
                + "}");

        RoleConfig config = store.load(Role.DATABASE);

        assertThat(config.getDbPassword()).isEqualTo("s3cret");
        assertThat(config.getDataDir()).isEqualTo(appDir + "/db");
        assertThat(config.getEnvironment())
                .containsEntry("HOME_DIR", appDir.toString())
                .containsEntry("KEEP", "${NOT_SET}");
    }

    @Test
    void rejectsServerTypeOfAnotherRole() throws IOException {
        write(Role.WEB, "{\"server_type\": \"api\"}");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("server_type:");
    }

    @Test
    void rejectsPortOutOfRange() throws IOException {
        write(Role.WEB, "{\"port\": 70000}");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getReason()).isEqualTo(ConfigException.Reason.INVALID))
                .hasMessageStartingWith("port:");
    }

    @Test
    void rejectsNullEnvironmentValue() throws IOException {
        write(Role.WEB, "{\"environment\": {\"KEEP\": \"1\", \"X\": null}}");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getReason()).isEqualTo(ConfigException.Reason.INVALID))
                .hasMessageStartingWith("environment.X:");
    }

    @Test
    void rejectsWrongFieldType() throws IOException {
        write(Role.WEB, "{\"port\": \"eighty\"}");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getReason()).isEqualTo(ConfigException.Reason.INVALID));
    }

    @Test
    void parsesTimeouts() throws Exception {
        write(Role.WEB, "{\"startup_timeout\": \"45s\", \"shutdown_timeout\": \"1m\"}");

        RoleConfig config = store.load(Role.WEB);

        assertThat(config.getStartupTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.getShutdownTimeout()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void rejectsMalformedTimeout() throws IOException {
        write(Role.WEB, "{\"shutdown_timeout\": \"whenever\"}");

        assertThatThrownBy(() -> store.load(Role.WEB))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("shutdown_timeout:");
    }

    @Test
    void ignoresUnknownFields() throws Exception {
        write(Role.WEB, "{\"port\": 8081, \"colour\": \"blue\"}");

        assertThat(store.load(Role.WEB).getPort()).isEqualTo(8081);
    }

    @Test
    void substituteLeavesTextWithoutReferencesAlone() {
        assertThat(store.substitute("plain $value")).isEqualTo("plain $value");
        assertThat(store.substitute("${APP_DIR}/model")).isEqualTo(appDir + "/model");
    }
}
