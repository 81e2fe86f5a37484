package io.llmops.platform.runtime.config;

import io.llmops.platform.runtime.registry.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthCheckSpecTest {

    @TempDir
    Path appDir;

    private HealthCheckSpec spec(String section) throws ConfigException {
        ConfigStore store = new ConfigStore(appDir, appDir, Map.of(), JsonMappers.create());
        RoleConfig config = store.parse(Role.LOADBALANCER, "{\"health_check\": " + section + "}",
                appDir.resolve("loadbalancer_server.json"));
        return HealthCheckSpec.from(config.getHealthCheck());
    }

    @Test
    void parsesSection() throws ConfigException {
        HealthCheckSpec spec = spec("{\"path\": \"/ready\", \"interval\": \"10s\", \"timeout\": \"5s\", \"retries\": 3}");

        assertThat(spec.path()).isEqualTo("/ready");
        assertThat(spec.interval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(spec.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(spec.retries()).isEqualTo(3);
        assertThat(spec.healthyThreshold()).isEqualTo(1);
    }

    @Test
    void pathDefaultsToHealth() throws ConfigException {
        assertThat(spec("{\"interval\": \"10s\", \"timeout\": \"5s\", \"retries\": 2}").path()).isEqualTo("/health");
    }

    @Test
    void sectionIsRequired() {
        assertThatThrownBy(() -> HealthCheckSpec.from(null))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("health_check:");
    }

    @Test
    void timeoutMustNotExceedInterval() {
        assertThatThrownBy(() -> spec("{\"interval\": \"2s\", \"timeout\": \"5s\", \"retries\": 3}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("health_check.timeout:");
    }

    @Test
    void retriesMustBePositive() {
        assertThatThrownBy(() -> spec("{\"interval\": \"10s\", \"timeout\": \"5s\", \"retries\": 0}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("health_check.retries:");
    }

    @Test
    void intervalIsRequired() {
        assertThatThrownBy(() -> spec("{\"timeout\": \"5s\", \"retries\": 3}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("health_check.interval:");
    }

    @Test
    void pathMustBeAbsolute() {
        assertThatThrownBy(() -> spec("{\"path\": \"health\", \"interval\": \"10s\", \"timeout\": \"5s\", \"retries\": 3}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("health_check.path:");
    }
}
