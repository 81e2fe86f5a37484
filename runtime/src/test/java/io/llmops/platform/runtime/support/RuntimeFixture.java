package io.llmops.platform.runtime.support;

import io.llmops.platform.runtime.Orchestrator;
import io.llmops.platform.runtime.registry.Role;
import io.llmops.platform.runtime.role.DependencyResolver;
import io.llmops.platform.runtime.role.PortProbe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A throwaway config directory, application directory and tool directory,
 * plus fakes for everything an {@link Orchestrator} touches on the host.
 */
public class RuntimeFixture {

    public static final List<String> TOOLS = List.of("gunicorn", "uvicorn", "streamlit", "prometheus");

    private final Path configDir;
    private final Path appDir;
    private final Path binDir;
    private final Path sitesAvailable;
    private final Path sitesEnabled;

    private final FakeLauncher launcher = new FakeLauncher();
    private final FakeServiceController services = new FakeServiceController();
    private final ScriptedHealthProbe healthProbe = new ScriptedHealthProbe();
    private final InMemoryMetricsSource metrics = new InMemoryMetricsSource();
    private final PortProbe portProbe = mock(PortProbe.class);

    public RuntimeFixture(Path root) throws IOException {
        this.configDir = Files.createDirectories(root.resolve("configs"));
        this.appDir = Files.createDirectories(root.resolve("app"));
        this.binDir = Files.createDirectories(root.resolve("bin"));
        this.sitesAvailable = root.resolve("nginx/sites-available");
        this.sitesEnabled = root.resolve("nginx/sites-enabled");
        for (String tool : TOOLS) {
            installTool(tool);
        }
        writeDescriptor("{}");
        when(portProbe.isFree(anyInt())).thenReturn(true);
        when(portProbe.isListening(anyString(), anyInt(), any(Duration.class))).thenReturn(true);
    }

    public Orchestrator orchestrator(boolean hostingLoops) {
        return builder(hostingLoops).build();
    }

    public Orchestrator.Builder builder(boolean hostingLoops) {
        return Orchestrator.builder(configDir, appDir)
                .environment(Map.of("DB_PASSWORD", "s3cret"))
                .launcher(launcher)
                .services(services)
                .healthProbe(healthProbe)
                .metricsSourceFactory(targets -> metrics)
                .portProbe(portProbe)
                .dependencyResolver(new DependencyResolver(List.of(binDir)))
                .nginxSites(sitesAvailable, sitesEnabled)
                .hostingLoops(hostingLoops)
                .readinessPollInterval(Duration.ofMillis(10));
    }

    public Path writeConfig(Role role, String json) throws IOException {
        Path file = configDir.resolve(role.getConfigFileName());
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    public void writeDescriptor(String json) throws IOException {
        Files.writeString(appDir.resolve("descriptor.json"), json, StandardCharsets.UTF_8);
    }

    public Path installTool(String name) throws IOException {
        Path tool = binDir.resolve(name);
        Files.writeString(tool, "#!/bin/sh\n", StandardCharsets.UTF_8);
        if (!tool.toFile().setExecutable(true)) {
            throw new IOException("cannot make " + tool + " executable");
        }
        return tool;
    }

    public void removeTool(String name) throws IOException {
        Files.deleteIfExists(binDir.resolve(name));
    }

    public Path runFile(String name) {
        return appDir.resolve(Orchestrator.RUN_DIR).resolve(name);
    }

    public Path getConfigDir() {
        return configDir;
    }

    public Path getAppDir() {
        return appDir;
    }

    public Path getSitesAvailable() {
        return sitesAvailable;
    }

    public Path getSitesEnabled() {
        return sitesEnabled;
    }

    public FakeLauncher getLauncher() {
        return launcher;
    }

    public FakeServiceController getServices() {
        return services;
    }

    public ScriptedHealthProbe getHealthProbe() {
        return healthProbe;
    }

    public InMemoryMetricsSource getMetrics() {
        return metrics;
    }

    public PortProbe getPortProbe() {
        return portProbe;
    }

    // ==================== Sample Configs ====================

    public static String loadBalancerConfig(int port, String interval, String timeout, String... backends) {
        StringBuilder servers = new StringBuilder();
        for (int i = 0; i < backends.length; i++) {
            servers.append(i > 0 ? ", " : "").append('"').append(backends[i]).append('"');
        }
        return "{\n"
                + "  \"server_type\": \"loadbalancer\",\n"
                + "  \"port\": " + port + ",\n"
                + "  \"backend_servers\": [" + servers + "],\n"
                + "  \"health_check\": {\"path\": \"/health\", \"interval\": \"" + interval + "\","
                + " \"timeout\": \"" + timeout + "\", \"retries\": 3}\n"
                + "}\n";
    }

    public static String monitoringConfig(int port, boolean startGrafana) {
        return "{\n"
                + "  \"server_type\": \"monitoring\",\n"
                + "  \"port\": " + port + ",\n"
                + "  \"monitoring_type\": \"prometheus\",\n"
                + "  \"targets\": [\"localhost:8000\", \"localhost:8080\"],\n"
                + "  \"start_grafana\": " + startGrafana + ",\n"
                + "  \"alert_rules\": {\n"
                + "    \"high_latency\": {\"threshold\": \"0.5s\", \"duration\": \"5m\"},\n"
                + "    \"error_rate\": {\"threshold\": \"5%\", \"duration\": \"1m\"}\n"
                + "  }\n"
                + "}\n";
    }
}
