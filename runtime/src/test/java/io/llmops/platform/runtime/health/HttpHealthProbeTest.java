package io.llmops.platform.runtime.health;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpHealthProbeTest {

    private HttpServer server;
    private String address;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/broken", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
        address = "127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void twoHundredsAreHealthy() {
        HealthCheckResult result = new HttpHealthProbe().probe(address, "/health", Duration.ofSeconds(2));

        assertThat(result.success()).isTrue();
        assertThat(result.error()).isNull();
    }

    @Test
    void errorStatusIsAFailure() {
        HealthCheckResult result = new HttpHealthProbe().probe(address, "/broken", Duration.ofSeconds(2));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("HTTP 503");
    }

    @Test
    void refusedConnectionIsAFailure() {
        server.stop(0);

        HealthCheckResult result = new HttpHealthProbe().probe(address, "/health", Duration.ofSeconds(1));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isNotBlank();
    }

    @Test
    void clientLeavesTimeoutsToTheRequest() {
        assertThat(HttpHealthProbe.defaultClient().connectTimeout()).isEmpty();
    }

    @Test
    void silentTargetFailsWithinTheCheckTimeout() throws IOException {
        try (ServerSocket silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            String target = "127.0.0.1:" + silent.getLocalPort();
            long started = System.nanoTime();

            HealthCheckResult result = new HttpHealthProbe().probe(target, "/health", Duration.ofMillis(300));

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("timed out after 300ms");
            assertThat(elapsed).isLessThan(Duration.ofMillis(1300));
        }
    }
}
