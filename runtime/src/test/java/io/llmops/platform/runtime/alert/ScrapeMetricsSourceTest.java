package io.llmops.platform.runtime.alert;

import com.sun.net.httpserver.HttpServer;
import io.llmops.platform.runtime.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeMetricsSourceTest {

    private static final String EXPOSITION = "# HELP latency request latency\n"
            + "# TYPE latency gauge\n"
            + "latency{route=\"/predict\"} 0.42\n"
            + "errors 1 1714564800000\n"
            + "broken NaNish\n";

    private final AtomicReference<String> exposition = new AtomicReference<>(EXPOSITION);
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/metrics", exchange -> {
            byte[] body = exposition.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void parsesExposition() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        List<MetricSample> samples = ScrapeMetricsSource.parse(EXPOSITION, "api:8000", now);

        assertThat(samples).extracting(MetricSample::metric).containsExactly("latency", "errors");
        assertThat(samples.get(0).value()).isEqualTo(0.42);
        assertThat(samples.get(0).labels()).isEqualTo(Map.of("route", "/predict"));
        assertThat(samples.get(1).labels()).isEmpty();
        assertThat(samples.get(0).source()).isEqualTo("api:8000");
        assertThat(samples.get(0).timestamp()).isEqualTo(now);
    }

    @Test
    void scrapesTargets() throws MetricsUnavailableException {
        String target = "127.0.0.1:" + server.getAddress().getPort();
        ScrapeMetricsSource source = new ScrapeMetricsSource(List.of(target), HttpClient.newHttpClient(),
                Duration.ofSeconds(2), Clock.systemUTC());

        assertThat(source.poll()).extracting(MetricSample::metric).containsExactly("latency", "errors");
    }

    @Test
    void unreachableTargetsMakeTheSourceUnavailable() {
        int port = server.getAddress().getPort();
        server.stop(0);
        ScrapeMetricsSource source = new ScrapeMetricsSource(List.of("127.0.0.1:" + port), HttpClient.newHttpClient(),
                Duration.ofSeconds(1), Clock.systemUTC());

        assertThatThrownBy(source::poll).isInstanceOf(MetricsUnavailableException.class);
    }

    @Test
    void labelValuesMayContainBracesAndQuotes() {
        String body = "http_requests_total{path=\"/a}b\",note=\"say \\\"hi\\\"\"} 7\n"
                + "bad{path=/unquoted} 1\n";

        List<MetricSample> samples = ScrapeMetricsSource.parse(body, "web:8080", Instant.EPOCH);

        assertThat(samples).singleElement().satisfies(sample -> {
            assertThat(sample.labels()).containsEntry("path", "/a}b").containsEntry("note", "say \"hi\"");
            assertThat(sample.value()).isEqualTo(7.0);
        });
    }

    private AlertStatus errorRateAfterScrapes(long failedPerHundred) throws MetricsUnavailableException {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        String target = "127.0.0.1:" + server.getAddress().getPort();
        ScrapeMetricsSource source = new ScrapeMetricsSource(List.of(target), HttpClient.newHttpClient(),
                Duration.ofSeconds(2), clock);
        AlertRule rule = AlertRule.percentage("error_rate",
                AlertRule.DEFAULT_FAILED_METRIC, AlertRule.DEFAULT_TOTAL_METRIC, 0.05, Duration.ofMinutes(1));
        AlertEvaluator evaluator = new AlertEvaluator(List.of(rule), source, Duration.ofSeconds(15), clock);

        for (int scrape = 0; scrape <= 4; scrape++) {
            long requests = 5000 + 25L * scrape;
            double failed = 200 + failedPerHundred * scrape / 4.0;
            exposition.set("# TYPE http_requests_total counter\n"
                    + "http_requests_total{method=\"POST\"} " + requests + "\n"
                    + "http_requests_failed_total{method=\"POST\"} " + failed + "\n");
            evaluator.evaluateNow();
            clock.advance(Duration.ofSeconds(15));
        }
        return evaluator.getSnapshot().state("error_rate").orElseThrow().status();
    }

    @Test
    void scrapedCountersFireOnSixFailuresInAHundred() throws MetricsUnavailableException {
        assertThat(errorRateAfterScrapes(6)).isEqualTo(AlertStatus.FIRING);
    }

    @Test
    void scrapedCountersStayOkOnFourFailuresInAHundred() throws MetricsUnavailableException {
        assertThat(errorRateAfterScrapes(4)).isEqualTo(AlertStatus.OK);
    }
}
