package io.llmops.platform.runtime.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Probes targets with an HTTP GET. Any 2xx status counts as healthy.
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient client;
    private final Clock clock;

    public HttpHealthProbe() {
        this(defaultClient(), Clock.systemUTC());
    }

    public HttpHealthProbe(@Nonnull HttpClient client, @Nonnull Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Client without a connect timeout of its own, so the probe timeout bounds
     * connecting as well as waiting for the response.
     */
    static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Nonnull
    @Override
    public HealthCheckResult probe(@Nonnull String address, @Nonnull String path, @Nonnull Duration timeout) {
        long started = System.nanoTime();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create("http://" + address + path))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            Duration latency = Duration.ofNanos(System.nanoTime() - started);
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return HealthCheckResult.success(address, Instant.now(clock), latency);
            }
            return HealthCheckResult.failure(address, Instant.now(clock), latency, "HTTP " + status);
        } catch (HttpTimeoutException e) {
            return failed(address, started, "timed out after " + timeout.toMillis() + "ms");
        } catch (IOException | IllegalArgumentException e) {
            return failed(address, started, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(address, started, "interrupted");
        }
    }

    private HealthCheckResult failed(String address, long started, String error) {
        LOGGER.debug("Probe of {} failed: {}", address, error);
        return HealthCheckResult.failure(address, Instant.now(clock), Duration.ofNanos(System.nanoTime() - started), error);
    }
}
