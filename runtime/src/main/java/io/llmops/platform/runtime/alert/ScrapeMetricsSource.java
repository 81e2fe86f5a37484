package io.llmops.platform.runtime.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scrapes the Prometheus text exposition of each target's {@code /metrics}
 * endpoint. Every scrape yields one sample per series, stamped with the scrape
 * time and carrying the series labels. Counters arrive as their running
 * totals; rules that need a rate work on the increase between scrapes.
 *
 * <p>The source is unavailable only when no target answers; a partial scrape
 * is logged and returned.</p>
 */
public class ScrapeMetricsSource implements MetricsSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScrapeMetricsSource.class);

    public static final String METRICS_PATH = "/metrics";

    private final List<String> targets;
    private final HttpClient client;
    private final Duration timeout;
    private final Clock clock;

    /**
     * Create a scraping source.
     *
     * @param targets targets, {@code host:port}
     * @param client HTTP client
     * @param timeout per-target request timeout
     * @param clock clock stamping the samples
     */
    public ScrapeMetricsSource(
            @Nonnull List<String> targets,
            @Nonnull HttpClient client,
            @Nonnull Duration timeout,
            @Nonnull Clock clock) {
        this.targets = List.copyOf(targets);
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Nonnull
    @Override
    public List<MetricSample> poll() throws MetricsUnavailableException {
        List<MetricSample> samples = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String target : targets) {
            try {
                samples.addAll(parse(scrape(target), target, Instant.now(clock)));
            } catch (IOException e) {
                failures.add(target + " (" + e.getMessage() + ")");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MetricsUnavailableException("interrupted while scraping " + target, e);
            }
        }

        if (!failures.isEmpty() && failures.size() == targets.size()) {
            throw new MetricsUnavailableException("no metrics target reachable: " + String.join(", ", failures));
        }
        if (!failures.isEmpty()) {
            LOGGER.warn("Could not scrape {} of {} targets: {}", failures.size(), targets.size(), failures);
        }
        return samples;
    }

    private String scrape(String target) throws IOException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create("http://" + target + METRICS_PATH))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid target address", e);
        }
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    /**
     * Parse a Prometheus text exposition.
     *
     * <p>Comment lines, malformed label sets and lines whose value is not a
     * number are skipped. Exposition timestamps are ignored in favour of the
     * scrape time.</p>
     *
     * @param body exposition text
     * @param source target that produced it
     * @param timestamp scrape time
     * @return the samples
     */
    @Nonnull
    static List<MetricSample> parse(@Nonnull String body, @Nonnull String source, @Nonnull Instant timestamp) {
        List<MetricSample> samples = new ArrayList<>();
        for (String raw : body.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String name;
            String rest;
            Map<String, String> labels = Map.of();
            int brace = line.indexOf('{');
            int space = line.indexOf(' ');
            if (brace >= 0 && (space < 0 || brace < space)) {
                int close = closingBrace(line, brace);
                if (close < 0) {
                    continue;
                }
                name = line.substring(0, brace);
                try {
                    labels = MetricSelector.parseLabels(line.substring(brace + 1, close));
                } catch (IllegalArgumentException e) {
                    LOGGER.debug("Skipping sample with malformed labels from {}: {}", source, line);
                    continue;
                }
                rest = line.substring(close + 1).trim();
            } else if (space > 0) {
                name = line.substring(0, space);
                rest = line.substring(space + 1).trim();
            } else {
                continue;
            }

            String[] fields = rest.split("\\s+");
            if (fields.length == 0 || fields[0].isEmpty()) {
                continue;
            }
            double value;
            try {
                value = Double.parseDouble(fields[0]);
            } catch (NumberFormatException e) {
                LOGGER.debug("Skipping unparseable sample from {}: {}", source, line);
                continue;
            }
            samples.add(new MetricSample(name, labels, timestamp, value, source));
        }
        return samples;
    }

    private static int closingBrace(String line, int open) {
        boolean quoted = false;
        for (int i = open + 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted && c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == '}' && !quoted) {
                return i;
            }
        }
        return -1;
    }
}
