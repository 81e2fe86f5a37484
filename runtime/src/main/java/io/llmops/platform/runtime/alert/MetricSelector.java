package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Selects the series of one metric, optionally narrowed by label values,
 * written the way Prometheus writes series: {@code name} or
 * {@code name{label="value",...}}.
 *
 * <p>A sample matches when its name is equal and it carries every selected
 * label with the same value. Labels not named in the selector are ignored.</p>
 *
 * @param name metric name
 * @param labels required label values
 */
public record MetricSelector(String name, Map<String, String> labels) {

    private static final Pattern METRIC_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");
    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    public MetricSelector {
        Objects.requireNonNull(name, "name");
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        if (!METRIC_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid metric name '" + name + "'");
        }
    }

    /**
     * Parse a selector.
     *
     * @param text e.g. {@code http_requests_total{status="500"}}
     * @return the selector
     * @throws IllegalArgumentException if the text is not a valid selector
     */
    @Nonnull
    public static MetricSelector parse(@Nonnull String text) {
        String trimmed = text.trim();
        int brace = trimmed.indexOf('{');
        if (brace < 0) {
            return new MetricSelector(trimmed, Map.of());
        }
        if (!trimmed.endsWith("}")) {
            throw new IllegalArgumentException("unterminated label set in '" + text + "'");
        }
        return new MetricSelector(trimmed.substring(0, brace).trim(),
                parseLabels(trimmed.substring(brace + 1, trimmed.length() - 1)));
    }

    /**
     * Parse the inside of a label set, {@code a="1",b="2"}.
     *
     * @param body text between the braces
     * @return labels in order of appearance
     * @throws IllegalArgumentException if the label set is malformed
     */
    @Nonnull
    static Map<String, String> parseLabels(@Nonnull String body) {
        Map<String, String> labels = new LinkedHashMap<>();
        int i = 0;
        int length = body.length();
        while (i < length) {
            while (i < length && (body.charAt(i) == ',' || Character.isWhitespace(body.charAt(i)))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int equals = body.indexOf('=', i);
            if (equals < 0) {
                throw new IllegalArgumentException("label without value in '" + body + "'");
            }
            String key = body.substring(i, equals).trim();
            if (!LABEL_NAME.matcher(key).matches()) {
                throw new IllegalArgumentException("invalid label name '" + key + "'");
            }
            i = equals + 1;
            while (i < length && Character.isWhitespace(body.charAt(i))) {
                i++;
            }
            if (i >= length || body.charAt(i) != '"') {
                throw new IllegalArgumentException("label '" + key + "' must have a quoted value");
            }
            i++;

            StringBuilder value = new StringBuilder();
            boolean closed = false;
            while (i < length) {
                char c = body.charAt(i++);
                if (c == '\\' && i < length) {
                    char escaped = body.charAt(i++);
                    value.append(escaped == 'n' ? '\n' : escaped);
                } else if (c == '"') {
                    closed = true;
                    break;
                } else {
                    value.append(c);
                }
            }
            if (!closed) {
                throw new IllegalArgumentException("unterminated value of label '" + key + "'");
            }
            labels.put(key, value.toString());
        }
        return labels;
    }

    /**
     * Whether a sample belongs to the selected series.
     *
     * @param sample the sample
     * @return true if name and selected labels match
     */
    public boolean matches(@Nonnull MetricSample sample) {
        if (!name.equals(sample.metric())) {
            return false;
        }
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (!label.getValue().equals(sample.labels().get(label.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        if (labels.isEmpty()) {
            return name;
        }
        StringBuilder text = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (!first) {
                text.append(',');
            }
            text.append(label.getKey()).append("=\"").append(label.getValue()).append('"');
            first = false;
        }
        return text.append('}').toString();
    }
}
