package io.llmops.platform.runtime.config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings such as {@code 5s}, {@code 250ms}, {@code 0.5s},
 * {@code 5m} or {@code 1h}. A bare number means seconds.
 */
public final class DurationParser {

    private static final Pattern DURATION = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?$");

    private DurationParser() {
    }

    /**
     * Check if a string looks like a duration with an explicit unit.
     *
     * @param text candidate text
     * @return true if it has a unit suffix and parses
     */
    public static boolean hasUnit(@Nullable String text) {
        if (text == null) {
            return false;
        }
        Matcher matcher = DURATION.matcher(text.trim().toLowerCase(Locale.ROOT));
        return matcher.matches() && matcher.group(2) != null;
    }

    /**
     * Parse a duration string.
     *
     * @param text duration text
     * @return the duration
     * @throws IllegalArgumentException if the text is not a duration
     */
    @Nonnull
    public static Duration parse(@Nonnull String text) {
        Matcher matcher = DURATION.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("not a duration: '" + text + "'");
        }
        BigDecimal amount = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2) != null ? matcher.group(2) : "s";
        BigDecimal nanosPerUnit = switch (unit) {
            case "ms" -> BigDecimal.valueOf(1_000_000L);
            case "m" -> BigDecimal.valueOf(60_000_000_000L);
            case "h" -> BigDecimal.valueOf(3_600_000_000_000L);
            default -> BigDecimal.valueOf(1_000_000_000L);
        };
        return Duration.ofNanos(amount.multiply(nanosPerUnit).longValue());
    }

    /**
     * Parse a config field holding a duration.
     *
     * @param field field name, for the error message
     * @param text value, or null to use the fallback
     * @param fallback value used when text is null
     * @return the parsed duration
     * @throws ConfigException if the value is not a duration
     */
    @Nonnull
    public static Duration parseField(@Nonnull String field, @Nullable String text, @Nonnull Duration fallback)
            throws ConfigException {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(field, e.getMessage());
        }
    }

    /**
     * Convert a duration to fractional seconds.
     *
     * @param duration duration
     * @return seconds
     */
    public static double toSeconds(@Nonnull Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
