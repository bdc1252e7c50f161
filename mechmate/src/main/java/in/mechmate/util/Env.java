package in.mechmate.util;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.function.Function;

/**
 * Typed reads of process settings.
 *
 * Lookup order is the process environment, then a JVM system property with the same key.
 * Blank values count as unset. A value that is set but unparseable is a startup error naming
 * the key, never a silent fall back to the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = trimToNull(System.getenv(key));
        if (value == null) {
            value = trimToNull(System.getProperty(key));
        }
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    /**
     * Whole number of {@code unit}s, e.g. {@code getDuration("PUSH_TIMEOUT_SECONDS", ChronoUnit.SECONDS, 10)}.
     */
    public static Duration getDuration(String key, ChronoUnit unit, long defaultAmount) {
        long amount = parse(key, defaultAmount, Long::parseLong);
        return Duration.of(amount, unit);
    }

    public static ZoneId getZone(String key, ZoneId defaultZone) {
        return parse(key, defaultZone, ZoneId::of);
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return parser.apply(value);
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalStateException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Env() {}
}
