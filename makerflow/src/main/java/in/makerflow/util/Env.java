package in.makerflow.util;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Environment variable lookup with system property fallback.
 *
 * A variable that is set but unparseable fails startup instead of silently using the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    public static double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::valueOf);
    }

    public static BigDecimal getDecimal(String key, String defaultValue) {
        return parse(key, new BigDecimal(defaultValue), BigDecimal::new);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " is not a number: '" + value + "'", e);
        }
    }

    private Env() {}
}
