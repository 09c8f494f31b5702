package com.track.resolution.api;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * Typed access to flat configuration properties. Parse errors name the offending key.
 */
class PropertyReader {

    private final Properties props;

    PropertyReader(Properties props) {
        if (props == null) {
            throw new ConfigurationException("properties are required");
        }
        this.props = props;
    }

    void stringValue(String key, Consumer<String> setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(value);
        }
    }

    void doubleValue(String key, DoubleConsumer setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(parseDouble(key, value));
        }
    }

    void intValue(String key, IntConsumer setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(parseInt(key, value));
        }
    }

    void booleanValue(String key, Consumer<Boolean> setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(parseBoolean(key, value));
        }
    }

    void millisValue(String key, Consumer<Duration> setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(Duration.ofMillis(parseLong(key, value)));
        }
    }

    void secondsValue(String key, Consumer<Duration> setter) {
        String value = raw(key);
        if (value != null) {
            setter.accept(Duration.ofSeconds(parseLong(key, value)));
        }
    }

    double doubleOr(String key, double defaultValue) {
        String value = raw(key);
        return value != null ? parseDouble(key, value) : defaultValue;
    }

    int intOr(String key, int defaultValue) {
        String value = raw(key);
        return value != null ? parseInt(key, value) : defaultValue;
    }

    long longOr(String key, long defaultValue) {
        String value = raw(key);
        return value != null ? parseLong(key, value) : defaultValue;
    }

    boolean booleanOr(String key, boolean defaultValue) {
        String value = raw(key);
        return value != null ? parseBoolean(key, value) : defaultValue;
    }

    private String raw(String key) {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new ConfigurationException(key + " must be true or false, got '" + value + "'");
        };
    }
}
