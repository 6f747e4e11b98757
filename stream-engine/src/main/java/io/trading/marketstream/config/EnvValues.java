package io.trading.marketstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Environment variable parsing with logged fallback to defaults.
 */
final class EnvValues {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvValues.class);

    private EnvValues() {
    }

    static String parseString(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value.trim();
    }

    static int parseInt(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    static boolean parseBoolean(Function<String, String> env, String key, boolean defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    static Duration parseMillis(Function<String, String> env, String key, Duration defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
