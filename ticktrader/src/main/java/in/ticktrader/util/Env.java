package in.ticktrader.util;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Environment lookups. A system property of the same name is consulted when
 * the variable is unset, so tests and launch scripts can pass {@code -Dkey=value}.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        return lookup(key).orElse(defaultValue);
    }

    /**
     * Path named by the variable, empty when unset or blank.
     */
    public static Optional<Path> path(String key) {
        return lookup(key).map(v -> Path.of(v.trim()));
    }

    private static Optional<String> lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private Env() {}
}
