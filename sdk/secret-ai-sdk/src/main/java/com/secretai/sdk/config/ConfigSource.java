package com.secretai.sdk.config;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of named settings. Blank values count as absent.
 */
@FunctionalInterface
public interface ConfigSource {

    Optional<String> get(String key);

    static ConfigSource environment() {
        return key -> nonBlank(System.getenv(key));
    }

    static ConfigSource of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> nonBlank(copy.get(key));
    }

    static ConfigSource empty() {
        return key -> Optional.empty();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
