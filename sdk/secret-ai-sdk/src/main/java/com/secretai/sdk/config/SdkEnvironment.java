package com.secretai.sdk.config;

import com.secretai.sdk.error.ConfigException;

import java.time.Duration;
import java.util.Optional;

/**
 * Environment variable names and built-in defaults of the SDK.
 */
public final class SdkEnvironment {

    public static final String API_KEY = "SECRET_AI_API_KEY";

    public static final String MAX_RETRIES = "SECRET_AI_MAX_RETRIES";
    public static final String RETRY_DELAY = "SECRET_AI_RETRY_DELAY";
    public static final String RETRY_BACKOFF = "SECRET_AI_RETRY_BACKOFF";
    public static final String MAX_RETRY_DELAY = "SECRET_AI_MAX_RETRY_DELAY";
    public static final String REQUEST_TIMEOUT = "SECRET_AI_REQUEST_TIMEOUT";
    public static final String CONNECT_TIMEOUT = "SECRET_AI_CONNECT_TIMEOUT";

    public static final String CHAIN_ID = "SECRET_CHAIN_ID";
    public static final String NODE_URL = "SECRET_NODE_URL";
    public static final String WORKER_SMART_CONTRACT = "SECRET_WORKER_SMART_CONTRACT";

    public static final int MAX_RETRIES_DEFAULT = 3;
    public static final Duration RETRY_DELAY_DEFAULT = Duration.ofSeconds(1);
    public static final double RETRY_BACKOFF_DEFAULT = 2.0;
    public static final Duration MAX_RETRY_DELAY_DEFAULT = Duration.ofSeconds(30);
    public static final Duration REQUEST_TIMEOUT_DEFAULT = Duration.ofSeconds(30);
    public static final Duration CONNECT_TIMEOUT_DEFAULT = Duration.ofSeconds(10);

    // Secret Network testnet
    public static final String CHAIN_ID_DEFAULT = "pulsar-3";
    public static final String NODE_URL_DEFAULT = "https://pulsar.lcd.secretnodes.com";
    public static final String WORKER_SMART_CONTRACT_DEFAULT = "secret18cy3cgnmkft3ayma4nr37wgtj4faxfnrnngrlq";

    private SdkEnvironment() {
    }

    static Optional<Integer> intValue(ConfigSource source, String key) {
        return source.get(key).map(raw -> {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new ConfigException("Environment variable " + key + " must be an integer, got '" + raw + "'", e);
            }
        });
    }

    static Optional<Double> doubleValue(ConfigSource source, String key) {
        return source.get(key).map(raw -> parseDouble(key, raw));
    }

    /**
     * Durations are given in (possibly fractional) seconds, e.g. {@code 2.5}.
     */
    static Optional<Duration> secondsValue(ConfigSource source, String key) {
        return source.get(key).map(raw -> {
            double seconds = parseDouble(key, raw);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                throw new ConfigException("Environment variable " + key + " must be a finite number of seconds");
            }
            return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
        });
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigException("Environment variable " + key + " must be a number, got '" + raw + "'", e);
        }
    }
}
