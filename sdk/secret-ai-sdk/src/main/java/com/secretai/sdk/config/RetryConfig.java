package com.secretai.sdk.config;

import com.secretai.sdk.error.ConfigException;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry policy values.
 *
 * @param maxRetries        number of retries after the first attempt; total attempts are {@code maxRetries + 1},
 *                          which must fit in an int
 * @param initialDelay      wait before the first retry
 * @param backoffMultiplier growth factor of the wait, at least 1
 * @param maxDelay          cap on any single wait, not below {@code initialDelay}
 */
public record RetryConfig(
        int maxRetries,
        Duration initialDelay,
        double backoffMultiplier,
        Duration maxDelay
) {
    public RetryConfig {
        if (maxRetries < 0) {
            throw new ConfigException("max_retries must be >= 0, got " + maxRetries);
        }
        if (maxRetries == Integer.MAX_VALUE) {
            throw new ConfigException("max_retries must be < " + Integer.MAX_VALUE + ", got " + maxRetries);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new ConfigException("initial_delay must be >= 0, got " + initialDelay);
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new ConfigException("backoff_multiplier must be >= 1, got " + backoffMultiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new ConfigException("max_delay must be >= initial_delay (" + initialDelay + "), got " + maxDelay);
        }
    }

    public int totalAttempts() {
        return maxRetries + 1;
    }

    public static RetryConfig defaults() {
        return new RetryConfig(SdkEnvironment.MAX_RETRIES_DEFAULT, SdkEnvironment.RETRY_DELAY_DEFAULT,
                SdkEnvironment.RETRY_BACKOFF_DEFAULT, SdkEnvironment.MAX_RETRY_DELAY_DEFAULT);
    }

    public static RetryConfig noRetry() {
        return new RetryConfig(0, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public static RetryConfig load(ConfigSource source) {
        return load(RetryOverrides.none(), source);
    }

    /**
     * Resolves every field from the override, then the environment, then the built-in default.
     */
    public static RetryConfig load(RetryOverrides overrides, ConfigSource source) {
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(source, "source");

        int maxRetries = overrides.maxRetries() != null
                ? overrides.maxRetries()
                : SdkEnvironment.intValue(source, SdkEnvironment.MAX_RETRIES)
                        .orElse(SdkEnvironment.MAX_RETRIES_DEFAULT);
        Duration initialDelay = overrides.initialDelay() != null
                ? overrides.initialDelay()
                : SdkEnvironment.secondsValue(source, SdkEnvironment.RETRY_DELAY)
                        .orElse(SdkEnvironment.RETRY_DELAY_DEFAULT);
        double multiplier = overrides.backoffMultiplier() != null
                ? overrides.backoffMultiplier()
                : SdkEnvironment.doubleValue(source, SdkEnvironment.RETRY_BACKOFF)
                        .orElse(SdkEnvironment.RETRY_BACKOFF_DEFAULT);
        Duration maxDelay = overrides.maxDelay() != null
                ? overrides.maxDelay()
                : SdkEnvironment.secondsValue(source, SdkEnvironment.MAX_RETRY_DELAY)
                        .orElse(SdkEnvironment.MAX_RETRY_DELAY_DEFAULT);

        return new RetryConfig(maxRetries, initialDelay, multiplier, maxDelay);
    }
}
