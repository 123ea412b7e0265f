package com.secretai.sdk.config;

import java.time.Duration;

/**
 * Caller-supplied retry values. Any field may be null, meaning "use the environment or default".
 */
public record RetryOverrides(
        Integer maxRetries,
        Duration initialDelay,
        Double backoffMultiplier,
        Duration maxDelay
) {
    public static RetryOverrides none() {
        return new RetryOverrides(null, null, null, null);
    }

    public RetryOverrides withMaxRetries(Integer value) {
        return new RetryOverrides(value, initialDelay, backoffMultiplier, maxDelay);
    }

    public RetryOverrides withInitialDelay(Duration value) {
        return new RetryOverrides(maxRetries, value, backoffMultiplier, maxDelay);
    }

    public RetryOverrides withBackoffMultiplier(Double value) {
        return new RetryOverrides(maxRetries, initialDelay, value, maxDelay);
    }

    public RetryOverrides withMaxDelay(Duration value) {
        return new RetryOverrides(maxRetries, initialDelay, backoffMultiplier, value);
    }
}
