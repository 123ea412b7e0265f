package com.secretai.sdk.retry;

import com.secretai.sdk.config.RetryConfig;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff without jitter: {@code min(initialDelay * multiplier^attempt, maxDelay)},
 * expressed as a resilience4j {@link IntervalFunction} with millisecond resolution.
 *
 * Waits are never shorter than one millisecond; the async retry loop of resilience4j
 * gives up on a zero interval.
 */
public class BackoffSchedule {
    static final long MIN_INTERVAL_MILLIS = 1;

    public IntervalFunction intervalFunction(RetryConfig config) {
        long initial = Math.max(MIN_INTERVAL_MILLIS, config.initialDelay().toMillis());
        long max = Math.max(initial, config.maxDelay().toMillis());
        if (config.backoffMultiplier() == 1.0 || initial == max) {
            return IntervalFunction.of(initial);
        }
        return IntervalFunction.ofExponentialBackoff(initial, config.backoffMultiplier(), max);
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    public Duration delayFor(int attempt, RetryConfig config) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        // resilience4j numbers attempts from 1
        return Duration.ofMillis(intervalFunction(config).apply(attempt + 1));
    }
}
