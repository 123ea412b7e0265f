package com.secretai.sdk.retry;

/**
 * Observer of retry sequences. Callbacks run on the thread that drives the sequence
 * and must not block.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {
    };

    default void onAttempt(String operation, int index) {
    }

    default void onRetry(String operation, Attempt attempt) {
    }

    default void onSuccess(String operation, int attempts) {
    }

    default void onNonRetryable(String operation, Attempt attempt) {
    }

    default void onExhausted(String operation, Attempt attempt) {
    }
}
