package com.secretai.sdk.retry;

import java.time.Duration;

/**
 * One failed attempt of a retry sequence.
 *
 * @param index           zero-based attempt index
 * @param error           failure raised by the attempt
 * @param delayBeforeNext wait scheduled before the next attempt, zero when none follows
 */
public record Attempt(int index, Throwable error, Duration delayBeforeNext) {
}
