package com.secretai.sdk.observability;

import io.micrometer.core.instrument.Tags;

/**
 * Classification of a finished Secret AI call or attempt.
 *
 * @param reason    semantic reason, {@link ErrorReason#SUCCESS} when the call returned a value
 * @param retryable whether another attempt could change the result
 * @param detail    exception type, network kind or matched keyword
 */
public record CallOutcome(
    ErrorReason reason,
    boolean retryable,
    String detail
) {
    public static final CallOutcome SUCCESS = new CallOutcome(ErrorReason.SUCCESS, false, "OK");

    public boolean isSuccess() {
        return reason == ErrorReason.SUCCESS;
    }

    public String resultLabel() {
        return isSuccess() ? "SUCCESS" : "FAILURE";
    }

    /**
     * "true" or "false" for failures; "n/a" for a success, which has nothing to retry.
     */
    public String retryableLabel() {
        return isSuccess() ? "n/a" : String.valueOf(retryable);
    }

    /**
     * Tags carried by {@code secret_ai_client_requests_total}.
     */
    public Tags tags() {
        return Tags.of("result", resultLabel(), "reason", reason.name(), "retryable", retryableLabel());
    }
}
