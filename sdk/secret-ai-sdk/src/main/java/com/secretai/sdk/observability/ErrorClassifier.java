package com.secretai.sdk.observability;

import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.error.RetryExhaustedException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Error Classifier: maps failures to a semantic {@link ErrorReason} plus retryability.
 *
 * Decision order:
 * 1. Taxonomy errors that retrying cannot fix (response, config) are never retryable.
 * 2. Network errors and the JDK's own timeout/connect exceptions are retryable.
 * 3. Anything else is matched by message against a fixed keyword set, walking the
 *    cause chain. A match is retryable, no match is not.
 *
 * Output: CallOutcome{reason, retryable, detail}. The reason is the metric label,
 * the retryable flag drives {@code RetryDecisionPolicy}.
 */
public class ErrorClassifier {

    static final List<String> RETRYABLE_KEYWORDS = List.of(
            "timeout", "timed out", "connection", "network",
            "temporarily unavailable", "service unavailable",
            "502", "503", "504", "gateway timeout");

    private static final int MAX_CAUSE_DEPTH = 16;

    public boolean isRetryable(Throwable error) {
        return error != null && classify(error).retryable();
    }

    public CallOutcome classify(Throwable throwable) {
        if (throwable == null) {
            return CallOutcome.SUCCESS;
        }

        String type = throwable.getClass().getSimpleName();

        if (throwable instanceof ResponseException) {
            return new CallOutcome(ErrorReason.RESPONSE_ERROR, false, type);
        }
        if (throwable instanceof ConfigException) {
            return new CallOutcome(ErrorReason.CONFIG_ERROR, false, type);
        }
        // A finished retry sequence must not be retried again by an outer loop
        if (throwable instanceof RetryExhaustedException) {
            return new CallOutcome(ErrorReason.RETRY_EXHAUSTED, false, type);
        }
        if (throwable instanceof CancellationException) {
            return new CallOutcome(ErrorReason.CANCELLED, false, type);
        }

        if (throwable instanceof NetworkException network) {
            return switch (network.networkKind()) {
                case TIMEOUT -> new CallOutcome(ErrorReason.TIMEOUT, true, network.networkKind().name());
                case CONNECTION -> new CallOutcome(ErrorReason.CONNECTION_FAILURE, true, network.networkKind().name());
                case GENERAL -> new CallOutcome(ErrorReason.NETWORK_ERROR, true, network.networkKind().name());
            };
        }
        if (throwable instanceof TimeoutException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException) {
            return new CallOutcome(ErrorReason.TIMEOUT, true, type);
        }
        if (throwable instanceof ConnectException) {
            return new CallOutcome(ErrorReason.CONNECTION_FAILURE, true, type);
        }

        String keyword = matchKeyword(throwable);
        if (keyword != null) {
            return new CallOutcome(ErrorReason.TRANSIENT_MESSAGE, true, keyword);
        }
        return new CallOutcome(ErrorReason.UNKNOWN, false, type);
    }

    private static String matchKeyword(Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String keyword : RETRYABLE_KEYWORDS) {
                    if (lower.contains(keyword)) {
                        return keyword;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
