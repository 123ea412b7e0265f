package com.secretai.sdk.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Transport-level failure. Retryable by default regardless of {@link Kind}.
 */
public final class NetworkException extends SecretAiException {

    public enum Kind {
        TIMEOUT,      // Attempt exceeded its request or connect timeout
        CONNECTION,   // Could not establish a connection to the host
        GENERAL       // Any other I/O failure or gateway error
    }

    private final Kind networkKind;
    private final String operation;
    private final Duration timeout;
    private final String host;

    private NetworkException(Kind networkKind, String message, String operation, Duration timeout,
                             String host, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
        this.networkKind = networkKind;
        this.operation = operation;
        this.timeout = timeout;
        this.host = host;
    }

    public static NetworkException timeout(Duration timeout, String operation, Throwable cause) {
        String message = "Request " + operation + " timed out after " + formatSeconds(timeout) + " seconds";
        return new NetworkException(Kind.TIMEOUT, message, operation, timeout, null, cause);
    }

    public static NetworkException connection(String host, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new NetworkException(Kind.CONNECTION, "Failed to connect to " + host + detail, null, null, host, cause);
    }

    public static NetworkException general(String message, String operation, Throwable cause) {
        return new NetworkException(Kind.GENERAL, "Network error: " + message, operation, null, null, cause);
    }

    public Kind networkKind() {
        return networkKind;
    }

    public Optional<String> operation() {
        return Optional.ofNullable(operation);
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    private static String formatSeconds(Duration duration) {
        return duration == null ? "?" : String.valueOf(duration.toMillis() / 1000.0);
    }
}
