package com.secretai.sdk.error;

/**
 * Root of the SDK error taxonomy.
 *
 * The hierarchy is flat: {@link ConfigException}, {@link NetworkException},
 * {@link ResponseException} and {@link RetryExhaustedException} extend this class
 * directly and carry only the fields they need. The constructor is package-private
 * so no other variant can be added outside this package.
 */
public abstract class SecretAiException extends RuntimeException {

    private static final String PREFIX = "Secret AI SDK Error: ";

    private final ErrorKind kind;

    SecretAiException(ErrorKind kind, String message, Throwable cause) {
        super(PREFIX + message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
