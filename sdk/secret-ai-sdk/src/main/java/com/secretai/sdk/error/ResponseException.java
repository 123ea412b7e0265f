package com.secretai.sdk.error;

import java.util.Optional;

/**
 * The service answered, but the answer cannot be used. Never retried.
 */
public final class ResponseException extends SecretAiException {

    private final Object responseData;
    private final Integer httpStatus;

    public ResponseException(String message, Object responseData) {
        this(message, responseData, null, null);
    }

    public ResponseException(String message, Object responseData, Integer httpStatus, Throwable cause) {
        super(ErrorKind.RESPONSE, "Invalid response: " + message, cause);
        this.responseData = responseData;
        this.httpStatus = httpStatus;
    }

    public Optional<Object> responseData() {
        return Optional.ofNullable(responseData);
    }

    public Optional<Integer> httpStatus() {
        return Optional.ofNullable(httpStatus);
    }
}
