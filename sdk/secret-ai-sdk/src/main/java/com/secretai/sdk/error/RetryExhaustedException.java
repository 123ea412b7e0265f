package com.secretai.sdk.error;

public final class RetryExhaustedException extends SecretAiException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super(ErrorKind.RETRY_EXHAUSTED,
                "All " + attempts + " retry attempts failed. Last error: " + describe(lastError), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    public Throwable lastError() {
        return getCause();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
