package com.secretai.sdk.error;

/**
 * Tag of the SDK error taxonomy. Every {@link SecretAiException} carries exactly one.
 */
public enum ErrorKind {
    CONFIG,           // Missing or invalid configuration, never retried
    NETWORK,          // Timeout, connection or other transport failure
    RESPONSE,         // Payload failed validation or the server rejected the request
    RETRY_EXHAUSTED   // Retry budget consumed on a retryable error chain
}
