package com.secretai.sdk.observability;

/**
 * Fixed reason taxonomy for client call outcomes.
 * Used as the 'reason' label in secret_ai_client_requests_total.
 */
public enum ErrorReason {
    SUCCESS,                 // Call succeeded
    TIMEOUT,                 // Attempt exceeded its timeout
    CONNECTION_FAILURE,      // Connection refused, unreachable host
    NETWORK_ERROR,           // Other transport failure, gateway errors
    RESPONSE_ERROR,          // Payload failed validation, request rejected
    CONFIG_ERROR,            // Missing API key, invalid settings
    RETRY_EXHAUSTED,         // Retry budget consumed
    TRANSIENT_MESSAGE,       // Unclassified error whose message looks transient
    CANCELLED,               // Caller cancelled the call
    UNKNOWN                  // Fallback
}
