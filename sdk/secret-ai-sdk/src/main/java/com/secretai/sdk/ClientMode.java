package com.secretai.sdk;

/**
 * Capability set of a {@link SecretAiClient}, chosen once when the client is created.
 */
public enum ClientMode {
    BASIC,      // Auth header, one transport call per request, error mapping only
    RESILIENT   // Adds retry with backoff and response validation
}
