package com.secretai.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.GenerateRequest;

/**
 * Performs the actual network call. Implementations raise their native failures
 * (timeouts, connection errors, HTTP status errors); the clients translate them with
 * {@link TransportErrorMapper}.
 */
public interface SecretAiTransport extends AutoCloseable {

    JsonNode generate(GenerateRequest request);

    JsonNode chat(ChatRequest request);

    String host();

    @Override
    default void close() {
    }
}
