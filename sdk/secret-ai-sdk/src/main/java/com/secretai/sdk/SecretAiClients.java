package com.secretai.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.transport.RestTemplateTransport;
import com.secretai.sdk.transport.TransportFactory;

/**
 * Entry point for building clients. The mode in {@link ClientSettings} picks the
 * implementation once, at construction.
 */
public final class SecretAiClients {

    private SecretAiClients() {
    }

    public static SecretAiClient create(ClientSettings settings) {
        ObjectMapper objectMapper = new ObjectMapper();
        return create(settings, RestTemplateTransport.factory(objectMapper), objectMapper, null);
    }

    public static SecretAiClient create(ClientSettings settings, TransportFactory transportFactory) {
        return create(settings, transportFactory, new ObjectMapper(), null);
    }

    public static SecretAiClient create(ClientSettings settings, TransportFactory transportFactory,
                                        ObjectMapper objectMapper, RetryMetrics metrics) {
        switch (settings.mode()) {
            case BASIC:
                return new BasicSecretAiClient(settings, transportFactory, objectMapper, metrics, null);
            case RESILIENT:
                return new ResilientSecretAiClient(settings, transportFactory, objectMapper, metrics, null);
            default:
                throw new IllegalArgumentException("Unsupported client mode: " + settings.mode());
        }
    }
}
