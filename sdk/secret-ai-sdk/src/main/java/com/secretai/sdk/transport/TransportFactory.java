package com.secretai.sdk.transport;

import com.secretai.sdk.config.TimeoutConfig;

import java.util.Map;

/**
 * Creates the transport once per client. The headers are final for the client's lifetime.
 */
@FunctionalInterface
public interface TransportFactory {

    SecretAiTransport create(String host, Map<String, String> headers, TimeoutConfig timeouts);
}
