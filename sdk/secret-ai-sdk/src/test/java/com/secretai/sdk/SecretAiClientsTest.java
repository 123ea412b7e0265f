package com.secretai.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.config.ConfigSource;
import com.secretai.sdk.observability.RetryMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecretAiClientsTest {

    private static ClientSettings.Builder base() {
        return ClientSettings.builder().apiKey("test-key").configSource(ConfigSource.empty());
    }

    @Test
    void testDefaultModeIsResilient() {
        FakeTransport transport = FakeTransport.returning("{}");

        try (SecretAiClient client = SecretAiClients.create(base().build(), transport.factory())) {
            assertInstanceOf(ResilientSecretAiClient.class, client);
            assertEquals(ClientMode.RESILIENT, client.mode());
        }
    }

    @Test
    void testBasicMode() {
        FakeTransport transport = FakeTransport.returning("{}");

        try (SecretAiClient client = SecretAiClients.create(base().mode(ClientMode.BASIC).build(), transport.factory(),
                new ObjectMapper(), new RetryMetrics(new SimpleMeterRegistry()))) {
            assertInstanceOf(BasicSecretAiClient.class, client);
        }
    }

    @Test
    void testDefaultTransportIsHttp() {
        try (SecretAiClient client = SecretAiClients.create(base().host("http://secret-ai.test:11434").build())) {
            assertEquals("http://secret-ai.test:11434", client.host());
        }
    }
}
