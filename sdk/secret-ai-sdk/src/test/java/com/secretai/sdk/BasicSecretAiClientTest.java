package com.secretai.sdk;

import com.secretai.sdk.config.ConfigSource;
import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.model.ChatMessage;
import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.GenerateRequest;
import com.secretai.sdk.model.GenerateResponse;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BasicSecretAiClientTest {

    private static final ClientSettings SETTINGS = ClientSettings.builder()
            .mode(ClientMode.BASIC)
            .apiKey("test-key")
            .configSource(ConfigSource.empty())
            .build();

    @Test
    void testSingleCallNoRetry() {
        FakeTransport transport = new FakeTransport(call -> {
            throw new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"));
        });

        try (BasicSecretAiClient client = new BasicSecretAiClient(SETTINGS, transport.factory())) {
            NetworkException ex = assertThrows(NetworkException.class,
                    () -> client.generate(GenerateRequest.of("llama3", "hi")));

            assertEquals(NetworkException.Kind.TIMEOUT, ex.networkKind());
            assertEquals(1, transport.calls.get());
        }
    }

    @Test
    void testNoValidation() {
        FakeTransport transport = FakeTransport.returning("{\"error\":\"ignored by basic mode\"}");

        try (BasicSecretAiClient client = new BasicSecretAiClient(SETTINGS, transport.factory())) {
            GenerateResponse response = client.generate(GenerateRequest.of("llama3", "hi"));

            assertNull(response.response());
            assertEquals(ClientMode.BASIC, client.mode());
        }
    }

    @Test
    void testUndecodableBodyIsResponseError() {
        FakeTransport transport = FakeTransport.returning("{\"message\":\"not an object\"}");

        try (BasicSecretAiClient client = new BasicSecretAiClient(SETTINGS, transport.factory())) {
            assertThrows(ResponseException.class,
                    () -> client.chat(ChatRequest.of("llama3", ChatMessage.user("hi"))));
        }
    }

    @Test
    void testAuthHeader() {
        FakeTransport transport = FakeTransport.returning("{\"response\":\"ok\"}");

        try (BasicSecretAiClient client = new BasicSecretAiClient(SETTINGS, transport.factory())) {
            assertEquals("Bearer test-key", transport.headers.get(0).get("Authorization"));
            assertEquals(1, transport.created.get());
            assertEquals(client.headers(), transport.headers.get(0));
        }
    }

    @Test
    void testMissingApiKey() {
        FakeTransport transport = FakeTransport.returning("{}");
        ClientSettings noKey = ClientSettings.builder().mode(ClientMode.BASIC).configSource(ConfigSource.empty()).build();

        assertThrows(ConfigException.class, () -> new BasicSecretAiClient(noKey, transport.factory()));
        assertEquals(0, transport.created.get());
    }

    @Test
    void testAsyncFailureIsMapped() {
        FakeTransport transport = new FakeTransport(call -> {
            throw new IllegalStateException("socket closed");
        });

        try (BasicSecretAiClient client = new BasicSecretAiClient(SETTINGS, transport.factory())) {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> client.chatAsync(ChatRequest.of("llama3", ChatMessage.user("hi"))).get(5, TimeUnit.SECONDS));

            assertInstanceOf(NetworkException.class, ex.getCause());
            assertEquals(1, transport.calls.get());
        }
    }
}
