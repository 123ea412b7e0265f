package com.secretai.sdk.autoconfigure;

import com.secretai.sdk.BasicSecretAiClient;
import com.secretai.sdk.FakeTransport;
import com.secretai.sdk.ResilientSecretAiClient;
import com.secretai.sdk.SecretAiClient;
import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.model.GenerateRequest;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.registry.RegistryClientFactory;
import com.secretai.sdk.registry.SecretRegistry;
import com.secretai.sdk.transport.TransportFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecretAiAutoConfigurationTest {

    private final FakeTransport transport = FakeTransport.returning("{\"response\":\"ok\",\"done\":true}");

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SecretAiAutoConfiguration.class))
            .withBean(TransportFactory.class, transport::factory);

    @Test
    void testResilientClientByDefault() {
        contextRunner
                .withPropertyValues(
                        "secret-ai.api-key=test-key",
                        "secret-ai.host=http://secret-ai.test:11434",
                        "secret-ai.retry.max-retries=1",
                        "secret-ai.retry.initial-delay=250ms",
                        "secret-ai.timeout.request=5s")
                .run(context -> {
                    ResilientSecretAiClient client = assertInstanceOf(ResilientSecretAiClient.class,
                            context.getBean(SecretAiClient.class));

                    assertEquals("http://secret-ai.test:11434", client.host());
                    assertEquals(1, client.retryConfig().maxRetries());
                    assertEquals(Duration.ofMillis(250), client.retryConfig().initialDelay());
                    assertEquals(Duration.ofSeconds(5), client.timeouts().requestTimeout());
                    assertEquals("Bearer test-key", client.headers().get("Authorization"));
                });
    }

    @Test
    void testBasicMode() {
        contextRunner
                .withPropertyValues("secret-ai.api-key=test-key", "secret-ai.mode=basic")
                .run(context -> assertInstanceOf(BasicSecretAiClient.class, context.getBean(SecretAiClient.class)));
    }

    @Test
    void testEnvironmentStyleNamesResolve() {
        contextRunner
                .withPropertyValues("SECRET_AI_API_KEY=env-key", "SECRET_AI_MAX_RETRIES=6")
                .run(context -> {
                    ResilientSecretAiClient client = (ResilientSecretAiClient) context.getBean(SecretAiClient.class);
                    assertEquals("Bearer env-key", client.headers().get("Authorization"));
                    assertEquals(6, client.retryConfig().maxRetries());
                });
    }

    @Test
    void testDisabled() {
        contextRunner
                .withPropertyValues("secret-ai.enabled=false", "secret-ai.api-key=test-key")
                .run(context -> assertTrue(context.getBeansOfType(SecretAiClient.class).isEmpty()));
    }

    @Test
    void testMissingApiKeyFailsStartup() {
        contextRunner.run(context -> {
            assertNotNull(context.getStartupFailure());
            Throwable root = context.getStartupFailure();
            while (root.getCause() != null) {
                root = root.getCause();
            }
            assertInstanceOf(ConfigException.class, root);
            assertEquals(0, transport.created.get());
        });
    }

    @Test
    void testMetricsWhenRegistryPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("secret-ai.api-key=test-key")
                .run(context -> {
                    assertEquals(1, context.getBeansOfType(RetryMetrics.class).size());
                    context.getBean(SecretAiClient.class).generate(
                            GenerateRequest.of("llama3", "hi"));
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.get("secret_ai_client_attempts_total").counter().count());
                });
    }

    @Test
    void testNoMetricsWithoutRegistry() {
        contextRunner
                .withPropertyValues("secret-ai.api-key=test-key")
                .run(context -> assertTrue(context.getBeansOfType(RetryMetrics.class).isEmpty()));
    }

    @Test
    void testClientClosedWithContext() {
        contextRunner
                .withPropertyValues("secret-ai.api-key=test-key")
                .run(context -> assertFalse(transport.closed));
        assertTrue(transport.closed);
    }

    @Test
    void testRegistryWhenChainClientPresent() {
        contextRunner
                .withPropertyValues("secret-ai.api-key=test-key", "SECRET_WORKER_SMART_CONTRACT=secret1abc")
                .withBean(RegistryClientFactory.class, () -> (chainId, nodeUrl) ->
                        (contract, query) -> FakeTransport.json("{\"models\":[\"llama3\"]}"))
                .run(context -> {
                    SecretRegistry registry = context.getBean(SecretRegistry.class);
                    assertEquals("secret1abc", registry.settings().contractAddress());
                    assertEquals("pulsar-3", registry.settings().chainId());
                    assertEquals(List.of("llama3"), registry.getModels());
                });
    }

    @Test
    void testNoRegistryWithoutChainClient() {
        contextRunner
                .withPropertyValues("secret-ai.api-key=test-key")
                .run(context -> assertTrue(context.getBeansOfType(SecretRegistry.class).isEmpty()));
    }
}
