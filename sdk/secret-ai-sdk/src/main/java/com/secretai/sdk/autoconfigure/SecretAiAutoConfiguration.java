package com.secretai.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.ClientSettings;
import com.secretai.sdk.SecretAiClient;
import com.secretai.sdk.SecretAiClients;
import com.secretai.sdk.config.ConfigSource;
import com.secretai.sdk.config.RetryOverrides;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.registry.RegistryClientFactory;
import com.secretai.sdk.registry.RegistrySettings;
import com.secretai.sdk.registry.SecretRegistry;
import com.secretai.sdk.retry.RetryListener;
import com.secretai.sdk.transport.RestTemplateTransport;
import com.secretai.sdk.transport.TransportFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.Optional;

/**
 * Registers a {@link SecretAiClient} built from {@link SecretAiProperties}, plus a
 * {@link SecretRegistry} when a {@link RegistryClientFactory} bean exists.
 * Disabled with {@code secret-ai.enabled=false}.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnProperty(prefix = "secret-ai", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SecretAiProperties.class)
public class SecretAiAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SecretAiAutoConfiguration.class);

    /**
     * Resolves {@code SECRET_AI_*} names through the Spring environment, which includes the
     * process environment and any property source the application adds.
     */
    @Bean
    @ConditionalOnMissingBean
    public ConfigSource secretAiConfigSource(Environment environment) {
        return key -> Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransportFactory secretAiTransportFactory(ObjectProvider<ObjectMapper> objectMapper) {
        return RestTemplateTransport.factory(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public RetryMetrics secretAiRetryMetrics(MeterRegistry registry) {
        return new RetryMetrics(registry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SecretAiClient secretAiClient(SecretAiProperties properties,
                                         ConfigSource configSource,
                                         TransportFactory transportFactory,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         ObjectProvider<RetryMetrics> metrics) {
        ClientSettings settings = toSettings(properties, configSource);
        logger.info("Creating Secret AI client in {} mode for host {}", settings.mode(), settings.host());
        return SecretAiClients.create(settings, transportFactory,
                objectMapper.getIfAvailable(ObjectMapper::new), metrics.getIfAvailable());
    }

    /**
     * Registry of models and worker URLs, available when the application supplies a chain client.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(RegistryClientFactory.class)
    public SecretRegistry secretRegistry(ConfigSource configSource,
                                         RegistryClientFactory clientFactory,
                                         ObjectProvider<RetryMetrics> metrics) {
        RetryMetrics retryMetrics = metrics.getIfAvailable();
        return new SecretRegistry(RegistrySettings.load(configSource), clientFactory,
                retryMetrics != null ? retryMetrics : RetryListener.NOOP);
    }

    static ClientSettings toSettings(SecretAiProperties properties, ConfigSource configSource) {
        SecretAiProperties.Retry retry = properties.getRetry();
        return ClientSettings.builder()
                .host(properties.getHost())
                .apiKey(properties.getApiKey())
                .mode(properties.getMode())
                .validateResponses(properties.isValidateResponses())
                .retry(new RetryOverrides(retry.getMaxRetries(), retry.getInitialDelay(),
                        retry.getBackoffMultiplier(), retry.getMaxDelay()))
                .requestTimeout(properties.getTimeout().getRequest())
                .connectTimeout(properties.getTimeout().getConnect())
                .headers(properties.getHeaders())
                .configSource(configSource)
                .build();
    }
}
