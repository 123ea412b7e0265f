package com.secretai.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.config.SdkEnvironment;
import com.secretai.sdk.config.TimeoutConfig;
import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.transport.SecretAiTransport;
import com.secretai.sdk.transport.TransportErrorMapper;
import com.secretai.sdk.transport.TransportFactory;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Construction and per-call plumbing shared by both client modes: API key resolution,
 * the frozen auth header, transport creation, error mapping, decoding and metrics.
 */
abstract class AbstractSecretAiClient implements SecretAiClient {

    static final String AUTHORIZATION = "Authorization";

    protected final Logger logger;
    protected final String host;
    protected final TimeoutConfig timeouts;
    protected final SecretAiTransport transport;
    protected final TransportErrorMapper errorMapper;
    protected final ObjectMapper objectMapper;
    protected final RetryMetrics metrics;
    protected final ExecutorService transportExecutor;

    private final Map<String, String> headers;

    /**
     * Fails with {@link ConfigException} before the transport is created when no API key resolves.
     */
    protected AbstractSecretAiClient(ClientSettings settings, TransportFactory transportFactory,
                                     ObjectMapper objectMapper, RetryMetrics metrics, Logger logger) {
        this.logger = logger;
        this.host = settings.host();

        String apiKey = resolveApiKey(settings);
        this.timeouts = TimeoutConfig.load(settings.requestTimeout(), settings.connectTimeout(), settings.configSource());

        Map<String, String> merged = new LinkedHashMap<>(settings.headers());
        merged.put(AUTHORIZATION, "Bearer " + apiKey);
        this.headers = Collections.unmodifiableMap(merged);

        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.errorMapper = new TransportErrorMapper(host, timeouts);
        this.transport = createTransport(transportFactory);
        this.transportExecutor = newTransportExecutor();
    }

    static String resolveApiKey(ClientSettings settings) {
        String explicit = settings.apiKey();
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return settings.configSource().get(SdkEnvironment.API_KEY)
                .orElseThrow(() -> ConfigException.missingApiKey(SdkEnvironment.API_KEY));
    }

    private SecretAiTransport createTransport(TransportFactory transportFactory) {
        try {
            return transportFactory.create(host, headers, timeouts);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize client for host {}: {}", host, e.getMessage());
            throw NetworkException.connection(host, e);
        }
    }

    /**
     * One transport call, with every raw failure translated into the SDK taxonomy.
     */
    protected JsonNode invokeTransport(String operation, Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            logger.error("{} request to {} failed: {}", operation, host, e.toString());
            throw errorMapper.map(e, operation);
        }
    }

    protected <T> T decode(JsonNode payload, Class<T> type, String operation) {
        if (payload == null || payload.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ResponseException("Cannot decode " + operation + " response: " + e.getOriginalMessage(),
                    payload, null, e);
        }
    }

    protected void recordCall(String operation, long startNanos, Throwable error) {
        if (metrics != null) {
            metrics.recordCall(operation, System.nanoTime() - startNanos, error);
        }
    }

    /**
     * Headers attached to every transport call; immutable.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public TimeoutConfig timeouts() {
        return timeouts;
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public void close() {
        logger.info("Shutting down {} client for host {}", mode(), host);
        transportExecutor.shutdown();
        transport.close();
    }

    private static ExecutorService newTransportExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "secret-ai-transport-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
