package com.secretai.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.ChatResponse;
import com.secretai.sdk.model.GenerateRequest;
import com.secretai.sdk.model.GenerateResponse;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Plain client: bearer auth and a single transport call per request.
 * No retry, no response validation.
 */
public class BasicSecretAiClient extends AbstractSecretAiClient {
    private static final Logger defaultLogger = LoggerFactory.getLogger(BasicSecretAiClient.class);

    public BasicSecretAiClient(ClientSettings settings, TransportFactory transportFactory) {
        this(settings, transportFactory, new ObjectMapper(), null, defaultLogger);
    }

    public BasicSecretAiClient(ClientSettings settings, TransportFactory transportFactory, ObjectMapper objectMapper,
                               RetryMetrics metrics, Logger logger) {
        super(settings, transportFactory, objectMapper, metrics, logger != null ? logger : defaultLogger);
        this.logger.info("Initialized BasicSecretAiClient with host: {}, timeout: {}", host, timeouts.requestTimeout());
    }

    @Override
    public GenerateResponse generate(GenerateRequest request) {
        return call("generate", () -> decode(invokeTransport("generate", () -> transport.generate(request)),
                GenerateResponse.class, "generate"));
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        return call("chat", () -> decode(invokeTransport("chat", () -> transport.chat(request)),
                ChatResponse.class, "chat"));
    }

    @Override
    public CompletableFuture<GenerateResponse> generateAsync(GenerateRequest request) {
        return CompletableFuture.supplyAsync(() -> generate(request), transportExecutor);
    }

    @Override
    public CompletableFuture<ChatResponse> chatAsync(ChatRequest request) {
        return CompletableFuture.supplyAsync(() -> chat(request), transportExecutor);
    }

    @Override
    public ClientMode mode() {
        return ClientMode.BASIC;
    }

    private <T> T call(String operation, Supplier<T> body) {
        long start = System.nanoTime();
        if (metrics != null) {
            metrics.incrementInflight();
        }
        try {
            T result = body.get();
            recordCall(operation, start, null);
            return result;
        } catch (RuntimeException e) {
            recordCall(operation, start, e);
            throw e;
        } finally {
            if (metrics != null) {
                metrics.decrementInflight();
            }
        }
    }
}
