package com.secretai.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretai.sdk.config.RetryConfig;
import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.ChatResponse;
import com.secretai.sdk.model.GenerateRequest;
import com.secretai.sdk.model.GenerateResponse;
import com.secretai.sdk.observability.RetryMetrics;
import com.secretai.sdk.retry.CancellationSignal;
import com.secretai.sdk.retry.RetryExecutor;
import com.secretai.sdk.retry.RetryListener;
import com.secretai.sdk.transport.TransportFactory;
import com.secretai.sdk.validation.ResponseShape;
import com.secretai.sdk.validation.ResponseValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Resilient client: every request runs inside a {@link RetryExecutor}.
 *
 * Per attempt:
 * 1. Transport call
 * 2. Raw failures mapped into the SDK taxonomy (timeout, connection, ...) before classification
 * 3. Payload validated, then decoded; a bad payload stops the sequence at once
 *
 * Per call state machine: INIT -> ATTEMPTING -> SUCCESS | FATAL_FAILURE | WAITING -> ATTEMPTING | EXHAUSTED.
 * Retry budgets belong to the call, not the client; the only shared state is immutable
 * configuration and the auth header.
 */
public class ResilientSecretAiClient extends AbstractSecretAiClient {
    private static final Logger defaultLogger = LoggerFactory.getLogger(ResilientSecretAiClient.class);

    private final RetryConfig retryConfig;
    private final RetryExecutor retryExecutor;
    private final ResponseValidator validator;

    public ResilientSecretAiClient(ClientSettings settings, TransportFactory transportFactory) {
        this(settings, transportFactory, new ObjectMapper(), null, defaultLogger);
    }

    public ResilientSecretAiClient(ClientSettings settings, TransportFactory transportFactory,
                                   ObjectMapper objectMapper, RetryMetrics metrics, Logger logger) {
        // retry settings are resolved before the transport exists, so a bad value leaves nothing open
        this(settings, transportFactory, objectMapper, metrics, logger,
                RetryConfig.load(settings.retry(), settings.configSource()));
    }

    private ResilientSecretAiClient(ClientSettings settings, TransportFactory transportFactory,
                                    ObjectMapper objectMapper, RetryMetrics metrics, Logger logger,
                                    RetryConfig retryConfig) {
        super(settings, transportFactory, objectMapper, metrics, logger != null ? logger : defaultLogger);
        this.retryConfig = retryConfig;
        this.validator = new ResponseValidator(settings.validateResponses(), this.logger);
        this.retryExecutor = RetryExecutor.builder()
                .config(retryConfig)
                .listener(metrics != null ? metrics : RetryListener.NOOP)
                .logger(this.logger)
                .build();

        this.logger.info("Initialized ResilientSecretAiClient with host: {}, timeout: {}, max_retries: {}",
                host, timeouts.requestTimeout(), retryConfig.maxRetries());
    }

    @Override
    public GenerateResponse generate(GenerateRequest request) {
        return generate(request, new CancellationSignal());
    }

    public GenerateResponse generate(GenerateRequest request, CancellationSignal cancellation) {
        return callBlocking("generate", () -> transport.generate(request), ResponseShape.GENERATE,
                GenerateResponse.class, cancellation);
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        return chat(request, new CancellationSignal());
    }

    public ChatResponse chat(ChatRequest request, CancellationSignal cancellation) {
        return callBlocking("chat", () -> transport.chat(request), ResponseShape.CHAT,
                ChatResponse.class, cancellation);
    }

    @Override
    public CompletableFuture<GenerateResponse> generateAsync(GenerateRequest request) {
        return generateAsync(request, new CancellationSignal());
    }

    public CompletableFuture<GenerateResponse> generateAsync(GenerateRequest request, CancellationSignal cancellation) {
        return callAsync("generate", () -> transport.generate(request), ResponseShape.GENERATE,
                GenerateResponse.class, cancellation);
    }

    @Override
    public CompletableFuture<ChatResponse> chatAsync(ChatRequest request) {
        return chatAsync(request, new CancellationSignal());
    }

    public CompletableFuture<ChatResponse> chatAsync(ChatRequest request, CancellationSignal cancellation) {
        return callAsync("chat", () -> transport.chat(request), ResponseShape.CHAT,
                ChatResponse.class, cancellation);
    }

    @Override
    public ClientMode mode() {
        return ClientMode.RESILIENT;
    }

    public RetryConfig retryConfig() {
        return retryConfig;
    }

    public boolean validatesResponses() {
        return validator.isEnabled();
    }

    private <T> T callBlocking(String operation, Supplier<JsonNode> call, ResponseShape shape, Class<T> type,
                               CancellationSignal cancellation) {
        long start = System.nanoTime();
        if (metrics != null) {
            metrics.incrementInflight();
        }
        try {
            T result = retryExecutor.execute(operation, () -> attempt(operation, call, shape, type), cancellation);
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

    private <T> CompletableFuture<T> callAsync(String operation, Supplier<JsonNode> call, ResponseShape shape,
                                               Class<T> type, CancellationSignal cancellation) {
        long start = System.nanoTime();
        if (metrics != null) {
            metrics.incrementInflight();
        }
        CompletableFuture<T> result = retryExecutor.executeAsync(operation,
                () -> CompletableFuture.supplyAsync(() -> attempt(operation, call, shape, type), transportExecutor),
                cancellation);
        result.whenComplete((value, error) -> {
            recordCall(operation, start, error);
            if (metrics != null) {
                metrics.decrementInflight();
            }
        });
        return result;
    }

    private <T> T attempt(String operation, Supplier<JsonNode> call, ResponseShape shape, Class<T> type) {
        JsonNode payload = invokeTransport(operation, call);
        validator.validate(payload, shape);
        return decode(payload, type, operation);
    }

    @Override
    public void close() {
        retryExecutor.close();
        super.close();
    }
}
