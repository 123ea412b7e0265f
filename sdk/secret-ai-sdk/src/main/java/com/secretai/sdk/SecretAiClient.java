package com.secretai.sdk;

import com.secretai.sdk.model.ChatRequest;
import com.secretai.sdk.model.ChatResponse;
import com.secretai.sdk.model.GenerateRequest;
import com.secretai.sdk.model.GenerateResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Client of the Secret AI language-model service.
 *
 * Every operation either returns a response or fails with one of
 * {@link com.secretai.sdk.error.ConfigException}, {@link com.secretai.sdk.error.NetworkException},
 * {@link com.secretai.sdk.error.ResponseException} or
 * {@link com.secretai.sdk.error.RetryExhaustedException}; raw transport exceptions never escape.
 */
public interface SecretAiClient extends AutoCloseable {

    GenerateResponse generate(GenerateRequest request);

    ChatResponse chat(ChatRequest request);

    CompletableFuture<GenerateResponse> generateAsync(GenerateRequest request);

    CompletableFuture<ChatResponse> chatAsync(ChatRequest request);

    ClientMode mode();

    String host();

    @Override
    void close();
}
