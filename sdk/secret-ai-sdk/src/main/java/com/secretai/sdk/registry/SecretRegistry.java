package com.secretai.sdk.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.secretai.sdk.config.RetryConfig;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.error.SecretAiException;
import com.secretai.sdk.retry.CancellationSignal;
import com.secretai.sdk.retry.RetryExecutor;
import com.secretai.sdk.retry.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Discovers the models served by Secret AI workers and the URLs that serve them by
 * querying the worker registry contract.
 *
 * Every query runs inside a {@link RetryExecutor} with the default retry policy.
 * Failures of the chain client become {@link NetworkException} (retried); an answer
 * without the expected list becomes {@link ResponseException} (not retried).
 */
public class SecretRegistry implements AutoCloseable {
    private static final Logger defaultLogger = LoggerFactory.getLogger(SecretRegistry.class);

    static final String GET_MODELS = "get_models";
    static final String GET_URLS = "get_u_r_ls";

    private final RegistrySettings settings;
    private final RegistryClient client;
    private final RetryExecutor retryExecutor;
    private final boolean ownsExecutor;
    private final ObjectMapper objectMapper;
    private final Logger logger;

    public SecretRegistry(RegistrySettings settings, RegistryClientFactory clientFactory) {
        this(settings, clientFactory, RetryListener.NOOP);
    }

    public SecretRegistry(RegistrySettings settings, RegistryClientFactory clientFactory, RetryListener listener) {
        this(settings, clientFactory,
                RetryExecutor.builder().config(RetryConfig.defaults()).listener(listener).logger(defaultLogger).build(),
                true);
    }

    /**
     * Uses a caller-owned executor, which {@link #close()} leaves running.
     */
    public SecretRegistry(RegistrySettings settings, RegistryClientFactory clientFactory, RetryExecutor retryExecutor) {
        this(settings, clientFactory, retryExecutor, false);
    }

    private SecretRegistry(RegistrySettings settings, RegistryClientFactory clientFactory,
                           RetryExecutor retryExecutor, boolean ownsExecutor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.ownsExecutor = ownsExecutor;
        this.objectMapper = new ObjectMapper();
        this.logger = defaultLogger;
        try {
            this.client = clientFactory.create(settings.chainId(), settings.nodeUrl());
        } catch (RuntimeException e) {
            logger.error("Failed to initialize registry client for node {}: {}", settings.nodeUrl(), e.getMessage());
            if (ownsExecutor) {
                retryExecutor.close();
            }
            throw NetworkException.connection(settings.nodeUrl(), e);
        }
        logger.info("Initialized SecretRegistry on chain {} via {}, contract {}",
                settings.chainId(), settings.nodeUrl(), settings.contractAddress());
    }

    public RegistrySettings settings() {
        return settings;
    }

    public List<String> getModels() {
        return getModels(new CancellationSignal());
    }

    public List<String> getModels(CancellationSignal cancellation) {
        ObjectNode query = objectMapper.createObjectNode();
        query.putObject(GET_MODELS);
        return query("get_models", query, "models", "Failed to query models", cancellation);
    }

    /**
     * URLs of every registered worker.
     */
    public List<String> getUrls() {
        return getUrls(null);
    }

    /**
     * URLs of the workers serving {@code model}; all workers when {@code model} is null or blank.
     */
    public List<String> getUrls(String model) {
        return getUrls(model, new CancellationSignal());
    }

    public List<String> getUrls(String model, CancellationSignal cancellation) {
        ObjectNode query = objectMapper.createObjectNode();
        ObjectNode arguments = query.putObject(GET_URLS);
        if (model != null && !model.isBlank()) {
            arguments.put("model", model);
        }
        return query("get_urls", query, "urls", "Failed to query URLs", cancellation);
    }

    private List<String> query(String operation, JsonNode query, String field, String failure,
                               CancellationSignal cancellation) {
        return retryExecutor.execute(operation, () -> {
            JsonNode response;
            try {
                response = client.contractQuery(settings.contractAddress(), query);
            } catch (SecretAiException e) {
                throw e;
            } catch (RuntimeException e) {
                throw NetworkException.general(failure + ": " + e.getMessage(), operation, e);
            }
            return extract(response, field);
        }, cancellation);
    }

    private static List<String> extract(JsonNode response, String field) {
        if (response == null || !response.isObject() || !response.has(field) || !response.get(field).isArray()) {
            throw new ResponseException("Invalid response format from smart contract", response);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : response.get(field)) {
            if (!value.isTextual()) {
                throw new ResponseException("Invalid response format from smart contract", response);
            }
            values.add(value.asText());
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public void close() {
        try {
            client.close();
        } finally {
            if (ownsExecutor) {
                retryExecutor.close();
            }
        }
    }
}
