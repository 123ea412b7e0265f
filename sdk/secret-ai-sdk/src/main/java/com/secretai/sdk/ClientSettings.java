package com.secretai.sdk;

import com.secretai.sdk.config.ConfigSource;
import com.secretai.sdk.config.RetryOverrides;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit client arguments. Unset values fall back to the {@link ConfigSource}
 * (environment by default) and then to built-in defaults.
 */
public final class ClientSettings {

    public static final String DEFAULT_HOST = "http://localhost:11434";

    private final String host;
    private final String apiKey;
    private final ClientMode mode;
    private final RetryOverrides retry;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final boolean validateResponses;
    private final Map<String, String> headers;
    private final ConfigSource configSource;

    private ClientSettings(Builder builder) {
        this.host = builder.host != null && !builder.host.isBlank() ? builder.host : DEFAULT_HOST;
        this.apiKey = builder.apiKey;
        this.mode = builder.mode;
        this.retry = builder.retry;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.validateResponses = builder.validateResponses;
        this.headers = Map.copyOf(builder.headers);
        this.configSource = builder.configSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String host() {
        return host;
    }

    public String apiKey() {
        return apiKey;
    }

    public ClientMode mode() {
        return mode;
    }

    public RetryOverrides retry() {
        return retry;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public boolean validateResponses() {
        return validateResponses;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public ConfigSource configSource() {
        return configSource;
    }

    public static final class Builder {
        private String host;
        private String apiKey;
        private ClientMode mode = ClientMode.RESILIENT;
        private RetryOverrides retry = RetryOverrides.none();
        private Duration requestTimeout;
        private Duration connectTimeout;
        private boolean validateResponses = true;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private ConfigSource configSource = ConfigSource.environment();

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder mode(ClientMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder retry(RetryOverrides retry) {
            this.retry = retry != null ? retry : RetryOverrides.none();
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder validateResponses(boolean validateResponses) {
            this.validateResponses = validateResponses;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder configSource(ConfigSource configSource) {
            this.configSource = Objects.requireNonNull(configSource, "configSource");
            return this;
        }

        public ClientSettings build() {
            return new ClientSettings(this);
        }
    }
}
