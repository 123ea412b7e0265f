package com.secretai.sdk.autoconfigure;

import com.secretai.sdk.ClientMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot binding for the {@code secret-ai.*} properties. Unset values fall back to the
 * {@code SECRET_AI_*} environment variables and then to the SDK defaults.
 */
@ConfigurationProperties(prefix = "secret-ai")
public class SecretAiProperties {

    private boolean enabled = true;
    private String host;
    private String apiKey;
    private ClientMode mode = ClientMode.RESILIENT;
    private boolean validateResponses = true;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Retry retry = new Retry();
    private final Timeout timeout = new Timeout();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public ClientMode getMode() {
        return mode;
    }

    public void setMode(ClientMode mode) {
        this.mode = mode;
    }

    public boolean isValidateResponses() {
        return validateResponses;
    }

    public void setValidateResponses(boolean validateResponses) {
        this.validateResponses = validateResponses;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Retry getRetry() {
        return retry;
    }

    public Timeout getTimeout() {
        return timeout;
    }

    public static class Retry {
        private Integer maxRetries;
        private Duration initialDelay;
        private Double backoffMultiplier;
        private Duration maxDelay;

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(Double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Timeout {
        private Duration request;
        private Duration connect;

        public Duration getRequest() {
            return request;
        }

        public void setRequest(Duration request) {
            this.request = request;
        }

        public Duration getConnect() {
            return connect;
        }

        public void setConnect(Duration connect) {
            this.connect = connect;
        }
    }
}
