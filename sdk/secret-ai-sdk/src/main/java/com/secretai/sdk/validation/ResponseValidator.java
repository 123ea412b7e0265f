package com.secretai.sdk.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.secretai.sdk.error.ResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Checks a returned payload before it reaches the caller.
 *
 * Strict for: absent payload, an explicit {@code error} field, a missing required
 * top-level field of the expected {@link ResponseShape}. Advisory (WARN only) for
 * nested fields such as {@code message.content}.
 */
public class ResponseValidator {
    private static final Logger defaultLogger = LoggerFactory.getLogger(ResponseValidator.class);

    private final boolean enabled;
    private final Logger logger;

    public ResponseValidator(boolean enabled) {
        this(enabled, defaultLogger);
    }

    public ResponseValidator(boolean enabled, Logger logger) {
        this.enabled = enabled;
        this.logger = logger != null ? logger : defaultLogger;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void validate(JsonNode response) {
        validate(response, ResponseShape.ANY);
    }

    public void validate(JsonNode response, ResponseShape shape) {
        if (!enabled) {
            return;
        }
        if (response == null || response.isNull() || response.isMissingNode()) {
            throw new ResponseException("Received null response", null);
        }

        if (response.isObject()) {
            JsonNode error = response.get("error");
            if (error != null) {
                throw new ResponseException("Server returned error: " + (error.isTextual() ? error.asText() : error), response);
            }
        } else if (shape != ResponseShape.ANY) {
            throw new ResponseException("Expected a JSON object for " + shape.name().toLowerCase(Locale.ROOT) + " response", response);
        }

        String required = shape.requiredField();
        if (required != null && !response.has(required)) {
            throw new ResponseException("Response missing '" + required + "' field", response);
        }

        JsonNode message = response.get("message");
        if (message != null && (!message.isObject() || !message.has("content"))) {
            logger.warn("Response message missing 'content' field");
        }
    }
}
