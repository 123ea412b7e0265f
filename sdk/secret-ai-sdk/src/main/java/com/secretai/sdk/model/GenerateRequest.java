package com.secretai.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;

/**
 * Body of {@code POST /api/generate}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GenerateRequest(
        String model,
        String prompt,
        String system,
        Map<String, Object> options
) {
    public GenerateRequest {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(prompt, "prompt");
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static GenerateRequest of(String model, String prompt) {
        return new GenerateRequest(model, prompt, null, Map.of());
    }
}
