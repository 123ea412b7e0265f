package com.secretai.sdk.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Body of {@code POST /api/chat}. Streaming is not supported; the transport always sends {@code stream=false}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        Map<String, Object> options
) {
    public ChatRequest {
        Objects.requireNonNull(model, "model");
        messages = messages == null ? List.of() : List.copyOf(messages);
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static ChatRequest of(String model, ChatMessage... messages) {
        return new ChatRequest(model, List.of(messages), Map.of());
    }
}
