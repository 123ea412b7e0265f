package com.secretai.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatResponse(
        String model,
        @JsonProperty("created_at") String createdAt,
        ChatMessage message,
        boolean done,
        @JsonProperty("done_reason") String doneReason,
        @JsonProperty("total_duration") Long totalDuration,
        @JsonProperty("eval_count") Integer evalCount
) {
    public String content() {
        return message != null ? message.content() : null;
    }
}
