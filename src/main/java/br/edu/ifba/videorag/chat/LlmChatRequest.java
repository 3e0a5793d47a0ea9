package br.edu.ifba.videorag.chat;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    /**
     * {@code {"type": "json_object"}} to request a strict JSON response, null otherwise.
     */
    @JsonProperty("response_format")
    Map<String, Object> responseFormat
) {
    private static final Map<String, Object> JSON_OBJECT = Map.of("type", "json_object");

    public LlmChatRequest(
            final String model,
            final List<ChatMessage> messages,
            final Integer maxTokens,
            final Double temperature,
            final boolean jsonMode) {
        this(model, messages, false, maxTokens, temperature, jsonMode ? JSON_OBJECT : null);
    }
}
