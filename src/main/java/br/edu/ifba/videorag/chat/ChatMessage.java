package br.edu.ifba.videorag.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat message in the OpenAI-compatible wire format. {@code content} is either plain text or,
 * for vision requests, a list of typed content parts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
    String role,
    Object content
) {

    public static ChatMessage system(final String text) {
        return new ChatMessage("system", text);
    }

    public static ChatMessage user(final String text) {
        return new ChatMessage("user", text);
    }

    /**
     * User message carrying a text part followed by one image part per data URL.
     */
    public static ChatMessage userWithImages(final String text, final List<String> imageDataUrls) {
        final List<Map<String, Object>> parts = new ArrayList<>(imageDataUrls.size() + 1);
        parts.add(Map.of("type", "text", "text", text));
        for (final String url : imageDataUrls) {
            parts.add(Map.of("type", "image_url", "image_url", Map.of("url", url)));
        }
        return new ChatMessage("user", parts);
    }

    /**
     * Text of a response message; content parts are not expected in responses.
     */
    public String text() {
        return content == null ? null : content.toString();
    }
}
