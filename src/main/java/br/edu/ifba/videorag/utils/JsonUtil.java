package br.edu.ifba.videorag.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;

/**
 * Shared Jackson mapper and helpers for reading model output.
 */
public final class JsonUtil {

    public static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Removes a surrounding Markdown code fence ({@code ```json ... ```}) if present.
     */
    @NotNull
    public static String stripCodeFence(@NotNull String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        final int firstNewline = trimmed.indexOf('\n');
        trimmed = firstNewline >= 0 ? trimmed.substring(firstNewline + 1) : trimmed.substring(3);
        if (trimmed.endsWith("```")) {
            trimmed = trimmed.substring(0, trimmed.length() - 3);
        }
        return trimmed.strip();
    }

    /**
     * Parses model output as a JSON tree, tolerating a code fence around it.
     *
     * @throws JsonProcessingException when the text is not valid JSON
     */
    @NotNull
    public static JsonNode readModelJson(@NotNull String text) throws JsonProcessingException {
        return MAPPER.readTree(stripCodeFence(text));
    }
}
