package br.edu.ifba.videorag.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Body of a multimodal encoder call. Video paths must be readable by the encoder service,
 * which shares the clip storage volume.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MultimodalEmbeddingRequest(
    @JsonProperty("video_paths") List<String> videoPaths,
    @JsonProperty("text_list") List<String> texts
) {

    public static MultimodalEmbeddingRequest videos(final List<String> videoPaths) {
        return new MultimodalEmbeddingRequest(videoPaths, null);
    }

    public static MultimodalEmbeddingRequest texts(final List<String> texts) {
        return new MultimodalEmbeddingRequest(null, texts);
    }
}
