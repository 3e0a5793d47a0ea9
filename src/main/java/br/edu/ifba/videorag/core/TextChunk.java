package br.edu.ifba.videorag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Concatenated text of several consecutive clips, the unit of knowledge-graph extraction.
 *
 * @param chunkId unique id, derived from the video id and the chunk index
 * @param sourceVideoId id of the video the clips belong to
 * @param content per-clip transcript and caption text with clip boundaries marked
 * @param sourceClipIds ids of the contributing clips, in clip order, never empty
 */
public record TextChunk(
    @JsonProperty("chunk_id") @NotNull String chunkId,
    @JsonProperty("source_video_id") @NotNull String sourceVideoId,
    @JsonProperty("content") @NotNull String content,
    @JsonProperty("source_clip_ids") @NotNull List<String> sourceClipIds
) {
    public TextChunk {
        if (sourceClipIds == null || sourceClipIds.isEmpty()) {
            throw new IllegalArgumentException("Chunk " + chunkId + " must reference at least one clip");
        }
        sourceClipIds = List.copyOf(sourceClipIds);
    }
}
