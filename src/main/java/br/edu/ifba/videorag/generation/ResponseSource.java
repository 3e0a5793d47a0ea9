package br.edu.ifba.videorag.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * A clip cited by an answer.
 *
 * @param timestamp clip bounds as {@code MM:SS - MM:SS}
 * @param content enriched description of the clip
 */
public record ResponseSource(
    @JsonProperty("clip_id") @NotNull String clipId,
    @JsonProperty("source_video_id") @NotNull String sourceVideoId,
    @JsonProperty("timestamp") @NotNull String timestamp,
    @JsonProperty("content") @NotNull String content,
    @JsonProperty("retrieval_score") double retrievalScore
) {}
