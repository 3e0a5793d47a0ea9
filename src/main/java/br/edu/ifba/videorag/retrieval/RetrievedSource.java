package br.edu.ifba.videorag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * A candidate clip located in its source video, with the score it was retrieved at.
 */
public record RetrievedSource(
    @JsonProperty("clip_id") @NotNull String clipId,
    @JsonProperty("source_video_id") @NotNull String sourceVideoId,
    @JsonProperty("start_time") double startTime,
    @JsonProperty("end_time") double endTime,
    @JsonProperty("retrieval_score") double retrievalScore,
    @JsonProperty("source_type") @NotNull SourceType sourceType
) {}
