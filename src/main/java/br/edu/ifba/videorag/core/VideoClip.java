package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

/**
 * A fixed-duration segment of a source video, the atomic unit of transcription and captioning.
 * Created by segmentation and referenced by id everywhere downstream.
 *
 * @param clipId unique id, derived from the source video id and the segment index
 * @param sourceVideoId id of the video the clip was cut from
 * @param clipPath path of the clip file, resolvable from every worker
 * @param startTime start offset in seconds
 * @param endTime end offset in seconds, always greater than {@code startTime}
 */
public record VideoClip(
    @NotNull String clipId,
    @NotNull String sourceVideoId,
    @NotNull String clipPath,
    double startTime,
    double endTime
) {
    public VideoClip {
        if (clipId == null || clipId.isBlank()) {
            throw new IllegalArgumentException("clipId is required");
        }
        if (sourceVideoId == null || sourceVideoId.isBlank()) {
            throw new IllegalArgumentException("sourceVideoId is required");
        }
        if (clipPath == null || clipPath.isBlank()) {
            throw new IllegalArgumentException("clipPath is required");
        }
        if (endTime <= startTime) {
            throw new IllegalArgumentException(
                "endTime must be greater than startTime for clip " + clipId + ": " + startTime + " >= " + endTime);
        }
    }
}
