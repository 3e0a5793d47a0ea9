package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

/**
 * Speech-to-text output for one clip. The text is empty, never null, when transcription failed.
 */
public record AudioTranscript(@NotNull String clipId, @NotNull String text) {

    public AudioTranscript {
        if (clipId == null || clipId.isBlank()) {
            throw new IllegalArgumentException("clipId is required");
        }
        text = text != null ? text : "";
    }
}
