package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

/**
 * Query-agnostic caption produced for one clip at indexing time.
 * The text is empty, never null, when captioning failed.
 */
public record VisualCaption(@NotNull String clipId, @NotNull String text) {

    public VisualCaption {
        if (clipId == null || clipId.isBlank()) {
            throw new IllegalArgumentException("clipId is required");
        }
        text = text != null ? text : "";
    }
}
