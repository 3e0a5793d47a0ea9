package br.edu.ifba.videorag.indexing;

import org.jetbrains.annotations.NotNull;

/**
 * What one indexing run produced.
 */
public record IndexingSummary(
    @NotNull String videoId,
    int clipCount,
    int chunkCount,
    int degradedTranscripts,
    int degradedCaptions,
    @NotNull GraphBuildReport graphReport
) {}
