package br.edu.ifba.videorag.retrieval;

import org.jetbrains.annotations.NotNull;

/**
 * A clip id scored by one retrieval channel, before hydration.
 */
public record ChannelHit(@NotNull String clipId, double score, @NotNull SourceType sourceType) {}
