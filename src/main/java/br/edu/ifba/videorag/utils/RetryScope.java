package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;

/**
 * What a retried unit of work belongs to: the pipeline stage and the item it processes.
 *
 * @param stage pipeline stage, for example {@code graph-build}
 * @param itemId the chunk, clip or video the attempt works on
 */
public record RetryScope(@NotNull String stage, @NotNull String itemId) {

    public static final String GRAPH_BUILD = "graph-build";

    public RetryScope {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage is required");
        }
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required");
        }
    }

    @NotNull
    public static RetryScope graphBuild(@NotNull String chunkId) {
        return new RetryScope(GRAPH_BUILD, chunkId);
    }

    @Override
    public String toString() {
        return stage + " of " + itemId;
    }
}
