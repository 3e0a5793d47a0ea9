package br.edu.ifba.videorag.indexing;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of building the knowledge graph for one video's chunks.
 *
 * @param chunksTotal chunks submitted
 * @param chunksMerged chunks whose merge sequence completed
 * @param failedChunkIds chunks that still failed after retries
 * @param entitiesMerged entity upserts across all merged chunks
 * @param descriptionsSynthesized upserts that triggered description synthesis
 * @param relationsWritten provenance and entity-entity edges written
 */
public record GraphBuildReport(
    int chunksTotal,
    int chunksMerged,
    @NotNull List<String> failedChunkIds,
    int entitiesMerged,
    int descriptionsSynthesized,
    int relationsWritten
) {
    public static GraphBuildReport empty() {
        return new GraphBuildReport(0, 0, List.of(), 0, 0, 0);
    }

    public boolean hasFailures() {
        return !failedChunkIds.isEmpty();
    }
}
