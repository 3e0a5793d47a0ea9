package br.edu.ifba.videorag.indexing;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Entities and relationships extracted from one chunk.
 */
public record ExtractionResult(
    @NotNull List<ExtractedEntity> entities,
    @NotNull List<ExtractedRelationship> relationships
) {

    public record ExtractedEntity(
        @NotNull String entityId,
        @NotNull String label,
        @NotNull String description
    ) {}

    public record ExtractedRelationship(
        @NotNull String sourceId,
        @NotNull String targetId,
        @NotNull String type,
        @NotNull String description
    ) {}

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
