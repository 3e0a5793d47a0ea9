package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

/**
 * Directed knowledge-graph edge. Edges are merged on {@code (sourceId, type, targetId)}.
 */
public record Relation(
    @NotNull String sourceId,
    @NotNull String targetId,
    @NotNull String type,
    @NotNull String description
) {
    /** Provenance edge type linking an entity to the chunk that justified it. */
    public static final String SOURCED_FROM = "SOURCED_FROM";

    public Relation {
        if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Relation endpoints are required");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Relation type is required");
        }
        description = description != null ? description : "";
    }

    @NotNull
    public static Relation sourcedFrom(@NotNull Entity entity, @NotNull String chunkId) {
        return new Relation(
            entity.entityId(),
            chunkId,
            SOURCED_FROM,
            "Entity '" + entity.label() + "' was sourced from chunk " + chunkId + "."
        );
    }

    public boolean isProvenance() {
        return SOURCED_FROM.equals(type);
    }

    /**
     * Key under which the edge is merged.
     */
    @NotNull
    public String mergeKey() {
        return sourceId + "|" + type + "|" + targetId;
    }
}
