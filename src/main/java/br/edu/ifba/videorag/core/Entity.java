package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Knowledge-graph node. Entities are keyed by their normalized id and shared across videos;
 * the description embedding always reflects the current description.
 */
public record Entity(
    @NotNull String entityId,
    @NotNull String label,
    @NotNull String description,
    @Nullable float[] descriptionEmbedding
) {
    public Entity {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId is required");
        }
        label = label != null ? label : entityId;
        description = description != null ? description : "";
    }

    @NotNull
    public Entity withDescription(@NotNull String newDescription, @Nullable float[] newEmbedding) {
        return new Entity(entityId, label, newDescription, newEmbedding);
    }

    /**
     * Normalizes an extracted entity id so that the same concept maps to the same node:
     * trimmed, lower-cased, runs of non-alphanumeric characters collapsed to a single underscore.
     *
     * @param rawId id as produced by the extraction model
     * @return normalized id, or an empty string when nothing usable remains
     */
    @NotNull
    public static String normalizeId(@Nullable String rawId) {
        if (rawId == null) {
            return "";
        }
        String normalized = rawId.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", "_");
        normalized = normalized.replaceAll("^_+", "").replaceAll("_+$", "");
        return normalized;
    }
}
