package br.edu.ifba.videorag.embedding;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embeds video clips and text into a shared multimodal space.
 * Results are keyed by the modality that produced them.
 */
public interface MultimodalEmbeddingFunction {

    enum Modality {
        VISION,
        TEXT
    }

    /**
     * Embeds video files. The {@link Modality#VISION} entry holds one vector per path, same order.
     */
    CompletableFuture<Map<Modality, List<float[]>>> embedVideos(@NotNull List<Path> videoPaths);

    /**
     * Embeds text into the video space. The {@link Modality#TEXT} entry holds one vector per text, same order.
     */
    CompletableFuture<Map<Modality, List<float[]>>> embedTexts(@NotNull List<String> texts);

    default CompletableFuture<float[]> embedText(@NotNull String text) {
        return embedTexts(List.of(text)).thenApply(byModality -> {
            final List<float[]> vectors = byModality.get(Modality.TEXT);
            if (vectors == null || vectors.isEmpty()) {
                throw new EmbeddingException("Multimodal embedder returned no text vector");
            }
            return vectors.get(0);
        });
    }
}
