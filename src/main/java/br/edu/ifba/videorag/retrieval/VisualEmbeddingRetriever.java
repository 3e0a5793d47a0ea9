package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.storage.VectorStorage;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding-based retrieval channel: a scene description of the query is embedded in the
 * multimodal text space and matched against clip vectors.
 */
public class VisualEmbeddingRetriever implements RetrievalChannel {

    private static final Logger logger = LoggerFactory.getLogger(VisualEmbeddingRetriever.class);

    private final LLMFunction llmFunction;
    private final MultimodalEmbeddingFunction multimodalEmbedding;
    private final VectorStorage vectorStorage;
    private final String clipsCollection;
    private final int topK;

    public VisualEmbeddingRetriever(
            @NotNull LLMFunction llmFunction,
            @NotNull MultimodalEmbeddingFunction multimodalEmbedding,
            @NotNull VectorStorage vectorStorage,
            @NotNull String clipsCollection,
            int topK) {
        this.llmFunction = llmFunction;
        this.multimodalEmbedding = multimodalEmbedding;
        this.vectorStorage = vectorStorage;
        this.clipsCollection = clipsCollection;
        this.topK = topK;
    }

    @Override
    @NotNull
    public CompletableFuture<List<ChannelHit>> retrieve(@NotNull String query) {
        logger.info("Visual retrieval for '{}'", query);
        return Futures.call(() -> llmFunction.complete(
                VideoRAGPrompts.sceneDescription(query),
                null,
                CompletionOptions.defaults()))
            .thenCompose(scene -> multimodalEmbedding.embedText(scene.strip()))
            .thenCompose(vector -> vectorStorage.search(clipsCollection, vector, topK))
            .thenApply(results -> results.stream()
                .map(result -> new ChannelHit(result.id(), result.score(), SourceType.VISUAL_EMBEDDING))
                .toList())
            .exceptionally(error -> {
                logger.error("Visual retrieval failed: {}", Futures.describe(error));
                return List.of();
            });
    }
}
