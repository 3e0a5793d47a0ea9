package br.edu.ifba.videorag.storage;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Named-collection vector store.
 *
 * Implementations: InMemoryVectorStorage
 */
public interface VectorStorage extends AutoCloseable {

    CompletableFuture<Void> initialize();

    /**
     * Adds (or replaces) vectors in a collection. The three lists are parallel.
     *
     * @throws IllegalArgumentException when list sizes differ
     * @throws VectorStorageException (in the returned future) when a vector's dimension differs from the collection's
     */
    CompletableFuture<Void> add(
        @NotNull String collection,
        @NotNull List<String> ids,
        @NotNull List<float[]> vectors,
        @NotNull List<Map<String, String>> metadata
    );

    /**
     * Nearest-neighbour search by cosine similarity.
     *
     * @return up to {@code topK} results, best first; empty for an unknown collection
     */
    CompletableFuture<List<VectorSearchResult>> search(@NotNull String collection, @NotNull float[] queryVector, int topK);

    record VectorSearchResult(
        @NotNull String id,
        double score,
        @NotNull Map<String, String> metadata
    ) {}

    @Override
    void close();
}
