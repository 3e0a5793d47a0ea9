package br.edu.ifba.videorag.storage.impl;

import br.edu.ifba.videorag.storage.VectorStorage;
import br.edu.ifba.videorag.storage.VectorStorageException;
import br.edu.ifba.videorag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector storage implementation.
 * Uses brute-force cosine similarity search per named collection.
 * Suitable for development and small-scale deployments.
 */
public class InMemoryVectorStorage implements VectorStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStorage.class);

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, StoredVector>> collections = new ConcurrentHashMap<>();
    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryVectorStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> add(
            @NotNull String collection,
            @NotNull List<String> ids,
            @NotNull List<float[]> vectors,
            @NotNull List<Map<String, String>> metadata) {
        ensureInitialized();
        if (ids.size() != vectors.size() || ids.size() != metadata.size()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                "ids, vectors and metadata must have the same size: "
                    + ids.size() + ", " + vectors.size() + ", " + metadata.size()));
        }
        return CompletableFuture.runAsync(() -> {
            final Map<String, StoredVector> target = collections.computeIfAbsent(collection, k -> new ConcurrentHashMap<>());
            final int dimension = target.values().stream()
                .findAny()
                .map(stored -> stored.vector().length)
                .orElse(vectors.isEmpty() ? 0 : vectors.get(0).length);
            for (int i = 0; i < vectors.size(); i++) {
                if (vectors.get(i).length != dimension) {
                    throw new VectorStorageException("Vector " + ids.get(i) + " has dimension " + vectors.get(i).length
                        + " but collection " + collection + " holds dimension " + dimension);
                }
            }
            for (int i = 0; i < ids.size(); i++) {
                target.put(ids.get(i), new StoredVector(ids.get(i), vectors.get(i), Map.copyOf(metadata.get(i))));
            }
            logger.debug("Added {} vectors to collection {}", ids.size(), collection);
        });
    }

    @Override
    public CompletableFuture<List<VectorSearchResult>> search(@NotNull String collection, @NotNull float[] queryVector, int topK) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, StoredVector> target = collections.get(collection);
            if (target == null) {
                return List.of();
            }
            return target.values().stream()
                .filter(stored -> stored.vector().length == queryVector.length)
                .map(stored -> new VectorSearchResult(
                    stored.id(),
                    EmbeddingUtil.cosineSimilarity(queryVector, stored.vector()),
                    stored.metadata()))
                .sorted(Comparator.comparingDouble(VectorSearchResult::score).reversed()
                    .thenComparing(VectorSearchResult::id))
                .limit(Math.max(topK, 0))
                .toList();
        });
    }

    public int size(@NotNull String collection) {
        final Map<String, StoredVector> target = collections.get(collection);
        return target == null ? 0 : target.size();
    }

    @Override
    public void close() {
        collections.clear();
        initialized = false;
        logger.info("InMemoryVectorStorage closed");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }

    private record StoredVector(String id, float[] vector, Map<String, String> metadata) {}
}
