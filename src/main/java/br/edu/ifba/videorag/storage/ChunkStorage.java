package br.edu.ifba.videorag.storage;

import br.edu.ifba.videorag.core.TextChunk;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Key-value store for raw text chunks and job-status records, with expiry support.
 *
 * Implementations: InMemoryChunkStorage
 */
public interface ChunkStorage extends AutoCloseable {

    /** Key prefix under which chunks are stored. */
    String CHUNK_KEY_PREFIX = "chunk:";

    CompletableFuture<Void> initialize();

    /**
     * @param ttl expiry, or {@code null} to keep the value indefinitely
     */
    CompletableFuture<Void> set(@NotNull String key, @NotNull String value, @Nullable Duration ttl);

    CompletableFuture<Optional<String>> get(@NotNull String key);

    /**
     * Bulk read. Missing or expired keys are absent from the result.
     */
    CompletableFuture<Map<String, String>> mget(@NotNull Collection<String> keys);

    /**
     * Stores chunks as JSON under {@code chunk:{chunkId}}.
     */
    CompletableFuture<Void> addChunks(@NotNull List<TextChunk> chunks);

    /**
     * Reads chunks by id. Missing chunks are skipped.
     */
    CompletableFuture<List<TextChunk>> getChunks(@NotNull Collection<String> chunkIds);

    /**
     * Drops expired entries.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    @Override
    void close();
}
