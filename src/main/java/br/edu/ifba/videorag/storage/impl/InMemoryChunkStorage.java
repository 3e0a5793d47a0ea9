package br.edu.ifba.videorag.storage.impl;

import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.ChunkStorageException;
import br.edu.ifba.videorag.utils.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key-value storage with per-key expiry.
 * Expired entries are invisible to reads and removed by {@link #purgeExpired()}.
 */
public class InMemoryChunkStorage implements ChunkStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryChunkStorage.class);

    private final ConcurrentHashMap<String, StoredValue> storage = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile boolean initialized = false;

    public InMemoryChunkStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryChunkStorage(@NotNull Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryChunkStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> set(@NotNull String key, @NotNull String value, @Nullable Duration ttl) {
        ensureInitialized();
        final Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
        return CompletableFuture.runAsync(() -> storage.put(key, new StoredValue(value, expiresAt)));
    }

    @Override
    public CompletableFuture<Optional<String>> get(@NotNull String key) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> Optional.ofNullable(readLive(key)));
    }

    @Override
    public CompletableFuture<Map<String, String>> mget(@NotNull Collection<String> keys) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, String> result = new HashMap<>();
            for (String key : keys) {
                final String value = readLive(key);
                if (value != null) {
                    result.put(key, value);
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<Void> addChunks(@NotNull List<TextChunk> chunks) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (TextChunk chunk : chunks) {
                try {
                    storage.put(CHUNK_KEY_PREFIX + chunk.chunkId(),
                        new StoredValue(JsonUtil.MAPPER.writeValueAsString(chunk), null));
                } catch (JsonProcessingException e) {
                    throw new ChunkStorageException("Cannot serialize chunk " + chunk.chunkId(), e);
                }
            }
            logger.debug("Stored {} chunks", chunks.size());
        });
    }

    @Override
    public CompletableFuture<List<TextChunk>> getChunks(@NotNull Collection<String> chunkIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final List<TextChunk> result = new ArrayList<>();
            for (String chunkId : chunkIds) {
                final String json = readLive(CHUNK_KEY_PREFIX + chunkId);
                if (json == null) {
                    logger.debug("Chunk {} not found", chunkId);
                    continue;
                }
                try {
                    result.add(JsonUtil.MAPPER.readValue(json, TextChunk.class));
                } catch (JsonProcessingException e) {
                    throw new ChunkStorageException("Corrupt chunk record " + chunkId, e);
                }
            }
            return result;
        });
    }

    @Override
    public int purgeExpired() {
        final Instant now = clock.instant();
        final int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        final int removed = before - storage.size();
        if (removed > 0) {
            logger.debug("Purged {} expired entries", removed);
        }
        return Math.max(removed, 0);
    }

    @Override
    public void close() {
        storage.clear();
        initialized = false;
        logger.info("InMemoryChunkStorage closed");
    }

    private String readLive(String key) {
        final StoredValue stored = storage.get(key);
        if (stored == null) {
            return null;
        }
        if (stored.isExpired(clock.instant())) {
            storage.remove(key, stored);
            return null;
        }
        return stored.value();
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }

    private record StoredValue(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
