package br.edu.ifba.videorag.storage.impl;

import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.MetadataStorageException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory clip metadata store with the per-video aggregation used by the library view.
 */
public class InMemoryMetadataStorage implements MetadataStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMetadataStorage.class);

    private final ConcurrentHashMap<String, ClipMetadata> clips = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile boolean initialized = false;

    public InMemoryMetadataStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryMetadataStorage(@NotNull Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryMetadataStorage initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsert(@NotNull ClipMetadata metadata) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> clips.compute(metadata.clipId(), (id, existing) -> {
            if (existing != null && !existing.sourceVideoId().equals(metadata.sourceVideoId())) {
                throw new MetadataStorageException("Clip " + id + " already belongs to video " + existing.sourceVideoId());
            }
            final Instant createdAt = existing != null && existing.createdAt() != null
                ? existing.createdAt()
                : clock.instant();
            return metadata.withCreatedAt(createdAt);
        }));
    }

    @Override
    public CompletableFuture<Map<String, ClipMetadata>> getMany(@NotNull Collection<String> clipIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, ClipMetadata> result = new HashMap<>();
            for (String clipId : clipIds) {
                final ClipMetadata metadata = clips.get(clipId);
                if (metadata != null) {
                    result.put(clipId, metadata);
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<VideoSummary>> summarizeVideos(@Nullable String search) {
        ensureInitialized();
        final String needle = search != null && !search.isBlank() ? search.toLowerCase(Locale.ROOT).strip() : null;
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, List<ClipMetadata>> byVideo = clips.values().stream()
                .filter(clip -> needle == null || matches(clip, needle))
                .collect(Collectors.groupingBy(ClipMetadata::sourceVideoId));

            return byVideo.entrySet().stream()
                .map(entry -> new VideoSummary(
                    entry.getKey(),
                    entry.getValue().size(),
                    entry.getValue().stream().mapToDouble(ClipMetadata::endTime).max().orElse(0.0),
                    entry.getValue().stream()
                        .map(ClipMetadata::createdAt)
                        .min(Comparator.naturalOrder())
                        .orElse(Instant.EPOCH)))
                .sorted(Comparator.comparing(VideoSummary::indexedAt).reversed()
                    .thenComparing(VideoSummary::videoId))
                .toList();
        });
    }

    @Override
    public void close() {
        clips.clear();
        initialized = false;
        logger.info("InMemoryMetadataStorage closed");
    }

    private static boolean matches(ClipMetadata clip, String needle) {
        return clip.sourceVideoId().toLowerCase(Locale.ROOT).contains(needle)
            || clip.initialCaption().toLowerCase(Locale.ROOT).contains(needle)
            || clip.transcript().toLowerCase(Locale.ROOT).contains(needle);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
