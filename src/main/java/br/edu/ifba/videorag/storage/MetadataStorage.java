package br.edu.ifba.videorag.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Document store of per-clip metadata, the source of candidate hydration and the video library.
 *
 * Implementations: InMemoryMetadataStorage
 */
public interface MetadataStorage extends AutoCloseable {

    CompletableFuture<Void> initialize();

    /**
     * Inserts or updates clip metadata by clip id. {@code createdAt} is kept from the first insert.
     * The returned future fails with {@link MetadataStorageException} if the clip id belongs to another video.
     */
    CompletableFuture<Void> upsert(@NotNull ClipMetadata metadata);

    /**
     * Bulk read. Unknown clip ids are absent from the result.
     */
    CompletableFuture<Map<String, ClipMetadata>> getMany(@NotNull Collection<String> clipIds);

    /**
     * One summary row per source video, newest first.
     *
     * @param search optional case-insensitive text filter over video id, captions and transcripts
     */
    CompletableFuture<List<VideoSummary>> summarizeVideos(@Nullable String search);

    record ClipMetadata(
        @NotNull String clipId,
        @NotNull String sourceVideoId,
        @NotNull String clipPath,
        double startTime,
        double endTime,
        @NotNull String initialCaption,
        @NotNull String transcript,
        @Nullable Instant createdAt
    ) {
        public ClipMetadata withCreatedAt(@NotNull Instant instant) {
            return new ClipMetadata(clipId, sourceVideoId, clipPath, startTime, endTime, initialCaption, transcript, instant);
        }
    }

    /**
     * @param durationSeconds largest clip end time of the video
     * @param indexedAt earliest clip creation time of the video
     */
    record VideoSummary(
        @NotNull String videoId,
        int clipCount,
        double durationSeconds,
        @NotNull Instant indexedAt
    ) {}

    @Override
    void close();
}
