package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime settings consumed by the engine. Built from {@link VideoRAGProperties} by the
 * Quarkus service, or from {@link #defaults()} in tests.
 */
public record VideoRAGConfig(
    @NotNull Indexing indexing,
    @NotNull Retrieval retrieval,
    @NotNull Generation generation,
    @NotNull Storage storage,
    @NotNull Directories directories,
    @NotNull Concurrency concurrency,
    @NotNull Retry retry
) {

    public record Indexing(
        int clipDurationSeconds,
        int initialFramesPerClip,
        int chunkSizeInClips,
        int embeddingBatchSize
    ) {}

    public record Retrieval(
        int graphTopKEntities,
        int graphMaxHops,
        int visualTopK
    ) {}

    public record Generation(
        int framesPerClip,
        double temperature
    ) {}

    public record Storage(
        @NotNull String clipsCollection,
        @NotNull String chunksCollection,
        @NotNull Duration jobStatusTtl
    ) {}

    public record Directories(
        @NotNull Path processingOutputDir,
        @NotNull Path tempFrameDir,
        @NotNull Path sharedClipStorage
    ) {}

    /**
     * Maximum number of in-flight calls per collaborator class.
     */
    public record Concurrency(
        int llm,
        int embedding,
        int speechToText,
        int captioning,
        int media
    ) {}

    public record Retry(
        int maxAttempts,
        @NotNull Duration baseDelay,
        double backoffFactor
    ) {}

    public static VideoRAGConfig defaults() {
        return new VideoRAGConfig(
            new Indexing(30, 5, 3, 32),
            new Retrieval(5, 2, 10),
            new Generation(15, 0.2),
            new Storage("video_clips", "text_chunks", Duration.ofHours(1)),
            new Directories(
                Path.of("data", "processed_videos"),
                Path.of("data", "temp_frames"),
                Path.of("data", "processed_videos")
            ),
            new Concurrency(8, 4, 4, 4, 2),
            new Retry(3, Duration.ofSeconds(5), 2.0)
        );
    }

    /**
     * Returns a copy whose working directories live under {@code root}.
     */
    public VideoRAGConfig withDirectories(@NotNull Path root) {
        final Path processed = root.resolve("processed_videos");
        return new VideoRAGConfig(
            indexing,
            retrieval,
            generation,
            storage,
            new Directories(processed, root.resolve("temp_frames"), processed),
            concurrency,
            retry
        );
    }

    public VideoRAGConfig withRetry(@NotNull Retry newRetry) {
        return new VideoRAGConfig(indexing, retrieval, generation, storage, directories, concurrency, newRetry);
    }

    public VideoRAGConfig withIndexing(@NotNull Indexing newIndexing) {
        return new VideoRAGConfig(newIndexing, retrieval, generation, storage, directories, concurrency, retry);
    }
}
