package br.edu.ifba.videorag.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the VideoRAG engine, read from application.properties with the prefix "videorag".
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>indexing</b> - clip duration, frames per clip and chunk size</li>
 *   <li><b>retrieval</b> - top-K for the graph and visual channels, traversal depth</li>
 *   <li><b>generation</b> - query-time frame count and answer temperature</li>
 *   <li><b>storage</b> - vector collection names and job-status expiry</li>
 *   <li><b>paths</b> - working directories shared by every worker</li>
 *   <li><b>retry</b> - graph extraction retry policy</li>
 *   <li><b>concurrency</b> - in-flight call limit per collaborator class</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * videorag.indexing.clip-duration-seconds=30
 * videorag.indexing.chunk-size-in-clips=3
 * videorag.retrieval.visual-top-k=10
 * videorag.concurrency.llm=8
 * }</pre>
 */
@ConfigMapping(prefix = "videorag")
public interface VideoRAGProperties {

    Indexing indexing();

    Retrieval retrieval();

    Generation generation();

    Storage storage();

    Paths paths();

    Retry retry();

    Concurrency concurrency();

    Models models();

    Media media();

    interface Indexing {

        @WithName("clip-duration-seconds")
        @WithDefault("30")
        int clipDurationSeconds();

        /**
         * Frames sampled per clip for the initial, query-agnostic caption.
         */
        @WithName("initial-frames-per-clip")
        @WithDefault("5")
        int initialFramesPerClip();

        @WithName("chunk-size-in-clips")
        @WithDefault("3")
        int chunkSizeInClips();

        @WithName("embedding-batch-size")
        @WithDefault("32")
        int embeddingBatchSize();
    }

    interface Retrieval {

        @WithName("graph-top-k-entities")
        @WithDefault("5")
        int graphTopKEntities();

        @WithName("graph-max-hops")
        @WithDefault("2")
        int graphMaxHops();

        @WithName("visual-top-k")
        @WithDefault("10")
        int visualTopK();
    }

    interface Generation {

        /**
         * Frames sampled per clip for query-focused re-captioning.
         */
        @WithName("frames-per-clip")
        @WithDefault("15")
        int framesPerClip();

        @WithDefault("0.2")
        double temperature();
    }

    interface Storage {

        @WithName("clips-collection")
        @WithDefault("video_clips")
        String clipsCollection();

        @WithName("chunks-collection")
        @WithDefault("text_chunks")
        String chunksCollection();

        @WithName("job-status-ttl")
        @WithDefault("PT1H")
        Duration jobStatusTtl();

        /**
         * How often expired entries are purged, in scheduler syntax such as {@code 5m}.
         */
        @WithName("sweep-interval")
        @WithDefault("5m")
        String sweepInterval();
    }

    interface Paths {

        @WithName("processing-output-dir")
        @WithDefault("data/processed_videos")
        Path processingOutputDir();

        @WithName("temp-frame-dir")
        @WithDefault("data/temp_frames")
        Path tempFrameDir();

        /**
         * Root under which clips are found at query time as {@code {videoId}/clips/{clipId}.mp4}.
         */
        @WithName("shared-clip-storage")
        @WithDefault("data/processed_videos")
        Path sharedClipStorage();
    }

    interface Retry {

        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("base-delay")
        @WithDefault("PT5S")
        Duration baseDelay();

        @WithName("backoff-factor")
        @WithDefault("2.0")
        double backoffFactor();
    }

    interface Concurrency {

        @WithDefault("8")
        int llm();

        @WithDefault("4")
        int embedding();

        @WithName("speech-to-text")
        @WithDefault("4")
        int speechToText();

        @WithDefault("4")
        int captioning();

        @WithDefault("2")
        int media();

        /**
         * Videos indexed at the same time by the job service.
         */
        @WithName("indexing-jobs")
        @WithDefault("2")
        int indexingJobs();
    }

    interface Models {

        /**
         * Model used for extraction, reformulation, judging and other JSON-mode indexing calls.
         */
        @WithDefault("gpt-4o-mini")
        String indexer();

        /**
         * Model used for the final answer.
         */
        @WithDefault("gpt-4o")
        String generator();

        @WithDefault("gpt-4o-mini")
        String vlm();

        @WithDefault("text-embedding-3-small")
        String embedding();

        @WithName("speech-to-text")
        @WithDefault("whisper-1")
        String speechToText();

        /**
         * Spoken language hint passed to the speech-to-text model.
         */
        @WithName("transcription-language")
        @WithDefault("en")
        String transcriptionLanguage();
    }

    interface Media {

        @WithName("ffmpeg-path")
        @WithDefault("ffmpeg")
        String ffmpegPath();

        @WithName("ffprobe-path")
        @WithDefault("ffprobe")
        String ffprobePath();
    }

    /**
     * Validates the configuration values.
     *
     * @throws IllegalArgumentException if any size or limit is not positive
     */
    default void validate() {
        requirePositive("videorag.indexing.clip-duration-seconds", indexing().clipDurationSeconds());
        requirePositive("videorag.indexing.initial-frames-per-clip", indexing().initialFramesPerClip());
        requirePositive("videorag.indexing.chunk-size-in-clips", indexing().chunkSizeInClips());
        requirePositive("videorag.indexing.embedding-batch-size", indexing().embeddingBatchSize());
        requirePositive("videorag.retrieval.graph-top-k-entities", retrieval().graphTopKEntities());
        requirePositive("videorag.retrieval.graph-max-hops", retrieval().graphMaxHops());
        requirePositive("videorag.retrieval.visual-top-k", retrieval().visualTopK());
        requirePositive("videorag.generation.frames-per-clip", generation().framesPerClip());
        requirePositive("videorag.retry.max-attempts", retry().maxAttempts());
        requirePositive("videorag.concurrency.llm", concurrency().llm());
        requirePositive("videorag.concurrency.embedding", concurrency().embedding());
        requirePositive("videorag.concurrency.speech-to-text", concurrency().speechToText());
        requirePositive("videorag.concurrency.captioning", concurrency().captioning());
        requirePositive("videorag.concurrency.media", concurrency().media());
        requirePositive("videorag.concurrency.indexing-jobs", concurrency().indexingJobs());
        if (retry().backoffFactor() < 1.0) {
            throw new IllegalArgumentException("videorag.retry.backoff-factor must be >= 1.0");
        }
    }

    /**
     * Maps the configuration tree onto the record consumed by the engine.
     */
    default VideoRAGConfig toConfig() {
        return new VideoRAGConfig(
            new VideoRAGConfig.Indexing(
                indexing().clipDurationSeconds(),
                indexing().initialFramesPerClip(),
                indexing().chunkSizeInClips(),
                indexing().embeddingBatchSize()),
            new VideoRAGConfig.Retrieval(
                retrieval().graphTopKEntities(),
                retrieval().graphMaxHops(),
                retrieval().visualTopK()),
            new VideoRAGConfig.Generation(
                generation().framesPerClip(),
                generation().temperature()),
            new VideoRAGConfig.Storage(
                storage().clipsCollection(),
                storage().chunksCollection(),
                storage().jobStatusTtl()),
            new VideoRAGConfig.Directories(
                paths().processingOutputDir(),
                paths().tempFrameDir(),
                paths().sharedClipStorage()),
            new VideoRAGConfig.Concurrency(
                concurrency().llm(),
                concurrency().embedding(),
                concurrency().speechToText(),
                concurrency().captioning(),
                concurrency().media()),
            new VideoRAGConfig.Retry(
                retry().maxAttempts(),
                retry().baseDelay(),
                retry().backoffFactor())
        );
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }
}
