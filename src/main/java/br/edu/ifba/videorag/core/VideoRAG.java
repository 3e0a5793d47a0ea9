package br.edu.ifba.videorag.core;

import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.generation.GenerationEnrichmentEngine;
import br.edu.ifba.videorag.generation.QueryResponse;
import br.edu.ifba.videorag.indexing.ClipAnnotator;
import br.edu.ifba.videorag.indexing.IndexPersister;
import br.edu.ifba.videorag.indexing.IndexingPipeline;
import br.edu.ifba.videorag.indexing.IndexingSummary;
import br.edu.ifba.videorag.indexing.JobStatus;
import br.edu.ifba.videorag.indexing.JobStatusTracker;
import br.edu.ifba.videorag.indexing.KnowledgeGraphMerger;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.media.CaptioningFunction;
import br.edu.ifba.videorag.media.FfmpegFrameExtractor;
import br.edu.ifba.videorag.media.FfmpegVideoSegmenter;
import br.edu.ifba.videorag.media.FrameExtractor;
import br.edu.ifba.videorag.media.ProcessRunner;
import br.edu.ifba.videorag.media.SpeechToTextFunction;
import br.edu.ifba.videorag.media.VideoSegmenter;
import br.edu.ifba.videorag.retrieval.CandidateClipInfo;
import br.edu.ifba.videorag.retrieval.CommunityDetector;
import br.edu.ifba.videorag.retrieval.RelevanceFilter;
import br.edu.ifba.videorag.retrieval.RetrievalFusionEngine;
import br.edu.ifba.videorag.retrieval.RetrievalResult;
import br.edu.ifba.videorag.retrieval.TextualGraphRetriever;
import br.edu.ifba.videorag.retrieval.VisualEmbeddingRetriever;
import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.MetadataStorage.VideoSummary;
import br.edu.ifba.videorag.storage.VectorStorage;
import br.edu.ifba.videorag.utils.ConcurrencyLimiter;
import br.edu.ifba.videorag.utils.RetryPolicy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application context for indexing and querying a video library.
 *
 * <p>Holds the model collaborators, the stores, one concurrency limiter per collaborator class
 * and the media worker pool. Every collaborator is wrapped so that its calls go through its
 * limiter, which bounds fan-out across concurrent jobs and queries alike.</p>
 *
 * <p>Call {@link #open()} before use and {@link #close()} when done.</p>
 */
public class VideoRAG implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VideoRAG.class);

    private final VideoRAGConfig config;

    private final GraphStorage graphStorage;
    private final VectorStorage vectorStorage;
    private final ChunkStorage chunkStorage;
    private final MetadataStorage metadataStorage;

    private final ConcurrencyLimiter llmLimiter;
    private final ConcurrencyLimiter embeddingLimiter;
    private final ConcurrencyLimiter speechToTextLimiter;
    private final ConcurrencyLimiter captioningLimiter;
    private final ConcurrencyLimiter mediaLimiter;

    private final LLMFunction llmFunction;
    private final EmbeddingFunction embeddingFunction;
    private final MultimodalEmbeddingFunction multimodalEmbeddingFunction;
    private final SpeechToTextFunction speechToTextFunction;
    private final CaptioningFunction captioningFunction;
    private final VideoSegmenter videoSegmenter;
    private final FrameExtractor frameExtractor;

    private final ExecutorService mediaExecutor;
    private final RetryPolicy retryPolicy;

    private volatile boolean opened = false;
    private volatile JobStatusTracker statusTracker;
    private volatile IndexingPipeline indexingPipeline;
    private volatile RetrievalFusionEngine retrievalEngine;
    private volatile GenerationEnrichmentEngine generationEngine;

    private VideoRAG(Builder builder) {
        this.config = builder.config;
        this.graphStorage = builder.graphStorage;
        this.vectorStorage = builder.vectorStorage;
        this.chunkStorage = builder.chunkStorage;
        this.metadataStorage = builder.metadataStorage;

        final VideoRAGConfig.Concurrency limits = config.concurrency();
        this.llmLimiter = new ConcurrencyLimiter("llm", limits.llm());
        this.embeddingLimiter = new ConcurrencyLimiter("embedding", limits.embedding());
        this.speechToTextLimiter = new ConcurrencyLimiter("speech-to-text", limits.speechToText());
        this.captioningLimiter = new ConcurrencyLimiter("captioning", limits.captioning());
        this.mediaLimiter = new ConcurrencyLimiter("media", limits.media());

        this.mediaExecutor = Executors.newFixedThreadPool(limits.media(), new MediaThreadFactory());

        final LLMFunction llm = builder.llmFunction;
        final EmbeddingFunction embedding = builder.embeddingFunction;
        final MultimodalEmbeddingFunction multimodal = builder.multimodalEmbeddingFunction;
        final SpeechToTextFunction speechToText = builder.speechToTextFunction;
        final CaptioningFunction captioning = builder.captioningFunction;

        this.llmFunction = (prompt, systemPrompt, options) ->
            llmLimiter.submit(() -> llm.complete(prompt, systemPrompt, options));
        this.embeddingFunction = texts -> embeddingLimiter.submit(() -> embedding.embed(texts));
        this.multimodalEmbeddingFunction = new MultimodalEmbeddingFunction() {
            @Override
            public CompletableFuture<Map<Modality, List<float[]>>> embedVideos(@NotNull List<Path> videoPaths) {
                return embeddingLimiter.submit(() -> multimodal.embedVideos(videoPaths));
            }

            @Override
            public CompletableFuture<Map<Modality, List<float[]>>> embedTexts(@NotNull List<String> texts) {
                return embeddingLimiter.submit(() -> multimodal.embedTexts(texts));
            }
        };
        this.speechToTextFunction = clip -> speechToTextLimiter.submit(() -> speechToText.transcribe(clip));
        this.captioningFunction = (frames, prompt) -> captioningLimiter.submit(() -> captioning.caption(frames, prompt));

        final ProcessRunner processRunner = new ProcessRunner();
        final VideoSegmenter segmenter = builder.videoSegmenter != null
            ? builder.videoSegmenter
            : new FfmpegVideoSegmenter(builder.ffmpegPath, processRunner, mediaExecutor);
        final FrameExtractor extractor = builder.frameExtractor != null
            ? builder.frameExtractor
            : new FfmpegFrameExtractor(builder.ffmpegPath, builder.ffprobePath, processRunner, mediaExecutor);
        this.videoSegmenter = (video, clipDuration, outputDir) ->
            mediaLimiter.submit(() -> segmenter.segment(video, clipDuration, outputDir));
        this.frameExtractor = (clip, count, outputDir) ->
            mediaLimiter.submit(() -> extractor.extract(clip, count, outputDir));

        final VideoRAGConfig.Retry retry = config.retry();
        this.retryPolicy = new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.backoffFactor());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Initializes every store and assembles the engines. Idempotent.
     */
    public synchronized CompletableFuture<Void> open() {
        if (opened) {
            return CompletableFuture.completedFuture(null);
        }
        logger.info("Opening VideoRAG context...");
        return CompletableFuture.allOf(
            graphStorage.initialize(),
            vectorStorage.initialize(),
            chunkStorage.initialize(),
            metadataStorage.initialize()
        ).thenRun(() -> {
            assembleComponents();
            opened = true;
            logger.info("VideoRAG context opened (limits: llm={}, embedding={}, speech-to-text={}, captioning={}, media={})",
                llmLimiter.maxConcurrent(), embeddingLimiter.maxConcurrent(), speechToTextLimiter.maxConcurrent(),
                captioningLimiter.maxConcurrent(), mediaLimiter.maxConcurrent());
        });
    }

    private void assembleComponents() {
        final VideoRAGConfig.Indexing indexing = config.indexing();
        final VideoRAGConfig.Retrieval retrieval = config.retrieval();
        final VideoRAGConfig.Generation generation = config.generation();
        final VideoRAGConfig.Storage storage = config.storage();
        final VideoRAGConfig.Directories directories = config.directories();

        this.statusTracker = new JobStatusTracker(chunkStorage, storage.jobStatusTtl());

        final ClipAnnotator annotator = new ClipAnnotator(
            speechToTextFunction, captioningFunction, frameExtractor,
            directories.tempFrameDir(), indexing.initialFramesPerClip());
        final KnowledgeGraphMerger graphMerger = new KnowledgeGraphMerger(
            graphStorage, llmFunction, embeddingFunction, retryPolicy);
        final IndexPersister persister = new IndexPersister(
            embeddingFunction, multimodalEmbeddingFunction, vectorStorage, chunkStorage, metadataStorage,
            storage.chunksCollection(), storage.clipsCollection(), indexing.embeddingBatchSize());
        this.indexingPipeline = new IndexingPipeline(
            videoSegmenter, annotator, graphMerger, persister, statusTracker, config);

        this.retrievalEngine = new RetrievalFusionEngine(
            new TextualGraphRetriever(
                llmFunction, embeddingFunction, graphStorage, chunkStorage, new CommunityDetector(),
                retrieval.graphTopKEntities(), retrieval.graphMaxHops()),
            new VisualEmbeddingRetriever(
                llmFunction, multimodalEmbeddingFunction, vectorStorage,
                storage.clipsCollection(), retrieval.visualTopK()),
            metadataStorage,
            new RelevanceFilter(llmFunction));

        this.generationEngine = new GenerationEnrichmentEngine(
            llmFunction, captioningFunction, frameExtractor,
            directories.sharedClipStorage(), directories.tempFrameDir(),
            generation.framesPerClip(), generation.temperature());
    }

    /**
     * Indexes one video, reporting progress under {@code jobId} when given.
     */
    @NotNull
    public CompletableFuture<IndexingSummary> indexVideo(@NotNull Path videoPath, @Nullable String jobId) {
        ensureOpened();
        return indexingPipeline.runForVideo(videoPath, jobId);
    }

    /**
     * Records a new job in the {@code pending} state.
     */
    @NotNull
    public CompletableFuture<JobStatus> registerJob(@NotNull String jobId) {
        ensureOpened();
        final JobStatus status = JobStatus.pending(jobId);
        return statusTracker.save(status).thenApply(v -> status);
    }

    @NotNull
    public CompletableFuture<Optional<JobStatus>> jobStatus(@NotNull String jobId) {
        ensureOpened();
        return statusTracker.find(jobId);
    }

    @NotNull
    public CompletableFuture<RetrievalResult> retrieve(@NotNull String query) {
        ensureOpened();
        return retrievalEngine.retrieve(query);
    }

    @NotNull
    public CompletableFuture<QueryResponse> generate(@NotNull String query, @NotNull List<CandidateClipInfo> candidates) {
        ensureOpened();
        return generationEngine.generate(query, candidates);
    }

    @NotNull
    public CompletableFuture<List<VideoSummary>> summarizeVideos(@Nullable String search) {
        ensureOpened();
        return metadataStorage.summarizeVideos(search);
    }

    /**
     * Drops expired key-value entries such as finished job-status records.
     */
    public int purgeExpired() {
        return chunkStorage.purgeExpired();
    }

    @NotNull
    public VideoRAGConfig config() {
        return config;
    }

    @NotNull
    public List<ConcurrencyLimiter> limiters() {
        return List.of(llmLimiter, embeddingLimiter, speechToTextLimiter, captioningLimiter, mediaLimiter);
    }

    public boolean isOpened() {
        return opened;
    }

    @Override
    public void close() {
        logger.info("Closing VideoRAG context...");
        opened = false;
        mediaExecutor.shutdown();
        try {
            if (!mediaExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                mediaExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            mediaExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        graphStorage.close();
        vectorStorage.close();
        chunkStorage.close();
        metadataStorage.close();
        logger.info("VideoRAG context closed");
    }

    private void ensureOpened() {
        if (!opened) {
            throw new IllegalStateException("VideoRAG not opened. Call open() before using.");
        }
    }

    private static final class MediaThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable runnable) {
            final Thread thread = new Thread(runnable, "videorag-media-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * Builder for {@link VideoRAG}. The segmenter and frame extractor default to the ffmpeg tools.
     */
    public static class Builder {
        private VideoRAGConfig config = VideoRAGConfig.defaults();
        private LLMFunction llmFunction;
        private EmbeddingFunction embeddingFunction;
        private MultimodalEmbeddingFunction multimodalEmbeddingFunction;
        private SpeechToTextFunction speechToTextFunction;
        private CaptioningFunction captioningFunction;
        private GraphStorage graphStorage;
        private VectorStorage vectorStorage;
        private ChunkStorage chunkStorage;
        private MetadataStorage metadataStorage;
        private VideoSegmenter videoSegmenter;
        private FrameExtractor frameExtractor;
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";

        public Builder config(@NotNull VideoRAGConfig config) {
            this.config = config;
            return this;
        }

        public Builder llmFunction(@NotNull LLMFunction llmFunction) {
            this.llmFunction = llmFunction;
            return this;
        }

        public Builder embeddingFunction(@NotNull EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public Builder multimodalEmbeddingFunction(@NotNull MultimodalEmbeddingFunction multimodalEmbeddingFunction) {
            this.multimodalEmbeddingFunction = multimodalEmbeddingFunction;
            return this;
        }

        public Builder speechToTextFunction(@NotNull SpeechToTextFunction speechToTextFunction) {
            this.speechToTextFunction = speechToTextFunction;
            return this;
        }

        public Builder captioningFunction(@NotNull CaptioningFunction captioningFunction) {
            this.captioningFunction = captioningFunction;
            return this;
        }

        public Builder graphStorage(@NotNull GraphStorage graphStorage) {
            this.graphStorage = graphStorage;
            return this;
        }

        public Builder vectorStorage(@NotNull VectorStorage vectorStorage) {
            this.vectorStorage = vectorStorage;
            return this;
        }

        public Builder chunkStorage(@NotNull ChunkStorage chunkStorage) {
            this.chunkStorage = chunkStorage;
            return this;
        }

        public Builder metadataStorage(@NotNull MetadataStorage metadataStorage) {
            this.metadataStorage = metadataStorage;
            return this;
        }

        public Builder videoSegmenter(@NotNull VideoSegmenter videoSegmenter) {
            this.videoSegmenter = videoSegmenter;
            return this;
        }

        public Builder frameExtractor(@NotNull FrameExtractor frameExtractor) {
            this.frameExtractor = frameExtractor;
            return this;
        }

        public Builder ffmpegPath(@NotNull String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
            return this;
        }

        public Builder ffprobePath(@NotNull String ffprobePath) {
            this.ffprobePath = ffprobePath;
            return this;
        }

        public VideoRAG build() {
            if (llmFunction == null) {
                throw new IllegalStateException("llmFunction is required");
            }
            if (embeddingFunction == null) {
                throw new IllegalStateException("embeddingFunction is required");
            }
            if (multimodalEmbeddingFunction == null) {
                throw new IllegalStateException("multimodalEmbeddingFunction is required");
            }
            if (speechToTextFunction == null) {
                throw new IllegalStateException("speechToTextFunction is required");
            }
            if (captioningFunction == null) {
                throw new IllegalStateException("captioningFunction is required");
            }
            if (graphStorage == null) {
                throw new IllegalStateException("graphStorage is required");
            }
            if (vectorStorage == null) {
                throw new IllegalStateException("vectorStorage is required");
            }
            if (chunkStorage == null) {
                throw new IllegalStateException("chunkStorage is required");
            }
            if (metadataStorage == null) {
                throw new IllegalStateException("metadataStorage is required");
            }
            return new VideoRAG(this);
        }
    }
}
