package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.AudioTranscript;
import br.edu.ifba.videorag.core.ItemResult;
import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.core.VideoClip;
import br.edu.ifba.videorag.core.VideoRAGConfig;
import br.edu.ifba.videorag.core.VisualCaption;
import br.edu.ifba.videorag.media.MediaTaskException;
import br.edu.ifba.videorag.media.VideoSegmenter;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the indexing stages for one video in strict order: segmentation, transcription,
 * captioning, chunk assembly with graph build, embedding and persistence.
 *
 * <p>When a job id is given, the job-status record follows the fixed progress schedule
 * 5, 15, 30, 50, 75, 90, 100. A failure in any stage marks the job as {@code error} with
 * progress -1 and the formatted failure, then fails the returned future with the original
 * exception. Nothing here retries a whole stage.</p>
 */
public class IndexingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IndexingPipeline.class);

    static final int PROGRESS_STARTED = 5;
    static final int PROGRESS_SEGMENTED = 15;
    static final int PROGRESS_TRANSCRIBED = 30;
    static final int PROGRESS_CAPTIONED = 50;
    static final int PROGRESS_GRAPH_BUILT = 75;
    static final int PROGRESS_EMBEDDED = 90;

    private final VideoSegmenter segmenter;
    private final ClipAnnotator annotator;
    private final KnowledgeGraphMerger graphMerger;
    private final IndexPersister persister;
    private final JobStatusTracker statusTracker;
    private final VideoRAGConfig config;

    public IndexingPipeline(
            @NotNull VideoSegmenter segmenter,
            @NotNull ClipAnnotator annotator,
            @NotNull KnowledgeGraphMerger graphMerger,
            @NotNull IndexPersister persister,
            @NotNull JobStatusTracker statusTracker,
            @NotNull VideoRAGConfig config) {
        this.segmenter = segmenter;
        this.annotator = annotator;
        this.graphMerger = graphMerger;
        this.persister = persister;
        this.statusTracker = statusTracker;
        this.config = config;
    }

    /**
     * Indexes one video.
     *
     * @param videoPath source video file
     * @param jobId job whose status record is updated, or {@code null} to skip status reporting
     */
    @NotNull
    public CompletableFuture<IndexingSummary> runForVideo(@NotNull Path videoPath, @Nullable String jobId) {
        final String videoId = VideoSegmenter.videoIdOf(videoPath);
        final Path clipDir = config.directories().processingOutputDir().resolve(videoId).resolve("clips");
        final JobProgress progress = new JobProgress(jobId);
        final RunState state = new RunState(videoId);

        logger.info("Starting indexing of {} (job {})", videoPath, jobId);

        final CompletableFuture<IndexingSummary> run = progress.advance(PROGRESS_STARTED)
            .thenCompose(v -> segmenter.segment(videoPath, config.indexing().clipDurationSeconds(), clipDir))
            .thenCompose(clips -> {
                if (clips.isEmpty()) {
                    throw new MediaTaskException("No clips were generated for " + videoPath, "video-segmentation");
                }
                state.clips = List.copyOf(clips);
                return progress.advance(PROGRESS_SEGMENTED);
            })
            .thenCompose(v -> annotator.transcribeAll(state.clips))
            .thenCompose(transcripts -> {
                state.transcripts = transcripts;
                return progress.advance(PROGRESS_TRANSCRIBED);
            })
            .thenCompose(v -> annotator.captionAll(state.clips, ClipAnnotator.transcriptTexts(state.transcripts)))
            .thenCompose(captions -> {
                state.captions = captions;
                return progress.advance(PROGRESS_CAPTIONED);
            })
            .thenCompose(v -> {
                state.chunks = ChunkAssembler.assemble(
                    videoId,
                    state.clips,
                    ClipAnnotator.captionTexts(state.captions),
                    ClipAnnotator.transcriptTexts(state.transcripts),
                    config.indexing().chunkSizeInClips());
                logger.info("Assembled {} chunks from {} clips of {}", state.chunks.size(), state.clips.size(), videoId);
                return graphMerger.buildGraph(state.chunks);
            })
            .thenCompose(report -> {
                state.graphReport = report;
                if (report.hasFailures()) {
                    logger.warn("Graph build for {} left {} chunks unmerged: {}",
                        videoId, report.failedChunkIds().size(), report.failedChunkIds());
                }
                return progress.advance(PROGRESS_GRAPH_BUILT);
            })
            .thenCompose(v -> persister.embed(state.chunks, state.clips))
            .thenCompose(embedded -> progress.advance(PROGRESS_EMBEDDED)
                .thenCompose(ignored -> persister.persist(
                    state.chunks,
                    state.clips,
                    embedded,
                    ClipAnnotator.captionTexts(state.captions),
                    ClipAnnotator.transcriptTexts(state.transcripts))))
            .thenCompose(v -> progress.complete())
            .thenApply(v -> state.toSummary());

        return run
            .handle((summary, error) -> {
                if (error == null) {
                    logger.info("Indexing of {} completed: {}", videoId, summary);
                    return CompletableFuture.completedFuture(summary);
                }
                final Throwable cause = Futures.unwrap(error);
                logger.error("Indexing of {} failed (job {}): {}", videoPath, jobId, Futures.describe(cause));
                return progress.fail(cause)
                    .thenCompose(v -> CompletableFuture.<IndexingSummary>failedFuture(cause));
            })
            .thenCompose(future -> future);
    }

    /**
     * Writes status transitions for one job. A null job id turns every write into a no-op.
     */
    private final class JobProgress {

        private final String jobId;
        private JobStatus current;

        private JobProgress(@Nullable String jobId) {
            this.jobId = jobId;
            this.current = jobId == null ? null : JobStatus.pending(jobId);
        }

        CompletableFuture<Void> advance(int progress) {
            if (jobId == null) {
                return CompletableFuture.completedFuture(null);
            }
            current = current.processing(progress);
            return statusTracker.save(current);
        }

        CompletableFuture<Void> complete() {
            if (jobId == null) {
                return CompletableFuture.completedFuture(null);
            }
            current = current.completed();
            return statusTracker.save(current);
        }

        /**
         * Records the failure. A store error here is logged so the original failure still reaches the caller.
         */
        CompletableFuture<Void> fail(Throwable cause) {
            if (jobId == null || current.status().isTerminal()) {
                return CompletableFuture.completedFuture(null);
            }
            current = current.failed(Futures.describe(cause));
            return Futures.call(() -> statusTracker.save(current))
                .exceptionally(saveError -> {
                    logger.error("Could not record failure of job {}: {}", jobId, Futures.describe(saveError));
                    return null;
                });
        }
    }

    /**
     * Intermediate results handed from stage to stage.
     */
    private static final class RunState {

        private final String videoId;
        private List<VideoClip> clips = List.of();
        private Map<String, ItemResult<AudioTranscript>> transcripts = Map.of();
        private Map<String, ItemResult<VisualCaption>> captions = Map.of();
        private List<TextChunk> chunks = List.of();
        private GraphBuildReport graphReport = GraphBuildReport.empty();

        private RunState(String videoId) {
            this.videoId = videoId;
        }

        IndexingSummary toSummary() {
            return new IndexingSummary(
                videoId,
                clips.size(),
                chunks.size(),
                degradedCount(transcripts),
                degradedCount(captions),
                graphReport);
        }

        private static int degradedCount(Map<String, ? extends ItemResult<?>> results) {
            return (int) results.values().stream().filter(ItemResult::degraded).count();
        }
    }
}
