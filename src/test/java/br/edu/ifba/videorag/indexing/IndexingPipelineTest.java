package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.VideoClip;
import br.edu.ifba.videorag.core.VideoRAGConfig;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction.Modality;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.media.FrameExtractor;
import br.edu.ifba.videorag.media.MediaTaskException;
import br.edu.ifba.videorag.media.TranscriptionException;
import br.edu.ifba.videorag.media.VideoSegmenter;
import br.edu.ifba.videorag.storage.MetadataStorage.VideoSummary;
import br.edu.ifba.videorag.storage.impl.InMemoryChunkStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryMetadataStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryVectorStorage;
import br.edu.ifba.videorag.utils.JsonUtil;
import br.edu.ifba.videorag.utils.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link IndexingPipeline} with every collaborator faked and the
 * in-memory stores behind it.
 */
class IndexingPipelineTest {

    private static final String JOB_ID = "job-test";

    @TempDir
    Path tempDir;

    private RecordingChunkStorage chunkStorage;
    private InMemoryVectorStorage vectorStorage;
    private InMemoryMetadataStorage metadataStorage;
    private InMemoryGraphStorage graphStorage;
    private VideoRAGConfig config;

    @BeforeEach
    void setUp() {
        chunkStorage = new RecordingChunkStorage();
        vectorStorage = new InMemoryVectorStorage();
        metadataStorage = new InMemoryMetadataStorage();
        graphStorage = new InMemoryGraphStorage();
        chunkStorage.initialize().join();
        vectorStorage.initialize().join();
        metadataStorage.initialize().join();
        graphStorage.initialize().join();
        config = VideoRAGConfig.defaults().withDirectories(tempDir);
    }

    /**
     * Records every job-status document written, in order.
     */
    static class RecordingChunkStorage extends InMemoryChunkStorage {

        final List<JobStatus> statusWrites = Collections.synchronizedList(new ArrayList<>());

        @Override
        public CompletableFuture<Void> set(@NotNull String key, @NotNull String value, @Nullable Duration ttl) {
            if (key.startsWith(JobStatusTracker.KEY_PREFIX)) {
                try {
                    statusWrites.add(JsonUtil.MAPPER.readValue(value, JobStatus.class));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException(e);
                }
            }
            return super.set(key, value, ttl);
        }
    }

    private static VideoSegmenter segmenterOf(int clipCount) {
        return (videoPath, clipDuration, outputDir) -> {
            final String videoId = VideoSegmenter.videoIdOf(videoPath);
            final List<VideoClip> clips = new ArrayList<>();
            for (int i = 0; i < clipCount; i++) {
                clips.add(new VideoClip(
                    String.format("%s_clip_%04d", videoId, i),
                    videoId,
                    outputDir.resolve(String.format("%s_clip_%04d.mp4", videoId, i)).toString(),
                    i * clipDuration,
                    (i + 1) * clipDuration));
            }
            return CompletableFuture.completedFuture(clips);
        };
    }

    private IndexingPipeline pipeline(VideoSegmenter segmenter) {
        final FrameExtractor frames = (clipPath, count, outputDir) ->
            CompletableFuture.completedFuture(List.of(outputDir.resolve("frame_001.jpg")));
        final ClipAnnotator annotator = new ClipAnnotator(
            clip -> clip.getFileName().toString().contains("0001")
                ? CompletableFuture.failedFuture(new TranscriptionException("silence"))
                : CompletableFuture.completedFuture("spoken words"),
            (framePaths, prompt) -> CompletableFuture.completedFuture("a lecturer at a whiteboard"),
            frames,
            config.directories().tempFrameDir(),
            config.indexing().initialFramesPerClip());

        final LLMFunction llm = (prompt, systemPrompt, options) -> CompletableFuture.completedFuture("{}");
        final EmbeddingFunction embedding = texts -> CompletableFuture.completedFuture(
            texts.stream().map(text -> new float[] {1.0f, 0.0f}).toList());
        final MultimodalEmbeddingFunction multimodal = new MultimodalEmbeddingFunction() {
            @Override
            public CompletableFuture<Map<Modality, List<float[]>>> embedVideos(@NotNull List<Path> videoPaths) {
                final Map<Modality, List<float[]>> result = new EnumMap<>(Modality.class);
                result.put(Modality.VISION, videoPaths.stream().map(path -> new float[] {0.0f, 1.0f}).toList());
                return CompletableFuture.completedFuture(result);
            }

            @Override
            public CompletableFuture<Map<Modality, List<float[]>>> embedTexts(@NotNull List<String> texts) {
                final Map<Modality, List<float[]>> result = new EnumMap<>(Modality.class);
                result.put(Modality.TEXT, texts.stream().map(text -> new float[] {0.0f, 1.0f}).toList());
                return CompletableFuture.completedFuture(result);
            }
        };

        return new IndexingPipeline(
            segmenter,
            annotator,
            new KnowledgeGraphMerger(graphStorage, llm, embedding, RetryPolicy.noRetry()),
            new IndexPersister(embedding, multimodal, vectorStorage, chunkStorage, metadataStorage,
                config.storage().chunksCollection(), config.storage().clipsCollection(),
                config.indexing().embeddingBatchSize()),
            new JobStatusTracker(chunkStorage, config.storage().jobStatusTtl()),
            config);
    }

    @Nested
    @DisplayName("Successful run")
    class SuccessTests {

        @Test
        @DisplayName("Status follows the fixed progress schedule and ends completed")
        void testProgressSchedule() {
            pipeline(segmenterOf(4)).runForVideo(tempDir.resolve("lecture.mp4"), JOB_ID).join();

            final List<Integer> progress = chunkStorage.statusWrites.stream().map(JobStatus::progress).toList();
            assertEquals(List.of(5, 15, 30, 50, 75, 90, 100), progress);
            final JobStatus last = chunkStorage.statusWrites.get(chunkStorage.statusWrites.size() - 1);
            assertEquals(JobStatus.Status.COMPLETED, last.status());
        }

        @Test
        @DisplayName("Clips, chunks and metadata are persisted")
        void testPersistence() {
            final IndexingSummary summary = pipeline(segmenterOf(4))
                .runForVideo(tempDir.resolve("lecture.mp4"), JOB_ID).join();

            assertEquals("lecture", summary.videoId());
            assertEquals(4, summary.clipCount());
            assertEquals(2, summary.chunkCount(), "4 clips grouped by 3 give 2 chunks");
            assertEquals(1, summary.degradedTranscripts(), "The failing clip degrades to an empty transcript");
            assertEquals(0, summary.degradedCaptions());

            assertEquals(4, vectorStorage.size(config.storage().clipsCollection()));
            assertEquals(2, vectorStorage.size(config.storage().chunksCollection()));
            assertEquals(2, chunkStorage.getChunks(List.of("lecture_chunk_0000", "lecture_chunk_0001")).join().size());

            final List<VideoSummary> videos = metadataStorage.summarizeVideos(null).join();
            assertEquals(1, videos.size());
            assertEquals(4, videos.get(0).clipCount());
        }

        @Test
        @DisplayName("Without a job id no status is written")
        void testNoJobId() {
            pipeline(segmenterOf(2)).runForVideo(tempDir.resolve("lecture.mp4"), null).join();

            assertTrue(chunkStorage.statusWrites.isEmpty());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("A segmentation failure marks the job as error and fails the run")
        void testSegmentationFailure() {
            final VideoSegmenter broken = (videoPath, clipDuration, outputDir) ->
                CompletableFuture.failedFuture(new MediaTaskException("ffmpeg exited with 1", "video-segmentation"));

            final CompletionException error = assertThrows(CompletionException.class,
                () -> pipeline(broken).runForVideo(tempDir.resolve("lecture.mp4"), JOB_ID).join());

            assertInstanceOf(MediaTaskException.class, error.getCause());
            final JobStatus last = chunkStorage.statusWrites.get(chunkStorage.statusWrites.size() - 1);
            assertEquals(JobStatus.Status.ERROR, last.status());
            assertEquals(JobStatus.FAILED_PROGRESS, last.progress());
            assertTrue(last.error().contains("ffmpeg exited with 1"), last.error());
        }

        @Test
        @DisplayName("A video that yields no clips fails the job")
        void testNoClips() {
            final CompletionException error = assertThrows(CompletionException.class,
                () -> pipeline(segmenterOf(0)).runForVideo(tempDir.resolve("empty.mp4"), JOB_ID).join());

            assertTrue(error.getCause().getMessage().contains("No clips were generated"));
            final JobStatus last = chunkStorage.statusWrites.get(chunkStorage.statusWrites.size() - 1);
            assertEquals(JobStatus.Status.ERROR, last.status());
            assertTrue(metadataStorage.summarizeVideos(null).join().isEmpty(), "Nothing should be persisted");
        }
    }
}
