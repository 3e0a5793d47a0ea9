package br.edu.ifba.videorag.core;

import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction.Modality;
import br.edu.ifba.videorag.generation.QueryResponse;
import br.edu.ifba.videorag.indexing.IndexingSummary;
import br.edu.ifba.videorag.indexing.JobStatus;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.media.VideoSegmenter;
import br.edu.ifba.videorag.retrieval.RetrievalResult;
import br.edu.ifba.videorag.storage.MetadataStorage.VideoSummary;
import br.edu.ifba.videorag.storage.impl.InMemoryChunkStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryMetadataStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryVectorStorage;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Index-then-query round through {@link VideoRAG} with in-memory stores and scripted
 * collaborators. Every LLM call is answered according to the prompt it receives.
 */
class VideoRAGTest {

    @TempDir
    Path tempDir;

    private VideoRAG videoRAG;

    private static final String EXTRACTION = """
        {"entities": [
           {"entity_id": "gradient", "label": "Gradient", "description": "Direction of steepest ascent."},
           {"entity_id": "loss", "label": "Loss", "description": "Error measure."}],
         "relationships": [
           {"source_id": "gradient", "target_id": "loss", "type": "derivative of", "description": "d"}]}
        """;

    private final LLMFunction llm = (prompt, systemPrompt, options) -> {
        if (VideoRAGPrompts.EXTRACTION_SYSTEM_PROMPT.equals(systemPrompt)) {
            return CompletableFuture.completedFuture(EXTRACTION);
        }
        if (VideoRAGPrompts.GENERATION_SYSTEM_PROMPT.equals(systemPrompt)) {
            return CompletableFuture.completedFuture("The gradient points uphill on the loss surface.");
        }
        if (options.jsonMode()) {
            return CompletableFuture.completedFuture("{\"is_relevant\": true}");
        }
        return CompletableFuture.completedFuture("gradient, loss");
    };

    private final MultimodalEmbeddingFunction multimodal = new MultimodalEmbeddingFunction() {
        @Override
        public CompletableFuture<Map<Modality, List<float[]>>> embedVideos(@NotNull List<Path> videoPaths) {
            final Map<Modality, List<float[]>> result = new EnumMap<>(Modality.class);
            result.put(Modality.VISION, videoPaths.stream().map(path -> new float[] {1f, 0f}).toList());
            return CompletableFuture.completedFuture(result);
        }

        @Override
        public CompletableFuture<Map<Modality, List<float[]>>> embedTexts(@NotNull List<String> texts) {
            final Map<Modality, List<float[]>> result = new EnumMap<>(Modality.class);
            result.put(Modality.TEXT, texts.stream().map(text -> new float[] {1f, 0f}).toList());
            return CompletableFuture.completedFuture(result);
        }
    };

    /**
     * Writes three clip files, as the ffmpeg segmenter would.
     */
    private final VideoSegmenter segmenter = (videoPath, clipDuration, outputDir) -> {
        final String videoId = VideoSegmenter.videoIdOf(videoPath);
        final List<VideoClip> clips = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            for (int i = 0; i < 3; i++) {
                final String clipId = String.format("%s_clip_%04d", videoId, i);
                final Path clip = outputDir.resolve(clipId + ".mp4");
                Files.writeString(clip, "clip");
                clips.add(new VideoClip(clipId, videoId, clip.toString(), i * clipDuration, (i + 1) * clipDuration));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return CompletableFuture.completedFuture(clips);
    };

    @BeforeEach
    void setUp() {
        final VideoRAGConfig config = VideoRAGConfig.defaults()
            .withDirectories(tempDir)
            .withRetry(new VideoRAGConfig.Retry(1, Duration.ZERO, 1.0));
        videoRAG = VideoRAG.builder()
            .config(config)
            .llmFunction(llm)
            .embeddingFunction(texts -> CompletableFuture.completedFuture(
                texts.stream().map(text -> new float[] {1f, 0f}).toList()))
            .multimodalEmbeddingFunction(multimodal)
            .speechToTextFunction(clip -> CompletableFuture.completedFuture("today we talk about gradients"))
            .captioningFunction((frames, prompt) -> CompletableFuture.completedFuture("a slide with a loss curve"))
            .videoSegmenter(segmenter)
            .frameExtractor((clip, count, outputDir) -> CompletableFuture.completedFuture(List.of(outputDir.resolve("frame_0001.jpg"))))
            .graphStorage(new InMemoryGraphStorage())
            .vectorStorage(new InMemoryVectorStorage())
            .chunkStorage(new InMemoryChunkStorage())
            .metadataStorage(new InMemoryMetadataStorage())
            .build();
        videoRAG.open().join();
    }

    @AfterEach
    void tearDown() {
        videoRAG.close();
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Operations before open are rejected")
        void testRequiresOpen() {
            videoRAG.close();

            assertFalse(videoRAG.isOpened());
            assertThrows(IllegalStateException.class, () -> videoRAG.retrieve("q"));
        }

        @Test
        @DisplayName("The builder requires every collaborator")
        void testBuilderValidation() {
            final IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> VideoRAG.builder().llmFunction(llm).build());

            assertEquals("embeddingFunction is required", error.getMessage());
        }

        @Test
        @DisplayName("One limiter exists per collaborator class")
        void testLimiters() {
            assertEquals(List.of("llm", "embedding", "speech-to-text", "captioning", "media"),
                videoRAG.limiters().stream().map(limiter -> limiter.name()).toList());
        }
    }

    @Nested
    @DisplayName("Index then query")
    class RoundTripTests {

        @Test
        @DisplayName("An indexed video is listed, retrievable and cited in the answer")
        void testIndexAndQuery() {
            final String jobId = "job-roundtrip";
            assertEquals(JobStatus.Status.PENDING, videoRAG.registerJob(jobId).join().status());

            final IndexingSummary summary = videoRAG.indexVideo(tempDir.resolve("intro_to_ml.mp4"), jobId).join();
            assertEquals(3, summary.clipCount());
            assertEquals(1, summary.chunkCount());
            assertFalse(summary.graphReport().hasFailures());

            final Optional<JobStatus> status = videoRAG.jobStatus(jobId).join();
            assertTrue(status.isPresent());
            assertEquals(JobStatus.Status.COMPLETED, status.get().status());
            assertEquals(100, status.get().progress());

            final List<VideoSummary> library = videoRAG.summarizeVideos(null).join();
            assertEquals(List.of("intro_to_ml"), library.stream().map(VideoSummary::videoId).toList());
            assertEquals(90.0, library.get(0).durationSeconds(), 1e-9);

            final RetrievalResult retrieved = videoRAG.retrieve("What does the gradient tell us?").join();
            assertEquals(3, retrieved.candidates().size(), "Every clip of the only chunk is a candidate");

            final QueryResponse response = videoRAG.generate("What does the gradient tell us?", retrieved.candidates()).join();
            assertEquals("The gradient points uphill on the loss surface.", response.answer());
            assertEquals(3, response.retrievedSources().size());
            assertEquals("00:00 - 00:30", response.retrievedSources().get(0).timestamp());
        }

        @Test
        @DisplayName("An unknown job has no status")
        void testUnknownJob() {
            assertTrue(videoRAG.jobStatus("job-missing").join().isEmpty());
        }
    }
}
