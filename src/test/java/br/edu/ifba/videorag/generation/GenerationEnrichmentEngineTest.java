package br.edu.ifba.videorag.generation;

import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.llm.LLMInferenceException;
import br.edu.ifba.videorag.media.CaptioningException;
import br.edu.ifba.videorag.media.CaptioningFunction;
import br.edu.ifba.videorag.media.FrameExtractor;
import br.edu.ifba.videorag.retrieval.CandidateClipInfo;
import br.edu.ifba.videorag.retrieval.RetrievedSource;
import br.edu.ifba.videorag.retrieval.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GenerationEnrichmentEngine}. Clip files are created under a temporary
 * shared storage so the existence check passes; frame extraction and captioning are faked.
 */
class GenerationEnrichmentEngineTest {

    @TempDir
    Path tempDir;

    private Path sharedStorage;
    private List<String> captionPrompts;

    private final FrameExtractor frames = (clipPath, count, outputDir) ->
        CompletableFuture.completedFuture(List.of(outputDir.resolve("frame_001.jpg")));

    @BeforeEach
    void setUp() throws IOException {
        sharedStorage = tempDir.resolve("shared");
        captionPrompts = Collections.synchronizedList(new ArrayList<>());
        createClip("demo_clip_0000");
        createClip("demo_clip_0001");
    }

    private void createClip(String clipId) throws IOException {
        final Path clip = sharedStorage.resolve("demo").resolve("clips").resolve(clipId + ".mp4");
        Files.createDirectories(clip.getParent());
        Files.writeString(clip, "not really a video");
    }

    private static CandidateClipInfo candidate(String clipId, double start, double end) {
        return new CandidateClipInfo(
            new RetrievedSource(clipId, "demo", start, end, 0.75, SourceType.TEXTUAL_GRAPH),
            "initial caption of " + clipId,
            "transcript of " + clipId);
    }

    private GenerationEnrichmentEngine engine(LLMFunction llm, CaptioningFunction captioning) {
        return new GenerationEnrichmentEngine(llm, captioning, frames, sharedStorage, tempDir.resolve("frames"), 15, 0.2);
    }

    private static LLMFunction answering(String answer) {
        return (prompt, systemPrompt, options) -> CompletableFuture.completedFuture(
            VideoRAGPrompts.GENERATION_SYSTEM_PROMPT.equals(systemPrompt) ? answer : "gradient, loss");
    }

    private CaptioningFunction recordingCaptioner() {
        return (framePaths, prompt) -> {
            captionPrompts.add(prompt);
            return CompletableFuture.completedFuture("a slide about gradients");
        };
    }

    @Nested
    @DisplayName("Enrichment")
    class EnrichmentTests {

        @Test
        @DisplayName("Candidates are re-captioned with the extracted keywords")
        void testQueryFocusedCaption() {
            final Map<String, EnrichedClip> enriched = engine(answering("ok"), recordingCaptioner())
                .enrich("what is a gradient?", List.of(candidate("demo_clip_0000", 0, 30))).join();

            final EnrichedClip clip = enriched.get("demo_clip_0000");
            assertTrue(clip.queryFocused());
            assertEquals("a slide about gradients", clip.visuals());
            assertEquals(1, captionPrompts.size());
            assertTrue(captionPrompts.get(0).contains("gradient"), "Keywords should reach the captioning prompt");
        }

        @Test
        @DisplayName("A clip missing from shared storage falls back to its initial caption")
        void testMissingClipFallsBack() {
            final Map<String, EnrichedClip> enriched = engine(answering("ok"), recordingCaptioner())
                .enrich("q?", List.of(candidate("demo_clip_0009", 0, 30))).join();

            final EnrichedClip clip = enriched.get("demo_clip_0009");
            assertFalse(clip.queryFocused());
            assertEquals("initial caption of demo_clip_0009", clip.visuals());
            assertTrue(clip.body().startsWith(EnrichedClip.INITIAL_TAG));
            assertTrue(captionPrompts.isEmpty(), "No captioning call for a missing clip");
        }

        @Test
        @DisplayName("A captioning failure falls back to the initial caption")
        void testCaptioningFailureFallsBack() {
            final CaptioningFunction failing = (framePaths, prompt) ->
                CompletableFuture.failedFuture(new CaptioningException("VLM timeout"));

            final Map<String, EnrichedClip> enriched = engine(answering("ok"), failing)
                .enrich("q?", List.of(candidate("demo_clip_0000", 0, 30))).join();

            assertFalse(enriched.get("demo_clip_0000").queryFocused());
        }

        @Test
        @DisplayName("Keywords are split on commas and capped")
        void testParseKeywords() {
            assertEquals(List.of("a", "b", "c", "d", "e"), GenerationEnrichmentEngine.parseKeywords(" a, b,,c,d,e,f "));
            assertTrue(GenerationEnrichmentEngine.parseKeywords(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Answer synthesis")
    class SynthesisTests {

        @Test
        @DisplayName("The answer lists one source per candidate with formatted timestamps")
        void testAnswerWithSources() {
            final QueryResponse response = engine(answering("  Gradients point uphill.  "), recordingCaptioner())
                .generate("what is a gradient?", List.of(
                    candidate("demo_clip_0000", 0, 30),
                    candidate("demo_clip_0001", 90, 120))).join();

            assertEquals("what is a gradient?", response.query());
            assertEquals("Gradients point uphill.", response.answer());
            assertEquals(2, response.retrievedSources().size());
            final ResponseSource second = response.retrievedSources().get(1);
            assertEquals("demo_clip_0001", second.clipId());
            assertEquals("01:30 - 02:00", second.timestamp());
            assertEquals(0.75, second.retrievalScore(), 1e-9);
            assertTrue(second.content().startsWith(EnrichedClip.QUERY_FOCUSED_TAG));
        }

        @Test
        @DisplayName("A synthesis failure keeps the sources and returns the failure answer")
        void testSynthesisFailure() {
            final LLMFunction llm = (prompt, systemPrompt, options) ->
                VideoRAGPrompts.GENERATION_SYSTEM_PROMPT.equals(systemPrompt)
                    ? CompletableFuture.failedFuture(new LLMInferenceException("HTTP 500"))
                    : CompletableFuture.completedFuture("gradient");

            final QueryResponse response = engine(llm, recordingCaptioner())
                .generate("what is a gradient?", List.of(candidate("demo_clip_0000", 0, 30))).join();

            assertEquals(GenerationEnrichmentEngine.GENERATION_FAILED_ANSWER, response.answer());
            assertEquals(1, response.retrievedSources().size());
        }

        @Test
        @DisplayName("A keyword failure still produces an answer")
        void testKeywordFailure() {
            final LLMFunction llm = (prompt, systemPrompt, options) ->
                VideoRAGPrompts.GENERATION_SYSTEM_PROMPT.equals(systemPrompt)
                    ? CompletableFuture.completedFuture("answer")
                    : CompletableFuture.failedFuture(new LLMInferenceException("HTTP 429"));

            final QueryResponse response = engine(llm, recordingCaptioner())
                .generate("q?", List.of(candidate("demo_clip_0000", 0, 30))).join();

            assertEquals("answer", response.answer());
            assertTrue(response.retrievedSources().get(0).content().startsWith(EnrichedClip.QUERY_FOCUSED_TAG));
        }
    }
}
