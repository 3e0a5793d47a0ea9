package br.edu.ifba.videorag.generation;

import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.media.CaptioningException;
import br.edu.ifba.videorag.media.CaptioningFunction;
import br.edu.ifba.videorag.media.FrameExtractor;
import br.edu.ifba.videorag.media.MediaTaskException;
import br.edu.ifba.videorag.retrieval.CandidateClipInfo;
import br.edu.ifba.videorag.retrieval.RetrievedSource;
import br.edu.ifba.videorag.utils.FileCleanup;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the final answer for filtered candidates.
 *
 * <p>Keywords are pulled from the query, then every candidate is re-captioned from a denser
 * frame sample with a prompt focused on those keywords. A clip whose re-captioning fails
 * falls back to its stored initial caption. The answer prompt carries the enriched blocks as
 * PART 1 and the stored caption/transcript text as PART 2.</p>
 */
public class GenerationEnrichmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(GenerationEnrichmentEngine.class);

    public static final String GENERATION_FAILED_ANSWER =
        "I found relevant clips but could not generate an answer right now. Please try again.";

    static final String CONTEXT_SEPARATOR = "\n\n--- Next Retrieved Context ---\n\n";
    static final String NO_CONTEXT = "No relevant context was found.";
    static final String CONTENT_NOT_AVAILABLE = "Content not available.";
    static final int KEYWORD_MAX_TOKENS = 32;
    static final int MAX_KEYWORDS = 5;

    private final LLMFunction llmFunction;
    private final CaptioningFunction captioning;
    private final FrameExtractor frameExtractor;
    private final Path sharedClipStorage;
    private final Path tempFrameDir;
    private final int framesPerClip;
    private final double temperature;

    public GenerationEnrichmentEngine(
            @NotNull LLMFunction llmFunction,
            @NotNull CaptioningFunction captioning,
            @NotNull FrameExtractor frameExtractor,
            @NotNull Path sharedClipStorage,
            @NotNull Path tempFrameDir,
            int framesPerClip,
            double temperature) {
        this.llmFunction = llmFunction;
        this.captioning = captioning;
        this.frameExtractor = frameExtractor;
        this.sharedClipStorage = sharedClipStorage;
        this.tempFrameDir = tempFrameDir;
        this.framesPerClip = framesPerClip;
        this.temperature = temperature;
    }

    /**
     * Enriches the candidates and synthesizes the answer. If synthesis fails, the response
     * still lists the sources, with {@link #GENERATION_FAILED_ANSWER} as the answer.
     */
    @NotNull
    public CompletableFuture<QueryResponse> generate(@NotNull String query, @NotNull List<CandidateClipInfo> candidates) {
        logger.info("Generating answer for '{}' from {} clips", query, candidates.size());
        return enrich(query, candidates).thenCompose(enriched -> {
            final String prompt = VideoRAGPrompts.generation(
                enrichedContext(candidates, enriched),
                retrievedContext(candidates),
                query);
            final List<ResponseSource> sources = toSources(candidates, enriched);

            return Futures.call(() -> llmFunction.complete(
                    prompt,
                    VideoRAGPrompts.GENERATION_SYSTEM_PROMPT,
                    CompletionOptions.generator(temperature)))
                .thenApply(answer -> new QueryResponse(query, answer == null ? "" : answer.strip(), sources))
                .exceptionally(error -> {
                    logger.error("Answer synthesis failed for '{}': {}", query, Futures.describe(error));
                    return new QueryResponse(query, GENERATION_FAILED_ANSWER, sources);
                });
        });
    }

    /**
     * Re-captions every candidate concurrently.
     *
     * @return enriched clip by clip id, in candidate order
     */
    @NotNull
    public CompletableFuture<Map<String, EnrichedClip>> enrich(
            @NotNull String query,
            @NotNull List<CandidateClipInfo> candidates) {
        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        return extractKeywords(query).thenCompose(keywords -> {
            logger.debug("Keywords for query-focused captioning: {}", keywords);
            final List<CompletableFuture<EnrichedClip>> futures = candidates.stream()
                .map(candidate -> enrichClip(candidate, keywords))
                .toList();
            return Futures.allOf(futures);
        }).thenApply(clips -> {
            final Map<String, EnrichedClip> byClip = new LinkedHashMap<>();
            int fallbacks = 0;
            for (EnrichedClip clip : clips) {
                byClip.put(clip.clipId(), clip);
                if (!clip.queryFocused()) {
                    fallbacks++;
                }
            }
            if (fallbacks > 0) {
                logger.warn("{} of {} clips fell back to their initial caption", fallbacks, clips.size());
            }
            return byClip;
        });
    }

    /**
     * Asks for 2-5 comma-separated keywords. A failed call yields no keywords.
     */
    @NotNull
    CompletableFuture<List<String>> extractKeywords(@NotNull String query) {
        return Futures.call(() -> llmFunction.complete(
                VideoRAGPrompts.keywords(query),
                null,
                CompletionOptions.defaults().withMaxTokens(KEYWORD_MAX_TOKENS)))
            .thenApply(GenerationEnrichmentEngine::parseKeywords)
            .exceptionally(error -> {
                logger.warn("Keyword extraction failed, captioning without keywords: {}", Futures.describe(error));
                return List.of();
            });
    }

    @NotNull
    static List<String> parseKeywords(String response) {
        if (response == null) {
            return List.of();
        }
        return Arrays.stream(response.split(","))
            .map(String::strip)
            .filter(keyword -> !keyword.isEmpty())
            .limit(MAX_KEYWORDS)
            .toList();
    }

    private CompletableFuture<EnrichedClip> enrichClip(CandidateClipInfo candidate, List<String> keywords) {
        final RetrievedSource source = candidate.source();
        final String clipId = source.clipId();
        final Path clipPath = clipPath(source);
        final Path frameDir = tempFrameDir.resolve("query_" + clipId);

        return Futures.call(() -> {
                if (!Files.isRegularFile(clipPath)) {
                    throw new MediaTaskException("Clip file not found at shared path: " + clipPath, "frame-extraction");
                }
                return frameExtractor.extract(clipPath, framesPerClip, frameDir);
            })
            .thenCompose(frames -> {
                if (frames.isEmpty()) {
                    throw new CaptioningException("No frames extracted for clip " + clipId);
                }
                return captioning.caption(frames, VideoRAGPrompts.queryFocusedCaption(candidate.transcript(), keywords));
            })
            .whenComplete((caption, error) -> FileCleanup.deleteRecursively(frameDir))
            .thenApply(caption -> new EnrichedClip(clipId, caption == null ? "" : caption.strip(), candidate.transcript(), true))
            .exceptionally(error -> {
                logger.error("Query-focused captioning failed for clip {}: {}", clipId, Futures.describe(error));
                return new EnrichedClip(clipId, candidate.initialCaption(), candidate.transcript(), false);
            });
    }

    /**
     * Clips are read from {@code {sharedClipStorage}/{videoId}/clips/{clipId}.mp4}.
     */
    @NotNull
    Path clipPath(@NotNull RetrievedSource source) {
        return sharedClipStorage.resolve(source.sourceVideoId()).resolve("clips").resolve(source.clipId() + ".mp4");
    }

    private static String enrichedContext(List<CandidateClipInfo> candidates, Map<String, EnrichedClip> enriched) {
        if (candidates.isEmpty()) {
            return NO_CONTEXT;
        }
        final List<String> blocks = new ArrayList<>(candidates.size());
        for (CandidateClipInfo candidate : candidates) {
            final EnrichedClip clip = enriched.get(candidate.clipId());
            if (clip != null) {
                blocks.add(clip.toContextBlock());
            }
        }
        return String.join("\n", blocks);
    }

    private static String retrievedContext(List<CandidateClipInfo> candidates) {
        return String.join(CONTEXT_SEPARATOR, candidates.stream().map(CandidateClipInfo::combinedText).toList());
    }

    /**
     * Response used when no answer could be produced for candidates that did survive retrieval.
     * Sources are listed without enriched content.
     */
    @NotNull
    public static QueryResponse generationFailed(@NotNull String query, @NotNull List<CandidateClipInfo> candidates) {
        return new QueryResponse(query, GENERATION_FAILED_ANSWER, toSources(candidates, Map.of()));
    }

    private static List<ResponseSource> toSources(List<CandidateClipInfo> candidates, Map<String, EnrichedClip> enriched) {
        final List<ResponseSource> sources = new ArrayList<>(candidates.size());
        for (CandidateClipInfo candidate : candidates) {
            final RetrievedSource source = candidate.source();
            final EnrichedClip clip = enriched.get(source.clipId());
            sources.add(new ResponseSource(
                source.clipId(),
                source.sourceVideoId(),
                TimestampFormatter.format(source.startTime(), source.endTime()),
                clip == null ? CONTENT_NOT_AVAILABLE : clip.body().strip(),
                source.retrievalScore()));
        }
        return sources;
    }
}
