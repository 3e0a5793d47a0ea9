package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.utils.Futures;
import br.edu.ifba.videorag.utils.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the LLM whether each candidate is essential to the query. Judging fails closed: a call
 * error, unparseable output or anything other than a JSON boolean {@code true} rejects the clip.
 */
public class RelevanceFilter {

    private static final Logger logger = LoggerFactory.getLogger(RelevanceFilter.class);

    static final String RELEVANCE_FIELD = "is_relevant";

    private final LLMFunction llmFunction;

    public RelevanceFilter(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    /**
     * Judges every candidate concurrently.
     *
     * @return the admitted candidates, in input order
     */
    @NotNull
    public CompletableFuture<List<CandidateClipInfo>> filter(
            @NotNull String query,
            @NotNull List<CandidateClipInfo> candidates) {
        final List<CompletableFuture<Boolean>> verdicts = candidates.stream()
            .map(candidate -> judge(query, candidate))
            .toList();

        return Futures.allOf(verdicts).thenApply(results -> {
            final List<CandidateClipInfo> admitted = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (results.get(i)) {
                    admitted.add(candidates.get(i));
                }
            }
            logger.info("Relevance filter retained {} of {} candidates", admitted.size(), candidates.size());
            return admitted;
        });
    }

    private CompletableFuture<Boolean> judge(String query, CandidateClipInfo candidate) {
        return Futures.call(() -> llmFunction.complete(
                VideoRAGPrompts.relevance(query, candidate.combinedText()),
                null,
                CompletionOptions.json()))
            .thenApply(response -> isRelevant(candidate.clipId(), response))
            .exceptionally(error -> {
                logger.warn("Relevance judgment failed for clip {}, treating as not relevant: {}",
                    candidate.clipId(), Futures.describe(error));
                return false;
            });
    }

    /**
     * Only a JSON boolean {@code true} under {@code is_relevant} admits the clip.
     */
    static boolean isRelevant(@NotNull String clipId, @Nullable String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        try {
            final JsonNode verdict = JsonUtil.readModelJson(response).get(RELEVANCE_FIELD);
            return verdict != null && verdict.isBoolean() && verdict.booleanValue();
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable relevance verdict for clip {}: {}", clipId, e.getOriginalMessage());
            return false;
        }
    }
}
