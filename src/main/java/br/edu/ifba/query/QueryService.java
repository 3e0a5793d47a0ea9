package br.edu.ifba.query;

import br.edu.ifba.videorag.VideoRAGService;
import br.edu.ifba.videorag.core.VideoRAG;
import br.edu.ifba.videorag.generation.GenerationEnrichmentEngine;
import br.edu.ifba.videorag.generation.QueryResponse;
import br.edu.ifba.videorag.retrieval.RetrievalResult;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Answers a question against the indexed video library: retrieval, then enrichment and synthesis.
 * Collaborator failures never reach the caller; they end in one of the fixed answers.
 */
@ApplicationScoped
public class QueryService {

    private static final Logger LOG = Logger.getLogger(QueryService.class);

    public static final String NO_RESULTS_ANSWER =
        "I'm sorry, I couldn't find any relevant information in the video library to answer your question.";

    @Inject
    VideoRAGService videoRAGService;

    public QueryResponse query(final String query) {
        final long startTime = System.currentTimeMillis();
        LOG.infof("Received query: '%s'", query);

        final VideoRAG videoRAG = videoRAGService.videoRAG();
        final RetrievalResult retrieved;
        try {
            retrieved = videoRAG.retrieve(query).join();
        } catch (Exception e) {
            LOG.errorf("Retrieval failed for '%s': %s", query, Futures.describe(e));
            return noResults(query);
        }

        if (retrieved.isEmpty()) {
            LOG.warn("No relevant clips found for the query. Returning the default response.");
            return noResults(query);
        }

        LOG.infof("Generating answer from %d filtered clips", retrieved.candidates().size());
        final QueryResponse response;
        try {
            response = videoRAG.generate(query, retrieved.candidates()).join();
        } catch (Exception e) {
            LOG.errorf("Answer generation failed for '%s': %s", query, Futures.describe(e));
            return GenerationEnrichmentEngine.generationFailed(query, retrieved.candidates());
        }
        LOG.infof("Query answered in %d ms with %d sources",
            System.currentTimeMillis() - startTime, response.retrievedSources().size());
        return response;
    }

    static QueryResponse noResults(final String query) {
        return new QueryResponse(query, NO_RESULTS_ANSWER, List.of());
    }
}
