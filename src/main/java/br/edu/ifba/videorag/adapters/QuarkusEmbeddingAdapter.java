package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.embedding.EmbeddingException;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.embedding.EmbeddingRequest;
import br.edu.ifba.videorag.embedding.EmbeddingResponse;
import br.edu.ifba.videorag.embedding.LlmEmbeddingClient;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that bridges the embeddings REST client to the engine's {@link EmbeddingFunction}.
 */
@ApplicationScoped
public class QuarkusEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusEmbeddingAdapter.class);

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @Inject
    VideoRAGProperties properties;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            LOG.warn("Empty text list provided for embedding");
            return CompletableFuture.completedFuture(List.of());
        }
        final String model = properties.models().embedding();
        LOG.debugf("Embedding request - texts: %d, model: %s", texts.size(), model);

        return Futures.call(() -> embeddingClient.embed(new EmbeddingRequest(model, texts)).toCompletableFuture())
            .handle((response, error) -> {
                if (error != null) {
                    throw new EmbeddingException("Embedding call failed: " + Futures.describe(error), Futures.unwrap(error));
                }
                return toVectors(response, texts.size());
            });
    }

    static List<float[]> toVectors(final EmbeddingResponse response, final int expected) {
        if (response == null || response.data() == null || response.data().isEmpty()) {
            throw new EmbeddingException("Embedding API returned no data");
        }
        if (response.data().size() != expected) {
            throw new EmbeddingException(
                "Expected " + expected + " embeddings but received " + response.data().size());
        }

        final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.data());
        ordered.sort(Comparator.comparing(e -> e.index() == null ? 0 : e.index()));

        final List<float[]> vectors = new ArrayList<>(ordered.size());
        for (final EmbeddingResponse.Embedding embedding : ordered) {
            vectors.add(VectorConversions.toFloatArray(embedding.embedding()));
        }
        return vectors;
    }
}
