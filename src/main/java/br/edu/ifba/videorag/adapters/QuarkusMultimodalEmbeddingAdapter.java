package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.embedding.EmbeddingException;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingClient;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingRequest;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that bridges the multimodal encoder REST client to {@link MultimodalEmbeddingFunction}.
 */
@ApplicationScoped
public class QuarkusMultimodalEmbeddingAdapter implements MultimodalEmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusMultimodalEmbeddingAdapter.class);

    @Inject
    @RestClient
    MultimodalEmbeddingClient encoderClient;

    @Override
    public CompletableFuture<Map<Modality, List<float[]>>> embedVideos(@NotNull final List<Path> videoPaths) {
        LOG.debugf("Multimodal video embedding request - videos: %d", videoPaths.size());
        final List<String> paths = videoPaths.stream().map(path -> path.toAbsolutePath().toString()).toList();
        return encode(MultimodalEmbeddingRequest.videos(paths));
    }

    @Override
    public CompletableFuture<Map<Modality, List<float[]>>> embedTexts(@NotNull final List<String> texts) {
        LOG.debugf("Multimodal text embedding request - texts: %d", texts.size());
        return encode(MultimodalEmbeddingRequest.texts(texts));
    }

    private CompletableFuture<Map<Modality, List<float[]>>> encode(final MultimodalEmbeddingRequest request) {
        return Futures.call(() -> encoderClient.encode(request).toCompletableFuture())
            .handle((response, error) -> {
                if (error != null) {
                    throw new EmbeddingException("Multimodal encoding failed: " + Futures.describe(error),
                        Futures.unwrap(error));
                }
                return toModalities(response);
            });
    }

    /**
     * Maps modality names case-insensitively; unknown modalities are ignored.
     */
    static Map<Modality, List<float[]>> toModalities(final Map<String, List<List<Double>>> response) {
        if (response == null || response.isEmpty()) {
            throw new EmbeddingException("Multimodal encoder returned no embeddings");
        }
        final Map<Modality, List<float[]>> result = new EnumMap<>(Modality.class);
        response.forEach((name, vectors) -> {
            final Modality modality;
            try {
                modality = Modality.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.debugf("Ignoring unexpected modality %s", name);
                return;
            }
            final List<float[]> converted = new ArrayList<>(vectors.size());
            for (final List<Double> vector : vectors) {
                converted.add(VectorConversions.toFloatArray(vector));
            }
            result.put(modality, converted);
        });
        return result;
    }
}
