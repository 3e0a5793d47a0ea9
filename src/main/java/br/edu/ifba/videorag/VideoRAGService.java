package br.edu.ifba.videorag;

import br.edu.ifba.videorag.adapters.QuarkusCaptioningAdapter;
import br.edu.ifba.videorag.adapters.QuarkusEmbeddingAdapter;
import br.edu.ifba.videorag.adapters.QuarkusLLMAdapter;
import br.edu.ifba.videorag.adapters.QuarkusMultimodalEmbeddingAdapter;
import br.edu.ifba.videorag.adapters.QuarkusSpeechToTextAdapter;
import br.edu.ifba.videorag.core.VideoRAG;
import br.edu.ifba.videorag.core.VideoRAGConfig;
import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.VectorStorage;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Service that owns the {@link VideoRAG} context for the application.
 *
 * <p>The context is built from {@code videorag.*} configuration on startup, wired to the
 * REST-backed adapters and the produced stores, and closed on shutdown. Indexing, query
 * and library services reach the engine only through {@link #videoRAG()}.</p>
 */
@ApplicationScoped
@Startup
public class VideoRAGService {

    private static final Logger LOG = Logger.getLogger(VideoRAGService.class);

    @Inject
    VideoRAGProperties properties;

    @Inject
    QuarkusLLMAdapter llmAdapter;

    @Inject
    QuarkusEmbeddingAdapter embeddingAdapter;

    @Inject
    QuarkusMultimodalEmbeddingAdapter multimodalEmbeddingAdapter;

    @Inject
    QuarkusSpeechToTextAdapter speechToTextAdapter;

    @Inject
    QuarkusCaptioningAdapter captioningAdapter;

    @Inject
    GraphStorage graphStorage;

    @Inject
    VectorStorage vectorStorage;

    @Inject
    ChunkStorage chunkStorage;

    @Inject
    MetadataStorage metadataStorage;

    private VideoRAG videoRAG;

    /**
     * Validates configuration, creates the working directories and opens the context.
     */
    @PostConstruct
    public void initialize() {
        try {
            LOG.info("Initializing VideoRAG service...");
            properties.validate();
            final VideoRAGConfig config = properties.toConfig();

            Files.createDirectories(config.directories().processingOutputDir());
            Files.createDirectories(config.directories().tempFrameDir());

            LOG.infof("VideoRAG configuration - clip duration: %ds, chunk size: %d clips, graph top-k: %d, visual top-k: %d",
                config.indexing().clipDurationSeconds(),
                config.indexing().chunkSizeInClips(),
                config.retrieval().graphTopKEntities(),
                config.retrieval().visualTopK());

            this.videoRAG = VideoRAG.builder()
                .config(config)
                .llmFunction(llmAdapter)
                .embeddingFunction(embeddingAdapter)
                .multimodalEmbeddingFunction(multimodalEmbeddingAdapter)
                .speechToTextFunction(speechToTextAdapter)
                .captioningFunction(captioningAdapter)
                .graphStorage(graphStorage)
                .vectorStorage(vectorStorage)
                .chunkStorage(chunkStorage)
                .metadataStorage(metadataStorage)
                .ffmpegPath(properties.media().ffmpegPath())
                .ffprobePath(properties.media().ffprobePath())
                .build();

            videoRAG.open()
                .thenRun(() -> LOG.info("VideoRAG service initialized successfully"))
                .join();

        } catch (IOException e) {
            LOG.errorf(e, "Cannot create VideoRAG working directories");
            throw new RuntimeException("Failed to initialize VideoRAG service", e);
        } catch (Exception e) {
            LOG.errorf(e, "Error during VideoRAG service initialization");
            throw new RuntimeException("Failed to initialize VideoRAG service", e);
        }
    }

    /**
     * Closes the context, which shuts the media pool down and closes every store.
     */
    @PreDestroy
    public void shutdown() {
        LOG.info("Shutting down VideoRAG service...");
        try {
            if (videoRAG != null) {
                videoRAG.close();
            }
            LOG.info("VideoRAG service shut down successfully");
        } catch (Exception e) {
            LOG.errorf(e, "Error during VideoRAG service shutdown");
        }
    }

    public VideoRAG videoRAG() {
        if (videoRAG == null) {
            throw new IllegalStateException("VideoRAG service is not initialized");
        }
        return videoRAG;
    }
}
