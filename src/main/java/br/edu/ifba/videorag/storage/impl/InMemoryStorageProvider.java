package br.edu.ifba.videorag.storage.impl;

import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.VectorStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * CDI producer for the in-memory store implementations.
 *
 * <p>The stores are created uninitialized; {@code VideoRAG.open()} initializes them and
 * {@code VideoRAG.close()} closes them, so this provider has no lifecycle of its own.</p>
 */
@ApplicationScoped
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    @Produces
    @Singleton
    public GraphStorage graphStorage() {
        LOG.info("Producing in-memory GraphStorage");
        return new InMemoryGraphStorage();
    }

    @Produces
    @Singleton
    public VectorStorage vectorStorage() {
        LOG.info("Producing in-memory VectorStorage");
        return new InMemoryVectorStorage();
    }

    @Produces
    @Singleton
    public ChunkStorage chunkStorage() {
        LOG.info("Producing in-memory ChunkStorage");
        return new InMemoryChunkStorage(Clock.systemUTC());
    }

    @Produces
    @Singleton
    public MetadataStorage metadataStorage() {
        LOG.info("Producing in-memory MetadataStorage");
        return new InMemoryMetadataStorage(Clock.systemUTC());
    }
}
