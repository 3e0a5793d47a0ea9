package br.edu.ifba.videorag.storage;

import br.edu.ifba.videorag.core.Entity;
import br.edu.ifba.videorag.core.Relation;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Knowledge-graph store shared by every indexed video.
 *
 * <p>Writes go through a {@link GraphSession}, acquired once per chunk-processing unit so all
 * mutations of one chunk share a logical session. Reads serve the textual retrieval channel:
 * entity similarity search, neighborhood expansion and provenance lookup.</p>
 *
 * Implementations: InMemoryGraphStorage
 */
public interface GraphStorage extends AutoCloseable {

    /**
     * Initializes the graph storage backend.
     * Must be called before any other operations.
     */
    CompletableFuture<Void> initialize();

    /**
     * Opens a write session. Callers must close it when the unit of work completes.
     */
    @NotNull
    GraphSession openSession();

    /**
     * Vector-similarity query over entity description embeddings.
     *
     * @return up to {@code topK} matches, best first
     */
    CompletableFuture<List<EntityMatch>> querySimilarEntities(@NotNull float[] queryVector, int topK);

    /**
     * Expands from the seed nodes along edges of any type and direction, up to {@code maxHops}.
     *
     * @return the visited nodes and every edge between them; seeds are always included
     */
    CompletableFuture<GraphSubgraph> expandNeighborhood(@NotNull Set<String> seedIds, int maxHops);

    /**
     * Bulk provenance read: chunk ids each entity was {@code SOURCED_FROM}.
     * Entities without provenance map to an empty set.
     */
    CompletableFuture<Map<String, Set<String>>> getSourceChunkIds(@NotNull Collection<String> entityIds);

    /**
     * Bulk node read. Unknown ids are absent from the result.
     */
    CompletableFuture<Map<String, Entity>> getEntities(@NotNull Collection<String> entityIds);

    /**
     * Write session over the graph.
     */
    interface GraphSession extends AutoCloseable {

        /**
         * Registers a chunk node. Idempotent.
         */
        CompletableFuture<Void> mergeChunk(@NotNull String chunkId, @NotNull String sourceVideoId);

        /**
         * Creates or updates an entity by id.
         *
         * @return the description stored before this call when it differed from the new one;
         *         empty for new entities and unchanged descriptions
         */
        CompletableFuture<Optional<String>> upsertEntity(@NotNull Entity entity);

        /**
         * Merges an edge on {@code (source, type, target)}.
         *
         * @return false when an endpoint does not exist and nothing was written
         */
        CompletableFuture<Boolean> upsertRelation(@NotNull Relation relation);

        @Override
        void close();
    }

    record EntityMatch(@NotNull String entityId, double score) {}

    record GraphEdge(@NotNull String sourceId, @NotNull String targetId, @NotNull String type) {}

    /**
     * Local subgraph returned by neighborhood expansion.
     */
    record GraphSubgraph(@NotNull Set<String> nodeIds, @NotNull List<GraphEdge> edges) {

        public static GraphSubgraph empty() {
            return new GraphSubgraph(Set.of(), List.of());
        }

        public boolean isEmpty() {
            return nodeIds.isEmpty();
        }
    }

    @Override
    void close();
}
