package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.Entity;
import br.edu.ifba.videorag.core.Relation;
import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.embedding.EmbeddingException;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.indexing.ExtractionResult.ExtractedEntity;
import br.edu.ifba.videorag.indexing.ExtractionResult.ExtractedRelationship;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.llm.LLMInferenceException;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.GraphStorage.GraphSession;
import br.edu.ifba.videorag.utils.Futures;
import br.edu.ifba.videorag.utils.RetryPolicy;
import br.edu.ifba.videorag.utils.RetryScope;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts entities and relationships per chunk and merges them into the shared knowledge graph.
 *
 * <p>Chunks are processed concurrently, each inside the {@link RetryPolicy} and each with its own
 * {@link GraphSession}. Within a chunk, writes are issued one after another on that session:</p>
 * <ol>
 *   <li>register the chunk node</li>
 *   <li>extract a JSON document of entities and relationships</li>
 *   <li>embed all entity descriptions in one batch</li>
 *   <li>upsert each entity; when the store reports a different prior description, synthesize a
 *       combined description, re-embed it and write it back</li>
 *   <li>add a {@code SOURCED_FROM} edge per entity, then the entity-entity relationships</li>
 * </ol>
 *
 * <p>A chunk that still fails after its retries is logged and reported; it never fails the batch.</p>
 */
public class KnowledgeGraphMerger {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphMerger.class);

    private final GraphStorage graphStorage;
    private final LLMFunction llmFunction;
    private final EmbeddingFunction embeddingFunction;
    private final RetryPolicy retryPolicy;
    private final ExtractionResponseParser parser;

    public KnowledgeGraphMerger(
            @NotNull GraphStorage graphStorage,
            @NotNull LLMFunction llmFunction,
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull RetryPolicy retryPolicy) {
        this.graphStorage = graphStorage;
        this.llmFunction = llmFunction;
        this.embeddingFunction = embeddingFunction;
        this.retryPolicy = retryPolicy;
        this.parser = new ExtractionResponseParser();
    }

    /**
     * Merges every chunk, tolerating per-chunk failures.
     */
    @NotNull
    public CompletableFuture<GraphBuildReport> buildGraph(@NotNull List<TextChunk> chunks) {
        if (chunks.isEmpty()) {
            return CompletableFuture.completedFuture(GraphBuildReport.empty());
        }
        logger.info("Building knowledge graph from {} chunks", chunks.size());

        final List<CompletableFuture<ChunkOutcome>> futures = chunks.stream()
            .map(chunk -> retryPolicy.execute(RetryScope.graphBuild(chunk.chunkId()), () -> processChunk(chunk))
                .handle((stats, error) -> {
                    if (error != null) {
                        logger.error("Knowledge graph merge failed for chunk {}: {}",
                            chunk.chunkId(), Futures.describe(error));
                        return new ChunkOutcome(chunk.chunkId(), null);
                    }
                    return new ChunkOutcome(chunk.chunkId(), stats);
                }))
            .toList();

        return Futures.allOf(futures).thenApply(outcomes -> {
            final List<String> failed = new ArrayList<>();
            int merged = 0;
            int entities = 0;
            int synthesized = 0;
            int relations = 0;
            for (ChunkOutcome outcome : outcomes) {
                if (outcome.stats() == null) {
                    failed.add(outcome.chunkId());
                    continue;
                }
                merged++;
                entities += outcome.stats().entities();
                synthesized += outcome.stats().synthesized();
                relations += outcome.stats().relations();
            }
            final GraphBuildReport report = new GraphBuildReport(
                chunks.size(), merged, List.copyOf(failed), entities, synthesized, relations);
            logger.info("Knowledge graph build complete: {}/{} chunks merged, {} entities, {} synthesized, {} relations",
                merged, chunks.size(), entities, synthesized, relations);
            return report;
        });
    }

    /**
     * One attempt at merging a chunk. The session is closed when the attempt completes.
     */
    @NotNull
    CompletableFuture<ChunkStats> processChunk(@NotNull TextChunk chunk) {
        final GraphSession session = graphStorage.openSession();
        CompletableFuture<ChunkStats> work;
        try {
            work = session.mergeChunk(chunk.chunkId(), chunk.sourceVideoId())
                .thenCompose(v -> llmFunction.complete(
                    VideoRAGPrompts.extraction(chunk.content()),
                    VideoRAGPrompts.EXTRACTION_SYSTEM_PROMPT,
                    CompletionOptions.json()))
                .thenApply(response -> parser.parse(chunk.chunkId(), response))
                .thenCompose(extraction -> {
                    if (extraction.isEmpty()) {
                        logger.debug("No entities extracted from chunk {}", chunk.chunkId());
                        return CompletableFuture.completedFuture(ChunkStats.EMPTY);
                    }
                    return mergeExtraction(session, chunk, extraction);
                });
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }
        return work.whenComplete((stats, error) -> session.close());
    }

    private CompletableFuture<ChunkStats> mergeExtraction(
            GraphSession session,
            TextChunk chunk,
            ExtractionResult extraction) {
        final List<ExtractedEntity> extracted = extraction.entities();
        final List<String> descriptions = extracted.stream().map(ExtractedEntity::description).toList();

        return embeddingFunction.embed(descriptions).thenCompose(vectors -> {
            if (vectors.size() != extracted.size()) {
                throw new EmbeddingException("Expected " + extracted.size()
                    + " description embeddings for chunk " + chunk.chunkId() + " but received " + vectors.size());
            }

            final List<Entity> entities = new ArrayList<>(extracted.size());
            for (int i = 0; i < extracted.size(); i++) {
                final ExtractedEntity e = extracted.get(i);
                entities.add(new Entity(e.entityId(), e.label(), e.description(), vectors.get(i)));
            }

            final AtomicInteger synthesized = new AtomicInteger();
            final AtomicInteger relations = new AtomicInteger();
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

            for (Entity entity : entities) {
                chain = chain
                    .thenCompose(v -> mergeEntity(session, entity))
                    .thenAccept(wasSynthesized -> {
                        if (wasSynthesized) {
                            synthesized.incrementAndGet();
                        }
                    });
            }
            for (Entity entity : entities) {
                chain = chain
                    .thenCompose(v -> session.upsertRelation(Relation.sourcedFrom(entity, chunk.chunkId())))
                    .thenAccept(written -> countWritten(written, relations));
            }
            for (ExtractedRelationship r : extraction.relationships()) {
                if (Relation.SOURCED_FROM.equals(r.type())) {
                    logger.debug("Ignoring extracted relationship using the reserved provenance type in {}", chunk.chunkId());
                    continue;
                }
                final Relation relation = new Relation(r.sourceId(), r.targetId(), r.type(), r.description());
                chain = chain
                    .thenCompose(v -> session.upsertRelation(relation))
                    .thenAccept(written -> countWritten(written, relations));
            }

            return chain.thenApply(v -> {
                logger.debug("Merged chunk {}: {} entities, {} synthesized, {} relations",
                    chunk.chunkId(), entities.size(), synthesized.get(), relations.get());
                return new ChunkStats(entities.size(), synthesized.get(), relations.get());
            });
        });
    }

    /**
     * Upserts one entity and resolves a description conflict.
     *
     * @return true when a synthesized description was written
     */
    @NotNull
    CompletableFuture<Boolean> mergeEntity(@NotNull GraphSession session, @NotNull Entity entity) {
        return session.upsertEntity(entity).thenCompose(prior -> {
            if (prior.isEmpty()) {
                return CompletableFuture.completedFuture(Boolean.FALSE);
            }
            return synthesizeDescription(entity, prior.get())
                .thenCompose(combined -> embeddingFunction.embedSingle(combined)
                    .thenCompose(vector -> session.upsertEntity(entity.withDescription(combined, vector))))
                .thenApply(ignored -> {
                    logger.debug("Synthesized description for entity {}", entity.entityId());
                    return Boolean.TRUE;
                });
        });
    }

    private CompletableFuture<String> synthesizeDescription(Entity incoming, String existingDescription) {
        return llmFunction.complete(
                VideoRAGPrompts.synthesis(incoming.label(), existingDescription, incoming.description()),
                null,
                CompletionOptions.defaults().withTemperature(0.0))
            .thenApply(response -> {
                final String combined = response == null ? "" : response.strip();
                if (combined.isEmpty()) {
                    throw new LLMInferenceException("Empty description synthesis for entity " + incoming.entityId());
                }
                return combined;
            });
    }

    private static void countWritten(Boolean written, AtomicInteger counter) {
        if (Boolean.TRUE.equals(written)) {
            counter.incrementAndGet();
        }
    }

    record ChunkStats(int entities, int synthesized, int relations) {
        static final ChunkStats EMPTY = new ChunkStats(0, 0, 0);
    }

    private record ChunkOutcome(String chunkId, ChunkStats stats) {}
}
