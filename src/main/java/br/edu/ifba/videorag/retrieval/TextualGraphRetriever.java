package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.GraphStorage.EntityMatch;
import br.edu.ifba.videorag.storage.GraphStorage.GraphSubgraph;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Graph-based retrieval channel.
 *
 * <p>The query is reformulated into a declarative sentence and embedded; the closest entities
 * seed a bounded neighbourhood expansion. Communities are detected over that neighbourhood and
 * only those containing a seed are kept. Chunks sourced from their members resolve to clip ids,
 * each scored with the best seed similarity of the community that led to it.</p>
 */
public class TextualGraphRetriever implements RetrievalChannel {

    private static final Logger logger = LoggerFactory.getLogger(TextualGraphRetriever.class);

    private final LLMFunction llmFunction;
    private final EmbeddingFunction embeddingFunction;
    private final GraphStorage graphStorage;
    private final ChunkStorage chunkStorage;
    private final CommunityDetector communityDetector;
    private final int topKEntities;
    private final int maxHops;

    public TextualGraphRetriever(
            @NotNull LLMFunction llmFunction,
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull GraphStorage graphStorage,
            @NotNull ChunkStorage chunkStorage,
            @NotNull CommunityDetector communityDetector,
            int topKEntities,
            int maxHops) {
        this.llmFunction = llmFunction;
        this.embeddingFunction = embeddingFunction;
        this.graphStorage = graphStorage;
        this.chunkStorage = chunkStorage;
        this.communityDetector = communityDetector;
        this.topKEntities = topKEntities;
        this.maxHops = maxHops;
    }

    @Override
    @NotNull
    public CompletableFuture<List<ChannelHit>> retrieve(@NotNull String query) {
        logger.info("Textual retrieval for '{}'", query);
        return Futures.call(() -> llmFunction.complete(
                VideoRAGPrompts.reformulation(query),
                null,
                CompletionOptions.defaults().withTemperature(0.0)))
            .thenCompose(declarative -> embeddingFunction.embedSingle(declarative.strip()))
            .thenCompose(vector -> graphStorage.querySimilarEntities(vector, topKEntities))
            .thenCompose(this::fromSeeds)
            .exceptionally(error -> {
                logger.error("Textual retrieval failed: {}", Futures.describe(error));
                return List.of();
            });
    }

    private CompletableFuture<List<ChannelHit>> fromSeeds(List<EntityMatch> seeds) {
        if (seeds.isEmpty()) {
            logger.warn("No seed entities found for the query");
            return CompletableFuture.completedFuture(List.of());
        }
        final Map<String, Double> seedScores = new LinkedHashMap<>();
        for (EntityMatch seed : seeds) {
            seedScores.merge(seed.entityId(), seed.score(), Math::max);
        }

        return graphStorage.expandNeighborhood(seedScores.keySet(), maxHops)
            .thenCompose(subgraph -> {
                final Map<String, Double> memberScores = scoreCommunityMembers(subgraph, seedScores);
                if (memberScores.isEmpty()) {
                    return CompletableFuture.completedFuture(List.<ChannelHit>of());
                }
                return graphStorage.getSourceChunkIds(memberScores.keySet())
                    .thenCompose(chunkIdsByEntity -> resolveClips(chunkScores(chunkIdsByEntity, memberScores)));
            });
    }

    /**
     * Members of every community that contains a seed, each scored with the best seed score of its community.
     */
    private Map<String, Double> scoreCommunityMembers(GraphSubgraph subgraph, Map<String, Double> seedScores) {
        if (subgraph.isEmpty()) {
            return Map.of();
        }
        final Map<String, Integer> communities = communityDetector.detect(subgraph);

        final Map<Integer, Double> communityScores = new HashMap<>();
        seedScores.forEach((seedId, score) -> {
            final Integer community = communities.get(seedId);
            if (community != null) {
                communityScores.merge(community, score, Math::max);
            }
        });

        final Map<String, Double> memberScores = new LinkedHashMap<>();
        communities.forEach((nodeId, community) -> {
            final Double score = communityScores.get(community);
            if (score != null) {
                memberScores.put(nodeId, score);
            }
        });
        logger.debug("{} seed communities cover {} of {} expanded nodes",
            communityScores.size(), memberScores.size(), subgraph.nodeIds().size());
        return memberScores;
    }

    private static Map<String, Double> chunkScores(
            Map<String, Set<String>> chunkIdsByEntity,
            Map<String, Double> memberScores) {
        final Map<String, Double> scores = new LinkedHashMap<>();
        memberScores.forEach((entityId, score) -> {
            for (String chunkId : chunkIdsByEntity.getOrDefault(entityId, Set.of())) {
                scores.merge(chunkId, score, Math::max);
            }
        });
        return scores;
    }

    private CompletableFuture<List<ChannelHit>> resolveClips(Map<String, Double> chunkScores) {
        if (chunkScores.isEmpty()) {
            logger.warn("Graph traversal found no source chunks");
            return CompletableFuture.completedFuture(List.of());
        }
        logger.info("Found {} relevant chunks from graph communities", chunkScores.size());

        return chunkStorage.getChunks(new LinkedHashSet<>(chunkScores.keySet())).thenApply(chunks -> {
            final Map<String, Double> clipScores = new LinkedHashMap<>();
            for (TextChunk chunk : chunks) {
                final double score = chunkScores.getOrDefault(chunk.chunkId(), 0.0);
                for (String clipId : chunk.sourceClipIds()) {
                    clipScores.merge(clipId, score, Math::max);
                }
            }
            final List<ChannelHit> hits = new ArrayList<>(clipScores.size());
            clipScores.forEach((clipId, score) -> hits.add(new ChannelHit(clipId, score, SourceType.TEXTUAL_GRAPH)));
            hits.sort(Comparator.comparingDouble(ChannelHit::score).reversed().thenComparing(ChannelHit::clipId));
            return hits;
        });
    }
}
