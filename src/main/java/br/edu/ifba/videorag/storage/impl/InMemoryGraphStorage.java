package br.edu.ifba.videorag.storage.impl;

import br.edu.ifba.videorag.core.Entity;
import br.edu.ifba.videorag.core.Relation;
import br.edu.ifba.videorag.storage.GraphStorage;
import br.edu.ifba.videorag.storage.GraphStorageException;
import br.edu.ifba.videorag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory graph storage inspired by NetworkX.
 * Entities and chunks are nodes; edges are merged on {@code (source, type, target)} and
 * indexed in an undirected adjacency map for traversal.
 * Thread-safe with ConcurrentHashMap backing.
 */
public class InMemoryGraphStorage implements GraphStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStorage.class);

    // entityId -> Entity
    private final ConcurrentHashMap<String, Entity> entities = new ConcurrentHashMap<>();

    // chunkId -> sourceVideoId
    private final ConcurrentHashMap<String, String> chunks = new ConcurrentHashMap<>();

    // mergeKey -> Relation
    private final ConcurrentHashMap<String, Relation> edges = new ConcurrentHashMap<>();

    // nodeId -> neighbour ids, both directions
    private final ConcurrentHashMap<String, Set<String>> adjacency = new ConcurrentHashMap<>();

    // entityId -> chunk ids reached by SOURCED_FROM
    private final ConcurrentHashMap<String, Set<String>> provenance = new ConcurrentHashMap<>();

    private final AtomicInteger openSessions = new AtomicInteger();
    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStorage initialized");
            }
        });
    }

    @Override
    @NotNull
    public GraphSession openSession() {
        ensureInitialized();
        openSessions.incrementAndGet();
        return new InMemoryGraphSession();
    }

    @Override
    public CompletableFuture<List<EntityMatch>> querySimilarEntities(@NotNull float[] queryVector, int topK) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> entities.values().stream()
            .filter(entity -> entity.descriptionEmbedding() != null)
            .filter(entity -> entity.descriptionEmbedding().length == queryVector.length)
            .map(entity -> new EntityMatch(
                entity.entityId(),
                EmbeddingUtil.cosineSimilarity(queryVector, entity.descriptionEmbedding())))
            .sorted(Comparator.comparingDouble(EntityMatch::score).reversed()
                .thenComparing(EntityMatch::entityId))
            .limit(Math.max(topK, 0))
            .toList());
    }

    @Override
    public CompletableFuture<GraphSubgraph> expandNeighborhood(@NotNull Set<String> seedIds, int maxHops) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Set<String> visited = new LinkedHashSet<>();
            final Deque<String> frontier = new ArrayDeque<>();
            for (String seed : seedIds) {
                if (entities.containsKey(seed) || chunks.containsKey(seed)) {
                    visited.add(seed);
                    frontier.add(seed);
                }
            }

            for (int hop = 0; hop < maxHops && !frontier.isEmpty(); hop++) {
                final int levelSize = frontier.size();
                for (int i = 0; i < levelSize; i++) {
                    final String node = frontier.poll();
                    for (String neighbour : adjacency.getOrDefault(node, Set.of())) {
                        if (visited.add(neighbour)) {
                            frontier.add(neighbour);
                        }
                    }
                }
            }

            final List<GraphEdge> subgraphEdges = new ArrayList<>();
            for (Relation relation : edges.values()) {
                if (visited.contains(relation.sourceId()) && visited.contains(relation.targetId())) {
                    subgraphEdges.add(new GraphEdge(relation.sourceId(), relation.targetId(), relation.type()));
                }
            }
            logger.debug("Expanded {} seeds to {} nodes and {} edges in {} hops",
                seedIds.size(), visited.size(), subgraphEdges.size(), maxHops);
            return new GraphSubgraph(Set.copyOf(visited), List.copyOf(subgraphEdges));
        });
    }

    @Override
    public CompletableFuture<Map<String, Set<String>>> getSourceChunkIds(@NotNull Collection<String> entityIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, Set<String>> result = new HashMap<>();
            for (String entityId : entityIds) {
                result.put(entityId, Set.copyOf(provenance.getOrDefault(entityId, Set.of())));
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<Map<String, Entity>> getEntities(@NotNull Collection<String> entityIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, Entity> result = new HashMap<>();
            for (String entityId : entityIds) {
                final Entity entity = entities.get(entityId);
                if (entity != null) {
                    result.put(entityId, entity);
                }
            }
            return result;
        });
    }

    public int entityCount() {
        return entities.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public int openSessionCount() {
        return openSessions.get();
    }

    @Override
    public void close() {
        entities.clear();
        chunks.clear();
        edges.clear();
        adjacency.clear();
        provenance.clear();
        initialized = false;
        logger.info("InMemoryGraphStorage closed");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }

    private boolean nodeExists(String nodeId) {
        return entities.containsKey(nodeId) || chunks.containsKey(nodeId);
    }

    private void link(String a, String b) {
        adjacency.computeIfAbsent(a, k -> ConcurrentHashMap.newKeySet()).add(b);
        adjacency.computeIfAbsent(b, k -> ConcurrentHashMap.newKeySet()).add(a);
    }

    private class InMemoryGraphSession implements GraphSession {

        private volatile boolean closed = false;

        @Override
        public CompletableFuture<Void> mergeChunk(@NotNull String chunkId, @NotNull String sourceVideoId) {
            ensureOpen();
            return CompletableFuture.runAsync(() -> {
                if (entities.containsKey(chunkId)) {
                    throw new GraphStorageException("Chunk id collides with an entity id: " + chunkId);
                }
                chunks.putIfAbsent(chunkId, sourceVideoId);
            });
        }

        @Override
        public CompletableFuture<Optional<String>> upsertEntity(@NotNull Entity entity) {
            ensureOpen();
            return CompletableFuture.supplyAsync(() -> {
                if (chunks.containsKey(entity.entityId())) {
                    throw new GraphStorageException("Entity id collides with a chunk id: " + entity.entityId());
                }
                final AtomicReference<String> prior = new AtomicReference<>();
                entities.compute(entity.entityId(), (id, existing) -> {
                    if (existing != null && !Objects.equals(existing.description(), entity.description())) {
                        prior.set(existing.description());
                    }
                    return entity;
                });
                logger.debug("Upserted entity: {}", entity.entityId());
                return Optional.ofNullable(prior.get());
            });
        }

        @Override
        public CompletableFuture<Boolean> upsertRelation(@NotNull Relation relation) {
            ensureOpen();
            return CompletableFuture.supplyAsync(() -> {
                if (!nodeExists(relation.sourceId()) || !nodeExists(relation.targetId())) {
                    logger.debug("Skipping relation {} with missing endpoint", relation.mergeKey());
                    return Boolean.FALSE;
                }
                edges.merge(relation.mergeKey(), relation, (existing, incoming) -> incoming);
                link(relation.sourceId(), relation.targetId());
                if (relation.isProvenance()) {
                    provenance.computeIfAbsent(relation.sourceId(), k -> ConcurrentHashMap.newKeySet())
                        .add(relation.targetId());
                }
                return Boolean.TRUE;
            });
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                openSessions.decrementAndGet();
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Graph session already closed");
            }
            ensureInitialized();
        }
    }
}
