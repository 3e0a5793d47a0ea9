package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.core.Entity;
import br.edu.ifba.videorag.core.Relation;
import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.llm.LLMInferenceException;
import br.edu.ifba.videorag.storage.GraphStorage.GraphSession;
import br.edu.ifba.videorag.storage.impl.InMemoryChunkStorage;
import br.edu.ifba.videorag.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class TextualGraphRetrieverTest {

    private InMemoryGraphStorage graphStorage;
    private InMemoryChunkStorage chunkStorage;

    private final EmbeddingFunction embedding = texts -> CompletableFuture.completedFuture(
        texts.stream().map(text -> new float[] {1.0f, 0.0f}).toList());

    @BeforeEach
    void setUp() {
        graphStorage = new InMemoryGraphStorage();
        chunkStorage = new InMemoryChunkStorage();
        graphStorage.initialize().join();
        chunkStorage.initialize().join();

        final Entity loss = new Entity("loss", "Loss", "Error measure.", new float[] {1.0f, 0.0f});
        final Entity optimizer = new Entity("optimizer", "Optimizer", "Updates weights.", new float[] {0.0f, 1.0f});
        try (GraphSession session = graphStorage.openSession()) {
            session.mergeChunk("demo_chunk_0000", "demo").join();
            session.mergeChunk("demo_chunk_0001", "demo").join();
            session.upsertEntity(loss).join();
            session.upsertEntity(optimizer).join();
            session.upsertRelation(Relation.sourcedFrom(loss, "demo_chunk_0000")).join();
            session.upsertRelation(Relation.sourcedFrom(optimizer, "demo_chunk_0001")).join();
            session.upsertRelation(new Relation("optimizer", "loss", "MINIMIZES", "d")).join();
        }
        chunkStorage.addChunks(List.of(
            new TextChunk("demo_chunk_0000", "demo", "content", List.of("demo_clip_0000", "demo_clip_0001")),
            new TextChunk("demo_chunk_0001", "demo", "content", List.of("demo_clip_0002")))).join();
    }

    @AfterEach
    void tearDown() {
        graphStorage.close();
        chunkStorage.close();
    }

    private TextualGraphRetriever retriever(LLMFunction llm) {
        return new TextualGraphRetriever(llm, embedding, graphStorage, chunkStorage, new CommunityDetector(), 1, 2);
    }

    @Test
    @DisplayName("Clips of the chunks behind the seed community are returned with the seed score")
    void testRetrieve() {
        final List<ChannelHit> hits = retriever((prompt, systemPrompt, options) ->
            CompletableFuture.completedFuture("The loss measures error.")).retrieve("what is the loss?").join();

        assertFalse(hits.isEmpty());
        assertTrue(hits.stream().allMatch(hit -> hit.sourceType() == SourceType.TEXTUAL_GRAPH));
        assertTrue(hits.stream().anyMatch(hit -> hit.clipId().equals("demo_clip_0000")));
        assertTrue(hits.stream().anyMatch(hit -> hit.clipId().equals("demo_clip_0001")));
        assertEquals(1.0, hits.get(0).score(), 1e-6, "The best seed has cosine similarity 1");
        for (int i = 1; i < hits.size(); i++) {
            assertTrue(hits.get(i - 1).score() >= hits.get(i).score(), "Hits are sorted by descending score");
        }
    }

    @Test
    @DisplayName("A failing reformulation yields no hits instead of an error")
    void testChannelNeverFails() {
        final List<ChannelHit> hits = retriever((prompt, systemPrompt, options) ->
            CompletableFuture.failedFuture(new LLMInferenceException("HTTP 503"))).retrieve("what is the loss?").join();

        assertTrue(hits.isEmpty());
    }
}
