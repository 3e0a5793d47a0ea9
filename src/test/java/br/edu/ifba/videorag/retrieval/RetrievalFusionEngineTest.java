package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.storage.MetadataStorage.ClipMetadata;
import br.edu.ifba.videorag.storage.impl.InMemoryMetadataStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalFusionEngineTest {

    private InMemoryMetadataStorage metadataStorage;
    private AtomicInteger judgeCalls;
    private RelevanceFilter admitAll;

    @BeforeEach
    void setUp() {
        metadataStorage = new InMemoryMetadataStorage();
        metadataStorage.initialize().join();
        for (String clipId : List.of("clip_a", "clip_b")) {
            metadataStorage.upsert(new ClipMetadata(
                clipId, "demo", "/clips/" + clipId + ".mp4", 0, 30, "caption of " + clipId, "", null)).join();
        }
        judgeCalls = new AtomicInteger();
        admitAll = new RelevanceFilter((prompt, systemPrompt, options) -> {
            judgeCalls.incrementAndGet();
            return CompletableFuture.completedFuture("{\"is_relevant\": true}");
        });
    }

    @AfterEach
    void tearDown() {
        metadataStorage.close();
    }

    private static RetrievalChannel channel(ChannelHit... hits) {
        return query -> CompletableFuture.completedFuture(List.of(hits));
    }

    @Test
    @DisplayName("Hits are fused, hydrated from metadata and judged")
    void testRetrieve() {
        final RetrievalFusionEngine engine = new RetrievalFusionEngine(
            channel(new ChannelHit("clip_a", 0.6, SourceType.TEXTUAL_GRAPH)),
            channel(new ChannelHit("clip_a", 0.9, SourceType.VISUAL_EMBEDDING),
                new ChannelHit("clip_b", 0.8, SourceType.VISUAL_EMBEDDING),
                new ChannelHit("clip_unknown", 0.7, SourceType.VISUAL_EMBEDDING)),
            metadataStorage,
            admitAll);

        final RetrievalResult result = engine.retrieve("how does backprop work?").join();

        assertEquals(List.of("clip_a", "clip_b"), result.candidates().stream().map(CandidateClipInfo::clipId).toList(),
            "Clips without metadata are dropped");
        final RetrievedSource first = result.candidates().get(0).source();
        assertEquals(0.9, first.retrievalScore(), 1e-9);
        assertEquals(SourceType.TEXTUAL_GRAPH, first.sourceType());
        assertEquals("caption of clip_a", result.candidates().get(0).initialCaption());
        assertEquals(2, judgeCalls.get(), "Each hydrated candidate is judged once");
    }

    @Test
    @DisplayName("No hits skip hydration and judging")
    void testNoHits() {
        final RetrievalFusionEngine engine = new RetrievalFusionEngine(channel(), channel(), metadataStorage, admitAll);

        final RetrievalResult result = engine.retrieve("anything").join();

        assertTrue(result.isEmpty());
        assertEquals(0, judgeCalls.get());
    }
}
