package br.edu.ifba.videorag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.videorag.storage.VectorStorage.VectorSearchResult;
import br.edu.ifba.videorag.storage.VectorStorageException;

/**
 * Unit tests for InMemoryVectorStorage.
 */
class InMemoryVectorStorageTest {

    private InMemoryVectorStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryVectorStorage();
        storage.initialize().join();
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    /**
     * Test search ranks by cosine similarity and carries metadata.
     */
    @Test
    void testSearchRanksByScore() {
        storage.add("clips",
            List.of("a", "b", "c"),
            List.of(new float[]{1f, 0f}, new float[]{0.6f, 0.8f}, new float[]{0f, 1f}),
            List.of(Map.of("video", "v1"), Map.of("video", "v1"), Map.of("video", "v2"))).join();

        final List<VectorSearchResult> results = storage.search("clips", new float[]{1f, 0f}, 2).join();

        assertEquals(List.of("a", "b"), results.stream().map(VectorSearchResult::id).toList());
        assertEquals(1.0, results.get(0).score(), 1e-6);
        assertEquals(0.6, results.get(1).score(), 1e-6);
        assertEquals("v1", results.get(1).metadata().get("video"));
    }

    /**
     * Test collections are isolated and an unknown one is empty.
     */
    @Test
    void testCollectionsAreIsolated() {
        storage.add("clips", List.of("a"), List.of(new float[]{1f, 0f}), List.of(Map.of())).join();

        assertTrue(storage.search("chunks", new float[]{1f, 0f}, 5).join().isEmpty());
        assertEquals(1, storage.size("clips"));
    }

    /**
     * Test a vector of another dimension is rejected and nothing from the batch is stored.
     */
    @Test
    void testDimensionMismatch() {
        storage.add("clips", List.of("a"), List.of(new float[]{1f, 0f}), List.of(Map.of())).join();

        final CompletionException e = assertThrows(CompletionException.class, () -> storage.add("clips",
            List.of("b", "c"),
            List.of(new float[]{1f, 0f}, new float[]{1f, 0f, 0f}),
            List.of(Map.of(), Map.of())).join());

        assertInstanceOf(VectorStorageException.class, e.getCause());
        assertEquals(1, storage.size("clips"));
    }

    /**
     * Test parallel lists of different sizes are rejected.
     */
    @Test
    void testSizeMismatch() {
        final CompletionException e = assertThrows(CompletionException.class, () -> storage.add("clips",
            List.of("a", "b"), List.of(new float[]{1f}), List.of(Map.of(), Map.of())).join());

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
