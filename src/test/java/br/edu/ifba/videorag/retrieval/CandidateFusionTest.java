package br.edu.ifba.videorag.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateFusionTest {

    @Test
    @DisplayName("A clip found by both channels keeps the higher score and the textual type")
    void testOverlapKeepsMaxScore() {
        final List<ChannelHit> fused = CandidateFusion.fuse(
            List.of(new ChannelHit("clip_a", 0.4, SourceType.TEXTUAL_GRAPH)),
            List.of(new ChannelHit("clip_a", 0.9, SourceType.VISUAL_EMBEDDING)));

        assertEquals(1, fused.size(), "The same clip id must appear once");
        assertEquals(0.9, fused.get(0).score(), 1e-9);
        assertEquals(SourceType.TEXTUAL_GRAPH, fused.get(0).sourceType(), "The first channel's type is kept");
    }

    @Test
    @DisplayName("A visual-only clip keeps its own score and type")
    void testVisualOnly() {
        final List<ChannelHit> fused = CandidateFusion.fuse(
            List.of(new ChannelHit("clip_a", 0.5, SourceType.TEXTUAL_GRAPH)),
            List.of(new ChannelHit("clip_b", 0.8, SourceType.VISUAL_EMBEDDING)));

        assertEquals(List.of(
            new ChannelHit("clip_a", 0.5, SourceType.TEXTUAL_GRAPH),
            new ChannelHit("clip_b", 0.8, SourceType.VISUAL_EMBEDDING)), fused);
    }

    @Test
    @DisplayName("A lower score from the second channel does not replace the first")
    void testLowerScoreIgnored() {
        final List<ChannelHit> fused = CandidateFusion.fuse(
            List.of(new ChannelHit("clip_a", 0.7, SourceType.TEXTUAL_GRAPH)),
            List.of(new ChannelHit("clip_a", 0.2, SourceType.VISUAL_EMBEDDING)));

        assertEquals(List.of(new ChannelHit("clip_a", 0.7, SourceType.TEXTUAL_GRAPH)), fused);
    }

    @Test
    @DisplayName("Empty channels fuse to nothing")
    void testEmpty() {
        assertTrue(CandidateFusion.fuse(List.of(), List.of()).isEmpty());
    }
}
