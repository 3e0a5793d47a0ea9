package br.edu.ifba.videorag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges channel hits into one candidate per clip id.
 */
public final class CandidateFusion {

    private CandidateFusion() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Textual hits are taken first. A clip found by both channels keeps the channel that saw
     * it first and the higher of the two scores.
     *
     * @return fused hits in first-seen order
     */
    @NotNull
    public static List<ChannelHit> fuse(@NotNull List<ChannelHit> textual, @NotNull List<ChannelHit> visual) {
        final Map<String, ChannelHit> byClip = new LinkedHashMap<>();
        for (List<ChannelHit> channel : List.of(textual, visual)) {
            for (ChannelHit hit : channel) {
                byClip.merge(hit.clipId(), hit, (first, later) -> first.score() >= later.score()
                    ? first
                    : new ChannelHit(first.clipId(), later.score(), first.sourceType()));
            }
        }
        return new ArrayList<>(byClip.values());
    }
}
