package br.edu.ifba.videorag.generation;

import org.jetbrains.annotations.NotNull;

/**
 * Context block for one filtered clip.
 *
 * @param queryFocused true when the visuals come from query-focused re-captioning,
 *                     false when they fall back to the stored initial caption
 */
public record EnrichedClip(
    @NotNull String clipId,
    @NotNull String visuals,
    @NotNull String transcript,
    boolean queryFocused
) {

    static final String QUERY_FOCUSED_TAG = "**Visuals (Query-Focused Description):**";
    static final String INITIAL_TAG = "**Visuals (Initial Description):**";
    static final String TRANSCRIPT_TAG = "**Spoken Transcript:**";

    /**
     * Visual and transcript lines, without the clip header.
     */
    @NotNull
    public String body() {
        return (queryFocused ? QUERY_FOCUSED_TAG : INITIAL_TAG) + " " + visuals + "\n"
            + TRANSCRIPT_TAG + " " + transcript + "\n";
    }

    @NotNull
    public String toContextBlock() {
        return "--- Context from Clip ID: " + clipId + " ---\n" + body();
    }
}
