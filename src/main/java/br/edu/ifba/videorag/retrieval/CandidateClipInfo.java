package br.edu.ifba.videorag.retrieval;

import org.jetbrains.annotations.NotNull;

/**
 * Query-scoped view of a candidate clip: where it came from plus its stored caption and transcript.
 */
public record CandidateClipInfo(
    @NotNull RetrievedSource source,
    @NotNull String initialCaption,
    @NotNull String transcript
) {

    public CandidateClipInfo {
        initialCaption = initialCaption == null ? "" : initialCaption;
        transcript = transcript == null ? "" : transcript;
    }

    @NotNull
    public String clipId() {
        return source.clipId();
    }

    /**
     * Caption and transcript in the form shown to the relevance judge and the answer prompt.
     */
    @NotNull
    public String combinedText() {
        return "Visual Caption: " + initialCaption + "\nTranscript: " + transcript;
    }
}
