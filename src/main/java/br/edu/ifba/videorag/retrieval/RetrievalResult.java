package br.edu.ifba.videorag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * @param candidates clips judged relevant, in fusion order
 */
public record RetrievalResult(@NotNull String query, @NotNull List<CandidateClipInfo> candidates) {

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
