package br.edu.ifba.videorag.retrieval;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One independent way of turning a query into scored clip ids.
 * Implementations never fail: a channel error yields an empty list.
 */
public interface RetrievalChannel {

    @NotNull
    CompletableFuture<List<ChannelHit>> retrieve(@NotNull String query);
}
