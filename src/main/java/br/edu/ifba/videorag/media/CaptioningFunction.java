package br.edu.ifba.videorag.media;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Vision-language collaborator that describes a set of frames.
 * Fails the returned future with {@link CaptioningException}.
 */
@FunctionalInterface
public interface CaptioningFunction {

    /**
     * @param framePaths frames sampled from one clip, in time order
     * @param prompt instruction for the model, including any context text (transcript, keywords)
     * @return the caption
     */
    CompletableFuture<String> caption(@NotNull List<Path> framePaths, @NotNull String prompt);
}
