package br.edu.ifba.videorag.media;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Samples representative frames from a clip.
 */
public interface FrameExtractor {

    /**
     * Extracts {@code frameCount} evenly spaced frames into {@code outputDir}.
     *
     * @return frame files sorted by name (time order)
     * @throws MediaTaskException (through the future) when probing or extraction fails;
     *         the output directory is removed in that case
     */
    CompletableFuture<List<Path>> extract(@NotNull Path clipPath, int frameCount, @NotNull Path outputDir);
}
