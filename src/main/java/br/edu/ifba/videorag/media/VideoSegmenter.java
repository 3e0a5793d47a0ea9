package br.edu.ifba.videorag.media;

import br.edu.ifba.videorag.core.VideoClip;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Splits a source video into fixed-duration clips.
 */
public interface VideoSegmenter {

    /**
     * @param videoPath source video
     * @param clipDurationSeconds target clip length
     * @param outputDir directory receiving the clip files
     * @return clips in playback order; empty if the tool produced no segments
     * @throws MediaTaskException (through the future) when the source is missing or the tool fails
     */
    CompletableFuture<List<VideoClip>> segment(@NotNull Path videoPath, int clipDurationSeconds, @NotNull Path outputDir);

    /**
     * Video id is the source file name without its extension.
     */
    @NotNull
    static String videoIdOf(@NotNull Path videoPath) {
        final String name = videoPath.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
