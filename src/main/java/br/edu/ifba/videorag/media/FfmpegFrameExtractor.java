package br.edu.ifba.videorag.media;

import br.edu.ifba.videorag.utils.FileCleanup;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts evenly spaced JPEG frames with ffprobe and ffmpeg. Frame {@code i} (1-based)
 * is taken at {@code i * duration / (count + 1)}, so the first and last instants are skipped.
 * Runs on the media worker pool.
 */
public class FfmpegFrameExtractor implements FrameExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegFrameExtractor.class);
    private static final String TASK = "frame-extraction";

    private final String ffmpegPath;
    private final String ffprobePath;
    private final ProcessRunner processRunner;
    private final Executor executor;

    public FfmpegFrameExtractor(
            @NotNull String ffmpegPath,
            @NotNull String ffprobePath,
            @NotNull ProcessRunner processRunner,
            @NotNull Executor executor) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
        this.processRunner = processRunner;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Path>> extract(@NotNull Path clipPath, int frameCount, @NotNull Path outputDir) {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isRegularFile(clipPath)) {
                throw new MediaTaskException("Clip not found: " + clipPath, TASK);
            }
            try {
                Files.createDirectories(outputDir);
                final double duration = probeDuration(clipPath);
                final double interval = duration / (frameCount + 1);
                for (int i = 1; i <= frameCount; i++) {
                    final Path frame = outputDir.resolve(String.format(Locale.ROOT, "frame_%04d.jpg", i));
                    processRunner.run(TASK, List.of(
                        ffmpegPath,
                        "-ss", String.format(Locale.ROOT, "%.3f", interval * i),
                        "-i", clipPath.toString(),
                        "-vframes", "1",
                        "-q:v", "2",
                        "-y",
                        frame.toString()
                    ));
                }
                final List<Path> frames = listFrames(outputDir);
                logger.debug("Extracted {} frames from {}", frames.size(), clipPath.getFileName());
                return frames;
            } catch (IOException e) {
                FileCleanup.deleteRecursively(outputDir);
                throw new MediaTaskException("Cannot write frames to " + outputDir, TASK, e);
            } catch (RuntimeException e) {
                FileCleanup.deleteRecursively(outputDir);
                throw e;
            }
        }, executor);
    }

    private double probeDuration(Path clipPath) {
        final String output = processRunner.run("duration-probe", List.of(
            ffprobePath,
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            clipPath.toString()
        ));
        final String firstLine = output.strip().lines().findFirst().orElse("");
        try {
            final double duration = Double.parseDouble(firstLine);
            if (duration <= 0) {
                throw new MediaTaskException("Clip has no duration: " + clipPath, TASK);
            }
            return duration;
        } catch (NumberFormatException e) {
            throw new MediaTaskException("Unreadable duration '" + firstLine + "' for " + clipPath, TASK, e);
        }
    }

    private static List<Path> listFrames(Path outputDir) throws IOException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(".jpg"))
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
