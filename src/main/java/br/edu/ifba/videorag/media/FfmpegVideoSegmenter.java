package br.edu.ifba.videorag.media;

import br.edu.ifba.videorag.core.VideoClip;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Segments videos with the ffmpeg segment muxer (stream copy, timestamps reset per segment).
 * Segment files are named {@code {videoId}_clip_%04d.mp4}; clip {@code i} spans
 * {@code [i * d, (i + 1) * d]} seconds.
 */
public class FfmpegVideoSegmenter implements VideoSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoSegmenter.class);
    private static final String TASK = "video-segmentation";

    private final String ffmpegPath;
    private final ProcessRunner processRunner;
    private final Executor executor;

    public FfmpegVideoSegmenter(@NotNull String ffmpegPath, @NotNull ProcessRunner processRunner, @NotNull Executor executor) {
        this.ffmpegPath = ffmpegPath;
        this.processRunner = processRunner;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<VideoClip>> segment(
            @NotNull Path videoPath,
            int clipDurationSeconds,
            @NotNull Path outputDir) {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isRegularFile(videoPath)) {
                throw new MediaTaskException("Source video not found: " + videoPath, TASK);
            }
            final String videoId = VideoSegmenter.videoIdOf(videoPath);
            try {
                Files.createDirectories(outputDir);
                for (Path stale : listSegments(outputDir, videoId)) {
                    Files.deleteIfExists(stale);
                }
            } catch (IOException e) {
                throw new MediaTaskException("Cannot prepare clip directory " + outputDir, TASK, e);
            }

            final Path pattern = outputDir.resolve(videoId + "_clip_%04d.mp4");
            logger.info("Segmenting {} into {}s clips", videoPath, clipDurationSeconds);
            processRunner.run(TASK, List.of(
                ffmpegPath,
                "-i", videoPath.toString(),
                "-c", "copy",
                "-map", "0",
                "-segment_time", String.valueOf(clipDurationSeconds),
                "-f", "segment",
                "-reset_timestamps", "1",
                "-y",
                pattern.toString()
            ));

            final List<VideoClip> clips = buildClips(videoId, listSegments(outputDir, videoId), clipDurationSeconds);
            logger.info("Segmented {} into {} clips", videoId, clips.size());
            return clips;
        }, executor);
    }

    /**
     * Builds clip records for segment files already sorted in playback order.
     */
    @NotNull
    public static List<VideoClip> buildClips(@NotNull String videoId, @NotNull List<Path> segments, int clipDurationSeconds) {
        final List<VideoClip> clips = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            final Path segment = segments.get(i);
            clips.add(new VideoClip(
                stemOf(segment),
                videoId,
                segment.toString(),
                (double) i * clipDurationSeconds,
                (double) (i + 1) * clipDurationSeconds
            ));
        }
        return clips;
    }

    private static String stemOf(Path path) {
        return VideoSegmenter.videoIdOf(path);
    }

    private static List<Path> listSegments(Path outputDir, String videoId) {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        final String prefix = videoId + "_clip_";
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                .filter(p -> {
                    final String name = p.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(".mp4");
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MediaTaskException("Cannot list clips in " + outputDir, TASK, e);
        }
    }
}
