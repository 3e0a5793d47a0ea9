package br.edu.ifba.videorag.media;

import br.edu.ifba.videorag.core.VideoClip;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FfmpegVideoSegmenter}. The process runner is replaced by one that writes
 * the segment files ffmpeg would produce.
 */
class FfmpegVideoSegmenterTest {

    @TempDir
    Path tempDir;

    /**
     * Writes {@code segments} files following the output pattern, the last argument of the command.
     */
    static class SegmentWritingRunner extends ProcessRunner {

        private final int segments;
        final List<List<String>> commands = new ArrayList<>();

        SegmentWritingRunner(int segments) {
            this.segments = segments;
        }

        @Override
        @NotNull
        public String run(@NotNull String taskName, @NotNull List<String> command) {
            commands.add(command);
            final String pattern = command.get(command.size() - 1);
            try {
                for (int i = 0; i < segments; i++) {
                    Files.writeString(Path.of(String.format(pattern, i)), "segment");
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return "";
        }
    }

    private Path sourceVideo(String name) throws IOException {
        final Path video = tempDir.resolve(name);
        Files.writeString(video, "source");
        return video;
    }

    @Nested
    @DisplayName("Segmentation")
    class SegmentationTests {

        @Test
        @DisplayName("A 90 second video cut into 30 second clips yields three ordered clips")
        void testThreeClips() throws IOException {
            final SegmentWritingRunner runner = new SegmentWritingRunner(3);
            final FfmpegVideoSegmenter segmenter = new FfmpegVideoSegmenter("ffmpeg", runner, Runnable::run);

            final List<VideoClip> clips = segmenter.segment(sourceVideo("lecture.mp4"), 30, tempDir.resolve("clips")).join();

            assertEquals(3, clips.size());
            assertEquals("lecture_clip_0000", clips.get(0).clipId());
            assertEquals("lecture_clip_0002", clips.get(2).clipId());
            assertEquals(60.0, clips.get(2).startTime(), 1e-9);
            assertEquals(90.0, clips.get(2).endTime(), 1e-9);
            assertTrue(clips.stream().allMatch(clip -> clip.sourceVideoId().equals("lecture")));

            final List<String> command = runner.commands.get(0);
            assertTrue(command.containsAll(List.of("-c", "copy", "-segment_time", "30", "-reset_timestamps", "1")),
                "Segments should be stream-copied with reset timestamps: " + command);
        }

        @Test
        @DisplayName("Clips left by an earlier run are replaced")
        void testStaleClipsRemoved() throws IOException {
            final Path clipDir = Files.createDirectories(tempDir.resolve("clips"));
            Files.writeString(clipDir.resolve("lecture_clip_0007.mp4"), "stale");

            final List<VideoClip> clips = new FfmpegVideoSegmenter("ffmpeg", new SegmentWritingRunner(2), Runnable::run)
                .segment(sourceVideo("lecture.mp4"), 30, clipDir).join();

            assertEquals(2, clips.size());
            assertFalse(Files.exists(clipDir.resolve("lecture_clip_0007.mp4")));
        }

        @Test
        @DisplayName("A missing source fails with a media task error")
        void testMissingSource() {
            final FfmpegVideoSegmenter segmenter = new FfmpegVideoSegmenter("ffmpeg", new SegmentWritingRunner(1), Runnable::run);

            final CompletionException error = assertThrows(CompletionException.class,
                () -> segmenter.segment(tempDir.resolve("missing.mp4"), 30, tempDir.resolve("clips")).join());

            final MediaTaskException cause = assertInstanceOf(MediaTaskException.class, error.getCause());
            assertEquals("video-segmentation", cause.getTaskName());
        }
    }

    @Test
    @DisplayName("Clip bounds follow the segment index")
    void testBuildClips() {
        final List<VideoClip> clips = FfmpegVideoSegmenter.buildClips("v", List.of(
            Path.of("/c/v_clip_0000.mp4"), Path.of("/c/v_clip_0001.mp4")), 10);

        assertEquals(List.of(
            new VideoClip("v_clip_0000", "v", "/c/v_clip_0000.mp4", 0.0, 10.0),
            new VideoClip("v_clip_0001", "v", "/c/v_clip_0001.mp4", 10.0, 20.0)), clips);
    }
}
