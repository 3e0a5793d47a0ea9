package br.edu.ifba.videorag.media;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.DisplayName;
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

class FfmpegFrameExtractorTest {

    @TempDir
    Path tempDir;

    /**
     * Answers the duration probe with a fixed value and writes each requested frame.
     */
    static class FakeRunner extends ProcessRunner {

        private final String probeOutput;
        final List<String> seekOffsets = new ArrayList<>();

        FakeRunner(String probeOutput) {
            this.probeOutput = probeOutput;
        }

        @Override
        @NotNull
        public String run(@NotNull String taskName, @NotNull List<String> command) {
            if (command.get(0).equals("ffprobe")) {
                return probeOutput;
            }
            seekOffsets.add(command.get(command.indexOf("-ss") + 1));
            try {
                Files.writeString(Path.of(command.get(command.size() - 1)), "jpeg");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return "";
        }
    }

    private Path clip() throws IOException {
        final Path clip = tempDir.resolve("demo_clip_0000.mp4");
        Files.writeString(clip, "clip");
        return clip;
    }

    @Test
    @DisplayName("Frames are evenly spaced inside the clip and returned in time order")
    void testEvenlySpacedFrames() throws IOException {
        final FakeRunner runner = new FakeRunner("12.000000\n");
        final FfmpegFrameExtractor extractor = new FfmpegFrameExtractor("ffmpeg", "ffprobe", runner, Runnable::run);

        final List<Path> frames = extractor.extract(clip(), 3, tempDir.resolve("frames")).join();

        assertEquals(3, frames.size());
        assertEquals("frame_0001.jpg", frames.get(0).getFileName().toString());
        assertEquals(List.of("3.000", "6.000", "9.000"), runner.seekOffsets);
    }

    @Test
    @DisplayName("An unreadable duration fails and removes the frame directory")
    void testUnreadableDuration() throws IOException {
        final FfmpegFrameExtractor extractor = new FfmpegFrameExtractor("ffmpeg", "ffprobe", new FakeRunner("N/A"), Runnable::run);
        final Path frameDir = tempDir.resolve("frames");
        final Path clip = clip();

        final CompletionException error = assertThrows(CompletionException.class,
            () -> extractor.extract(clip, 3, frameDir).join());

        assertInstanceOf(MediaTaskException.class, error.getCause());
        assertFalse(Files.exists(frameDir), "The frame directory should be cleaned up");
    }
}
