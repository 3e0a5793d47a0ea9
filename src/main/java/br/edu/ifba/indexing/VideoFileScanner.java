package br.edu.ifba.indexing;

import br.edu.ifba.videorag.media.MediaTaskException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves an indexing request path to the video files it names.
 */
public final class VideoFileScanner {

    static final String SUBMISSION_TASK = "indexing-submission";
    static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".mkv", ".mov", ".avi");

    private VideoFileScanner() {
    }

    /**
     * A file is returned as is. A directory yields its direct children with a video
     * extension, sorted by name.
     *
     * @throws MediaTaskException if the path does not exist
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> scan(final Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        if (!Files.isDirectory(path)) {
            throw new MediaTaskException("Video path not found: " + path, SUBMISSION_TASK);
        }
        try (Stream<Path> children = Files.list(path)) {
            return children
                .filter(Files::isRegularFile)
                .filter(VideoFileScanner::isVideo)
                .sorted()
                .toList();
        }
    }

    static boolean isVideo(final Path file) {
        final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return VIDEO_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
