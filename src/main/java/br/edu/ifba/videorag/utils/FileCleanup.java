package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Removes temporary frame directories. Cleanup failures are logged, never thrown,
 * so they cannot mask the outcome of the work that produced the files.
 */
public final class FileCleanup {

    private static final Logger logger = LoggerFactory.getLogger(FileCleanup.class);

    private FileCleanup() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Deletes a directory tree if it exists.
     *
     * @return true if nothing remains at {@code path}
     */
    public static boolean deleteRecursively(@NotNull Path path) {
        if (!Files.exists(path)) {
            return true;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            return true;
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to clean up {}: {}", path, e.getMessage());
            return false;
        }
    }
}
