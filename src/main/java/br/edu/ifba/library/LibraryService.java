package br.edu.ifba.library;

import br.edu.ifba.videorag.VideoRAGService;
import br.edu.ifba.videorag.storage.MetadataStorage.VideoSummary;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Locale;

@ApplicationScoped
public class LibraryService {

    private static final Logger LOG = Logger.getLogger(LibraryService.class);

    @Inject
    VideoRAGService videoRAGService;

    /**
     * Lists indexed videos, newest first.
     *
     * @param search case-insensitive filter on video id, captions and transcripts, or null/blank for all videos
     */
    public List<VideoLibraryItem> list(final String search) {
        final String filter = search == null || search.isBlank() ? null : search.strip();
        final List<VideoSummary> summaries = videoRAGService.videoRAG().summarizeVideos(filter).join();
        LOG.debugf("Library lookup (search: %s) returned %d videos", filter, summaries.size());
        return summaries.stream().map(LibraryService::toItem).toList();
    }

    static VideoLibraryItem toItem(final VideoSummary summary) {
        return new VideoLibraryItem(
            summary.videoId(),
            titleOf(summary.videoId()),
            formatDuration(summary.durationSeconds()),
            summary.clipCount(),
            summary.indexedAt().toString());
    }

    /**
     * {@code my_first-video} becomes {@code My First Video}.
     */
    static String titleOf(final String videoId) {
        final String spaced = videoId.replace('_', ' ').replace('-', ' ');
        final StringBuilder title = new StringBuilder(spaced.length());
        boolean startOfWord = true;
        for (final char c : spaced.toCharArray()) {
            if (Character.isLetter(c)) {
                title.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                title.append(c);
                startOfWord = true;
            }
        }
        return title.toString();
    }

    static String formatDuration(final double seconds) {
        final long whole = (long) Math.max(0, seconds);
        return String.format(Locale.ROOT, "%d:%02d", whole / 60, whole % 60);
    }
}
