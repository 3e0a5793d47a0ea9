package br.edu.ifba.videorag.generation;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Formats clip bounds as {@code MM:SS - MM:SS}, truncating fractional seconds.
 */
public final class TimestampFormatter {

    private TimestampFormatter() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String format(double startSeconds, double endSeconds) {
        return clock(startSeconds) + " - " + clock(endSeconds);
    }

    private static String clock(double seconds) {
        final int whole = (int) seconds;
        return String.format(Locale.ROOT, "%02d:%02d", whole / 60, whole % 60);
    }
}
