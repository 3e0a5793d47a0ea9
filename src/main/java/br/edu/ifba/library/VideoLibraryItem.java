package br.edu.ifba.library;

/**
 * One indexed video as listed by the library endpoint.
 *
 * @param duration {@code M:SS}, minutes unbounded
 * @param indexedAt ISO-8601 instant at which the first clip was stored
 */
public record VideoLibraryItem(
    String videoId,
    String title,
    String duration,
    int clipCount,
    String indexedAt
) {}
