package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.core.VideoClip;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups consecutive clips into text chunks for knowledge-graph extraction.
 *
 * <p>Clips keep their order and each clip lands in exactly one chunk; the last chunk may hold
 * fewer than {@code chunkSizeInClips} clips. A clip missing from the caption or transcript map
 * contributes an empty field.</p>
 */
public final class ChunkAssembler {

    static final String CLIP_SEPARATOR = "\n---\n";

    private ChunkAssembler() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param videoId id of the source video
     * @param clips clips in playback order
     * @param captions caption text by clip id
     * @param transcripts transcript text by clip id
     * @param chunkSizeInClips clips per chunk, at least 1
     * @return {@code ceil(clips / chunkSizeInClips)} chunks
     */
    @NotNull
    public static List<TextChunk> assemble(
            @NotNull String videoId,
            @NotNull List<VideoClip> clips,
            @NotNull Map<String, String> captions,
            @NotNull Map<String, String> transcripts,
            int chunkSizeInClips) {
        if (chunkSizeInClips < 1) {
            throw new IllegalArgumentException("chunkSizeInClips must be at least 1");
        }

        final List<TextChunk> chunks = new ArrayList<>((clips.size() + chunkSizeInClips - 1) / chunkSizeInClips);
        for (int start = 0; start < clips.size(); start += chunkSizeInClips) {
            final List<VideoClip> group = clips.subList(start, Math.min(start + chunkSizeInClips, clips.size()));
            final List<String> blocks = new ArrayList<>(group.size());
            final List<String> clipIds = new ArrayList<>(group.size());
            for (VideoClip clip : group) {
                blocks.add(clipBlock(
                    clip.clipId(),
                    captions.getOrDefault(clip.clipId(), ""),
                    transcripts.getOrDefault(clip.clipId(), "")));
                clipIds.add(clip.clipId());
            }
            chunks.add(new TextChunk(
                chunkId(videoId, start / chunkSizeInClips),
                videoId,
                String.join(CLIP_SEPARATOR, blocks),
                clipIds));
        }
        return chunks;
    }

    @NotNull
    static String chunkId(@NotNull String videoId, int chunkIndex) {
        return String.format(Locale.ROOT, "%s_chunk_%04d", videoId, chunkIndex);
    }

    @NotNull
    static String clipBlock(@NotNull String clipId, @NotNull String caption, @NotNull String transcript) {
        return "CLIP_ID: " + clipId + "\nVISUALS: " + caption + "\nAUDIO: " + transcript + "\n";
    }
}
