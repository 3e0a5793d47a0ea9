package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.AudioTranscript;
import br.edu.ifba.videorag.core.ItemResult;
import br.edu.ifba.videorag.core.VideoClip;
import br.edu.ifba.videorag.core.VideoRAGPrompts;
import br.edu.ifba.videorag.core.VisualCaption;
import br.edu.ifba.videorag.media.CaptioningException;
import br.edu.ifba.videorag.media.CaptioningFunction;
import br.edu.ifba.videorag.media.FrameExtractor;
import br.edu.ifba.videorag.media.SpeechToTextFunction;
import br.edu.ifba.videorag.utils.FileCleanup;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Per-clip transcription and captioning. Each clip is an independent unit of work; a failing clip
 * degrades to an empty text instead of aborting the batch.
 */
public class ClipAnnotator {

    private static final Logger logger = LoggerFactory.getLogger(ClipAnnotator.class);

    private final SpeechToTextFunction speechToText;
    private final CaptioningFunction captioning;
    private final FrameExtractor frameExtractor;
    private final Path tempFrameDir;
    private final int framesPerClip;

    public ClipAnnotator(
            @NotNull SpeechToTextFunction speechToText,
            @NotNull CaptioningFunction captioning,
            @NotNull FrameExtractor frameExtractor,
            @NotNull Path tempFrameDir,
            int framesPerClip) {
        this.speechToText = speechToText;
        this.captioning = captioning;
        this.frameExtractor = frameExtractor;
        this.tempFrameDir = tempFrameDir;
        this.framesPerClip = framesPerClip;
    }

    /**
     * Transcribes every clip concurrently.
     *
     * @return transcript result by clip id, in clip order
     */
    @NotNull
    public CompletableFuture<Map<String, ItemResult<AudioTranscript>>> transcribeAll(@NotNull List<VideoClip> clips) {
        final List<CompletableFuture<ItemResult<AudioTranscript>>> futures = clips.stream()
            .map(clip -> Futures.call(() -> speechToText.transcribe(Path.of(clip.clipPath())))
                .thenApply(text -> ItemResult.ok(new AudioTranscript(clip.clipId(), text == null ? "" : text.strip())))
                .exceptionally(error -> {
                    logger.warn("Transcription failed for clip {}: {}", clip.clipId(), Futures.describe(error));
                    return ItemResult.degraded(new AudioTranscript(clip.clipId(), ""), error);
                }))
            .toList();
        return Futures.allOf(futures).thenApply(results -> byClipId(clips, results, "transcription"));
    }

    /**
     * Captions every clip concurrently, using its transcript as context.
     * Frame directories are removed after each clip whatever the outcome.
     *
     * @return caption result by clip id, in clip order
     */
    @NotNull
    public CompletableFuture<Map<String, ItemResult<VisualCaption>>> captionAll(
            @NotNull List<VideoClip> clips,
            @NotNull Map<String, String> transcripts) {
        final List<CompletableFuture<ItemResult<VisualCaption>>> futures = clips.stream()
            .map(clip -> captionClip(clip, transcripts.getOrDefault(clip.clipId(), "")))
            .toList();
        return Futures.allOf(futures).thenApply(results -> byClipId(clips, results, "captioning"));
    }

    private CompletableFuture<ItemResult<VisualCaption>> captionClip(VideoClip clip, String transcript) {
        final Path frameDir = tempFrameDir.resolve(clip.clipId());
        return Futures.call(() -> frameExtractor.extract(Path.of(clip.clipPath()), framesPerClip, frameDir))
            .thenCompose(frames -> {
                if (frames.isEmpty()) {
                    throw new CaptioningException("No frames extracted for clip " + clip.clipId());
                }
                return captioning.caption(frames, VideoRAGPrompts.initialCaption(transcript));
            })
            .whenComplete((caption, error) -> FileCleanup.deleteRecursively(frameDir))
            .thenApply(caption -> ItemResult.ok(new VisualCaption(clip.clipId(), caption == null ? "" : caption.strip())))
            .exceptionally(error -> {
                logger.warn("Captioning failed for clip {}: {}", clip.clipId(), Futures.describe(error));
                return ItemResult.degraded(new VisualCaption(clip.clipId(), ""), error);
            });
    }

    private static <T> Map<String, ItemResult<T>> byClipId(
            List<VideoClip> clips,
            List<ItemResult<T>> results,
            String stage) {
        final Map<String, ItemResult<T>> byClip = new LinkedHashMap<>();
        int degraded = 0;
        for (int i = 0; i < clips.size(); i++) {
            final ItemResult<T> result = results.get(i);
            byClip.put(clips.get(i).clipId(), result);
            if (result.degraded()) {
                degraded++;
            }
        }
        if (degraded > 0) {
            logger.warn("{} of {} clips degraded during {}", degraded, clips.size(), stage);
        }
        return byClip;
    }

    /**
     * Projects results to their texts, the form consumed by chunk assembly and persistence.
     */
    @NotNull
    public static Map<String, String> transcriptTexts(@NotNull Map<String, ItemResult<AudioTranscript>> results) {
        return texts(results, AudioTranscript::text);
    }

    @NotNull
    public static Map<String, String> captionTexts(@NotNull Map<String, ItemResult<VisualCaption>> results) {
        return texts(results, VisualCaption::text);
    }

    private static <T> Map<String, String> texts(Map<String, ItemResult<T>> results, Function<T, String> text) {
        final Map<String, String> values = new LinkedHashMap<>();
        results.forEach((clipId, result) -> values.put(clipId, text.apply(result.value())));
        return values;
    }
}
