package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.TextChunk;
import br.edu.ifba.videorag.core.VideoClip;
import br.edu.ifba.videorag.embedding.EmbeddingException;
import br.edu.ifba.videorag.embedding.EmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction;
import br.edu.ifba.videorag.embedding.MultimodalEmbeddingFunction.Modality;
import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.MetadataStorage.ClipMetadata;
import br.edu.ifba.videorag.storage.VectorStorage;
import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding and persistence stages: text-embeds chunks, multimodally embeds clips, and writes
 * chunks, vectors and clip metadata to their stores.
 */
public class IndexPersister {

    private static final Logger logger = LoggerFactory.getLogger(IndexPersister.class);

    static final String SOURCE_VIDEO_ID = "source_video_id";

    private final EmbeddingFunction textEmbedding;
    private final MultimodalEmbeddingFunction multimodalEmbedding;
    private final VectorStorage vectorStorage;
    private final ChunkStorage chunkStorage;
    private final MetadataStorage metadataStorage;
    private final String chunksCollection;
    private final String clipsCollection;
    private final int embeddingBatchSize;

    public IndexPersister(
            @NotNull EmbeddingFunction textEmbedding,
            @NotNull MultimodalEmbeddingFunction multimodalEmbedding,
            @NotNull VectorStorage vectorStorage,
            @NotNull ChunkStorage chunkStorage,
            @NotNull MetadataStorage metadataStorage,
            @NotNull String chunksCollection,
            @NotNull String clipsCollection,
            int embeddingBatchSize) {
        this.textEmbedding = textEmbedding;
        this.multimodalEmbedding = multimodalEmbedding;
        this.vectorStorage = vectorStorage;
        this.chunkStorage = chunkStorage;
        this.metadataStorage = metadataStorage;
        this.chunksCollection = chunksCollection;
        this.clipsCollection = clipsCollection;
        this.embeddingBatchSize = Math.max(1, embeddingBatchSize);
    }

    /**
     * Vectors produced by the embedding stage, parallel to the chunk and clip lists.
     */
    public record EmbeddedIndex(@NotNull List<float[]> chunkVectors, @NotNull List<float[]> clipVectors) {}

    @NotNull
    public CompletableFuture<EmbeddedIndex> embed(@NotNull List<TextChunk> chunks, @NotNull List<VideoClip> clips) {
        final CompletableFuture<List<float[]>> chunkVectors = embedTextsInBatches(
            chunks.stream().map(TextChunk::content).toList());

        final List<Path> clipPaths = clips.stream().map(clip -> Path.of(clip.clipPath())).toList();
        final CompletableFuture<List<float[]>> clipVectors = clipPaths.isEmpty()
            ? CompletableFuture.completedFuture(List.of())
            : Futures.call(() -> multimodalEmbedding.embedVideos(clipPaths))
                .thenApply(byModality -> requireCount(byModality.get(Modality.VISION), clipPaths.size(), "clip"));

        return chunkVectors.thenCombine(clipVectors, (chunksEmbedded, clipsEmbedded) -> {
            logger.info("Embedded {} chunks and {} clips", chunksEmbedded.size(), clipsEmbedded.size());
            return new EmbeddedIndex(chunksEmbedded, clipsEmbedded);
        });
    }

    @NotNull
    public CompletableFuture<Void> persist(
            @NotNull List<TextChunk> chunks,
            @NotNull List<VideoClip> clips,
            @NotNull EmbeddedIndex embedded,
            @NotNull Map<String, String> captions,
            @NotNull Map<String, String> transcripts) {
        final List<CompletableFuture<Void>> writes = new ArrayList<>();

        writes.add(chunkStorage.addChunks(chunks));
        if (!chunks.isEmpty()) {
            writes.add(vectorStorage.add(
                chunksCollection,
                chunks.stream().map(TextChunk::chunkId).toList(),
                embedded.chunkVectors(),
                chunks.stream().map(chunk -> Map.of(SOURCE_VIDEO_ID, chunk.sourceVideoId())).toList()));
        }
        if (!clips.isEmpty()) {
            writes.add(vectorStorage.add(
                clipsCollection,
                clips.stream().map(VideoClip::clipId).toList(),
                embedded.clipVectors(),
                clips.stream().map(clip -> Map.of(SOURCE_VIDEO_ID, clip.sourceVideoId())).toList()));
        }
        for (VideoClip clip : clips) {
            writes.add(metadataStorage.upsert(new ClipMetadata(
                clip.clipId(),
                clip.sourceVideoId(),
                clip.clipPath(),
                clip.startTime(),
                clip.endTime(),
                captions.getOrDefault(clip.clipId(), ""),
                transcripts.getOrDefault(clip.clipId(), ""),
                null)));
        }

        return CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]))
            .thenRun(() -> logger.info("Persisted {} chunks and {} clips", chunks.size(), clips.size()));
    }

    private CompletableFuture<List<float[]>> embedTextsInBatches(List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        final List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += embeddingBatchSize) {
            final List<String> batch = texts.subList(start, Math.min(start + embeddingBatchSize, texts.size()));
            batches.add(Futures.call(() -> textEmbedding.embed(batch))
                .thenApply(vectors -> requireCount(vectors, batch.size(), "chunk")));
        }
        return Futures.allOf(batches).thenApply(results -> {
            final List<float[]> flattened = new ArrayList<>(texts.size());
            results.forEach(flattened::addAll);
            return flattened;
        });
    }

    private static List<float[]> requireCount(List<float[]> vectors, int expected, String kind) {
        if (vectors == null || vectors.size() != expected) {
            throw new EmbeddingException("Expected " + expected + " " + kind + " embeddings but received "
                + (vectors == null ? 0 : vectors.size()));
        }
        return vectors;
    }
}
