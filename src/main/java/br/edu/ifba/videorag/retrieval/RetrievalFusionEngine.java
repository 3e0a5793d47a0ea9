package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.storage.MetadataStorage;
import br.edu.ifba.videorag.storage.MetadataStorage.ClipMetadata;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Query-time retrieval: runs the textual and visual channels concurrently, fuses their hits,
 * hydrates the candidates from clip metadata in one bulk read and keeps those the relevance
 * judge admits.
 */
public class RetrievalFusionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalFusionEngine.class);

    private final RetrievalChannel textualChannel;
    private final RetrievalChannel visualChannel;
    private final MetadataStorage metadataStorage;
    private final RelevanceFilter relevanceFilter;

    public RetrievalFusionEngine(
            @NotNull RetrievalChannel textualChannel,
            @NotNull RetrievalChannel visualChannel,
            @NotNull MetadataStorage metadataStorage,
            @NotNull RelevanceFilter relevanceFilter) {
        this.textualChannel = textualChannel;
        this.visualChannel = visualChannel;
        this.metadataStorage = metadataStorage;
        this.relevanceFilter = relevanceFilter;
    }

    @NotNull
    public CompletableFuture<RetrievalResult> retrieve(@NotNull String query) {
        final CompletableFuture<List<ChannelHit>> textual = textualChannel.retrieve(query);
        final CompletableFuture<List<ChannelHit>> visual = visualChannel.retrieve(query);

        return textual.thenCombine(visual, CandidateFusion::fuse)
            .thenCompose(hits -> {
                if (hits.isEmpty()) {
                    logger.info("No candidate clips found for '{}'", query);
                    return CompletableFuture.completedFuture(List.<CandidateClipInfo>of());
                }
                logger.info("Found {} unique candidate clips, proceeding to relevance filtering", hits.size());
                return hydrate(hits).thenCompose(candidates -> relevanceFilter.filter(query, candidates));
            })
            .thenApply(filtered -> new RetrievalResult(query, filtered));
    }

    /**
     * Attaches stored captions and transcripts. Hits without metadata are dropped.
     */
    private CompletableFuture<List<CandidateClipInfo>> hydrate(List<ChannelHit> hits) {
        return metadataStorage.getMany(hits.stream().map(ChannelHit::clipId).toList())
            .thenApply(metadata -> toCandidates(hits, metadata));
    }

    static List<CandidateClipInfo> toCandidates(List<ChannelHit> hits, Map<String, ClipMetadata> metadata) {
        final List<CandidateClipInfo> candidates = new ArrayList<>(hits.size());
        for (ChannelHit hit : hits) {
            final ClipMetadata clip = metadata.get(hit.clipId());
            if (clip == null) {
                logger.warn("No metadata for candidate clip {}, dropping it", hit.clipId());
                continue;
            }
            candidates.add(new CandidateClipInfo(
                new RetrievedSource(
                    clip.clipId(),
                    clip.sourceVideoId(),
                    clip.startTime(),
                    clip.endTime(),
                    hit.score(),
                    hit.sourceType()),
                clip.initialCaption(),
                clip.transcript()));
        }
        return candidates;
    }
}
