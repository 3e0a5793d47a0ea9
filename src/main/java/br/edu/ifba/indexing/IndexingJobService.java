package br.edu.ifba.indexing;

import br.edu.ifba.shared.UuidUtils;
import br.edu.ifba.videorag.VideoRAGService;
import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.indexing.IndexingSummary;
import br.edu.ifba.videorag.indexing.JobStatus;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queues indexing jobs and answers status lookups.
 *
 * <p>Each job is registered as {@code pending} before this service returns, then runs on a
 * bounded worker pool. The worker thread carries the job id in the MDC under {@code job.id}
 * while the job runs. Failures are recorded on the job's status by the pipeline itself.</p>
 */
@ApplicationScoped
public class IndexingJobService {

    private static final Logger LOG = Logger.getLogger(IndexingJobService.class);

    static final String MDC_JOB_ID = "job.id";
    static final String STATUS_PATH = "/api/v1/indexing/status/";

    @Inject
    VideoRAGService videoRAGService;

    @Inject
    VideoRAGProperties properties;

    private ExecutorService jobExecutor;

    @PostConstruct
    void initialize() {
        final int workers = properties.concurrency().indexingJobs();
        this.jobExecutor = Executors.newFixedThreadPool(workers, new JobThreadFactory());
        LOG.infof("Indexing job service started with %d workers", workers);
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down indexing job workers...");
        jobExecutor.shutdownNow();
        try {
            if (!jobExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Indexing job workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Registers and queues one job per video found at {@code videoPath}.
     *
     * @throws br.edu.ifba.videorag.media.MediaTaskException if the path does not exist
     * @throws IllegalArgumentException if a directory holds no videos
     */
    public IndexingResponse submit(final String videoPath) {
        final List<Path> videos;
        try {
            videos = VideoFileScanner.scan(Path.of(videoPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list videos in " + videoPath, e);
        }
        if (videos.isEmpty()) {
            throw new IllegalArgumentException("No video files (.mp4, .mkv, .mov, .avi) found in " + videoPath);
        }

        final List<String> jobIds = new ArrayList<>(videos.size());
        for (final Path video : videos) {
            final String jobId = UuidUtils.newJobId();
            videoRAGService.videoRAG().registerJob(jobId).join();
            jobExecutor.execute(() -> runJob(jobId, video));
            jobIds.add(jobId);
            LOG.infof("Queued indexing job %s for %s", jobId, video);
        }

        final String message = jobIds.size() == 1
            ? "Indexing job successfully queued."
            : jobIds.size() + " indexing jobs successfully queued.";
        return new IndexingResponse(jobIds, message, jobIds.stream().map(id -> STATUS_PATH + id).toList());
    }

    /**
     * @throws JobNotFoundException if no record exists, including after it expired
     */
    public JobStatus status(final String jobId) {
        return videoRAGService.videoRAG().jobStatus(jobId).join()
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    void runJob(final String jobId, final Path video) {
        MDC.put(MDC_JOB_ID, jobId);
        final long startTime = System.currentTimeMillis();
        try {
            LOG.infof("Indexing job started for %s", video);
            final IndexingSummary summary = videoRAGService.videoRAG().indexVideo(video, jobId).join();
            LOG.infof("Indexing job finished in %d ms: %d clips, %d chunks, %d degraded transcripts, %d degraded captions",
                System.currentTimeMillis() - startTime,
                summary.clipCount(),
                summary.chunkCount(),
                summary.degradedTranscripts(),
                summary.degradedCaptions());
        } catch (Exception e) {
            LOG.errorf("Indexing job failed after %d ms: %s",
                System.currentTimeMillis() - startTime, Futures.describe(e));
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private static final class JobThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, "videorag-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
