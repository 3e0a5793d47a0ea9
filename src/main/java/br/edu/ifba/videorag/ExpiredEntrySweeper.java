package br.edu.ifba.videorag;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically drops expired key-value entries, mostly job-status records past their TTL.
 */
@ApplicationScoped
public class ExpiredEntrySweeper {

    private static final Logger LOG = Logger.getLogger(ExpiredEntrySweeper.class);

    @Inject
    VideoRAGService videoRAGService;

    @Scheduled(every = "{videorag.storage.sweep-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweep() {
        final int removed = videoRAGService.videoRAG().purgeExpired();
        if (removed > 0) {
            LOG.infof("Purged %d expired entries", removed);
        } else {
            LOG.debug("No expired entries to purge");
        }
    }
}
