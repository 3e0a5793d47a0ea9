package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.storage.ChunkStorage;
import br.edu.ifba.videorag.storage.ChunkStorageException;
import br.edu.ifba.videorag.utils.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persists job-status records as JSON in the key-value store under {@code job_status:{jobId}},
 * with a bounded expiry. Writes are last-writer-wins.
 */
public class JobStatusTracker {

    static final String KEY_PREFIX = "job_status:";

    private final ChunkStorage store;
    private final Duration ttl;

    public JobStatusTracker(@NotNull ChunkStorage store, @NotNull Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    @NotNull
    public static String key(@NotNull String jobId) {
        return KEY_PREFIX + jobId;
    }

    @NotNull
    public CompletableFuture<Void> save(@NotNull JobStatus status) {
        final String json;
        try {
            json = JsonUtil.MAPPER.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new ChunkStorageException("Cannot serialize status of job " + status.id(), e));
        }
        return store.set(key(status.id()), json, ttl);
    }

    @NotNull
    public CompletableFuture<Optional<JobStatus>> find(@NotNull String jobId) {
        return store.get(key(jobId)).thenApply(json -> json.map(value -> {
            try {
                return JsonUtil.MAPPER.readValue(value, JobStatus.class);
            } catch (JsonProcessingException e) {
                throw new ChunkStorageException("Corrupt status record for job " + jobId, e);
            }
        }));
    }
}
