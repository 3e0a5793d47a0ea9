package br.edu.ifba.videorag.indexing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Externally observable state of an indexing job.
 *
 * <p>Transitions follow {@code pending -> processing -> completed | error}. While processing,
 * progress never decreases; {@code completed} carries 100 and {@code error} carries -1 together
 * with a non-null message. Transition methods return a new instance and reject anything else
 * with {@link IllegalStateException}.</p>
 */
public record JobStatus(
    @JsonProperty("id") @NotNull String id,
    @JsonProperty("status") @NotNull Status status,
    @JsonProperty("progress") int progress,
    @JsonProperty("error") @Nullable String error
) {

    public static final int FAILED_PROGRESS = -1;

    public enum Status {
        PENDING,
        PROCESSING,
        COMPLETED,
        ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromValue(String value) {
            return Status.valueOf(value.toUpperCase(Locale.ROOT));
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == ERROR;
        }
    }

    @NotNull
    public static JobStatus pending(@NotNull String jobId) {
        return new JobStatus(jobId, Status.PENDING, 0, null);
    }

    /**
     * Enters or continues processing at the given progress.
     */
    @NotNull
    public JobStatus processing(int newProgress) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.value());
        }
        if (newProgress < progress || newProgress > 100) {
            throw new IllegalStateException(
                "Job " + id + " progress cannot move from " + progress + " to " + newProgress);
        }
        return new JobStatus(id, Status.PROCESSING, newProgress, null);
    }

    @NotNull
    public JobStatus completed() {
        if (status != Status.PROCESSING) {
            throw new IllegalStateException("Job " + id + " cannot complete from " + status.value());
        }
        return new JobStatus(id, Status.COMPLETED, 100, null);
    }

    @NotNull
    public JobStatus failed(@Nullable String message) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.value());
        }
        final String errorMessage = message == null || message.isBlank() ? "Unknown error" : message;
        return new JobStatus(id, Status.ERROR, FAILED_PROGRESS, errorMessage);
    }
}
