package br.edu.ifba.videorag.media;

/**
 * Failure of a media task (segmentation, probing, frame extraction).
 * Fatal to the clip or video being processed.
 */
public class MediaTaskException extends RuntimeException {

    private final String taskName;

    public MediaTaskException(final String message, final String taskName) {
        super(message);
        this.taskName = taskName;
    }

    public MediaTaskException(final String message, final String taskName, final Throwable cause) {
        super(message, cause);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
