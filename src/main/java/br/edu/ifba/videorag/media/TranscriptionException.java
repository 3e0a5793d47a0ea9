package br.edu.ifba.videorag.media;

public class TranscriptionException extends RuntimeException {

    public TranscriptionException(final String message) {
        super(message);
    }

    public TranscriptionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
