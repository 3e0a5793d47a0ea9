package br.edu.ifba.videorag.media;

public class CaptioningException extends RuntimeException {

    public CaptioningException(final String message) {
        super(message);
    }

    public CaptioningException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
