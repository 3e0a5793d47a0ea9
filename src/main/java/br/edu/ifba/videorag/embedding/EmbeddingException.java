package br.edu.ifba.videorag.embedding;

/**
 * Raised when a text or multimodal embedding call fails.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(final String message) {
        super(message);
    }

    public EmbeddingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
