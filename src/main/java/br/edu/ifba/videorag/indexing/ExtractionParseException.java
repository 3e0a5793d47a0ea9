package br.edu.ifba.videorag.indexing;

/**
 * The extraction model returned something that is not an extraction document.
 */
public class ExtractionParseException extends RuntimeException {

    public ExtractionParseException(final String message) {
        super(message);
    }

    public ExtractionParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
