package br.edu.ifba.videorag.storage;

/**
 * Base type of persistence collaborator failures. Each store raises its own subtype.
 */
public class StorageException extends RuntimeException {

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
