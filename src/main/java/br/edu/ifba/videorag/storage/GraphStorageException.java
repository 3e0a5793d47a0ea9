package br.edu.ifba.videorag.storage;

public class GraphStorageException extends StorageException {

    public GraphStorageException(final String message) {
        super(message);
    }

    public GraphStorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
