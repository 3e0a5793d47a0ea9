package br.edu.ifba.videorag.storage;

public class VectorStorageException extends StorageException {

    public VectorStorageException(final String message) {
        super(message);
    }

    public VectorStorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
