package br.edu.ifba.videorag.storage;

public class MetadataStorageException extends StorageException {

    public MetadataStorageException(final String message) {
        super(message);
    }

    public MetadataStorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
