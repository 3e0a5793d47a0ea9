package br.edu.ifba.videorag.storage;

public class ChunkStorageException extends StorageException {

    public ChunkStorageException(final String message) {
        super(message);
    }

    public ChunkStorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
