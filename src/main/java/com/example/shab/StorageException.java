package com.example.shab;

/**
 * Write or transaction failure. The transaction has been rolled back when this is thrown.
 */
public class StorageException extends IngestionException {

    public StorageException(String publicationId, String message, Throwable cause) {
        super(publicationId, message, cause);
    }

    @Override
    public IngestionResult.ErrorKind getKind() {
        return IngestionResult.ErrorKind.STORAGE;
    }
}
