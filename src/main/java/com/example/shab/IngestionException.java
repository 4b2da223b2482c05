package com.example.shab;

import lombok.Getter;

/**
 * Failure while ingesting a single publication. Caught per identifier by
 * {@link IngestionService}; never aborts a batch.
 */
@Getter
public abstract class IngestionException extends Exception {
    private final String publicationId;

    protected IngestionException(String publicationId, String message, Throwable cause) {
        super(message, cause);
        this.publicationId = publicationId;
    }

    public abstract IngestionResult.ErrorKind getKind();
}
