package com.example.shab;

import lombok.Getter;

/**
 * Transport failure, timeout or non-2xx answer from the SHAB API.
 */
@Getter
public class FetchException extends IngestionException {
    /** HTTP status, or -1 when no response was received. */
    private final int status;

    public FetchException(String publicationId, String message, Throwable cause) {
        super(publicationId, message, cause);
        this.status = -1;
    }

    public FetchException(String publicationId, int status, String message) {
        super(publicationId, message, null);
        this.status = status;
    }

    @Override
    public IngestionResult.ErrorKind getKind() {
        return IngestionResult.ErrorKind.FETCH;
    }
}
