package com.example.shab;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of ingesting one publication identifier.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngestionResult {
    private final String publicationId;
    private final Status status;
    private final PublicationType publicationType;
    private final ErrorKind errorKind;
    private final String detail;
    private final int attempts;

    public enum Status {
        INSERTED,
        SKIPPED_DUPLICATE,
        SKIPPED_NON_AUCTION,
        ERROR
    }

    public enum ErrorKind {
        FETCH,
        PARSE,
        STORAGE,
        UNEXPECTED;

        /** Transient kinds worth another attempt; a document that fails to parse will fail again. */
        public boolean isRetryable() {
            return this == FETCH || this == STORAGE;
        }
    }

    public static IngestionResult inserted(String publicationId) {
        return new IngestionResult(publicationId, Status.INSERTED, PublicationType.AUCTION, null, null, 1);
    }

    public static IngestionResult skippedDuplicate(String publicationId, String detail) {
        return new IngestionResult(publicationId, Status.SKIPPED_DUPLICATE, null, null, detail, 1);
    }

    public static IngestionResult skippedNonAuction(String publicationId, PublicationType type) {
        return new IngestionResult(publicationId, Status.SKIPPED_NON_AUCTION, type, null,
                "Publication classified as " + type, 1);
    }

    public static IngestionResult error(String publicationId, ErrorKind kind, String detail) {
        return new IngestionResult(publicationId, Status.ERROR, null, kind, detail, 1);
    }

    public IngestionResult withAttempts(int attempts) {
        return new IngestionResult(publicationId, status, publicationType, errorKind, detail, attempts);
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public boolean isRetryable() {
        return isError() && errorKind != null && errorKind.isRetryable();
    }
}
