package com.example.shab;

/**
 * Document is not well-formed XML or lacks a mandatory field.
 */
public class ParseException extends IngestionException {

    public ParseException(String publicationId, String message) {
        super(publicationId, message, null);
    }

    public ParseException(String publicationId, String message, Throwable cause) {
        super(publicationId, message, cause);
    }

    @Override
    public IngestionResult.ErrorKind getKind() {
        return IngestionResult.ErrorKind.PARSE;
    }
}
