package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.Optional;

/**
 * Single entry point of the pipeline: fetch, classify, parse and store one publication.
 * Per-identifier failures come back as {@link IngestionResult#error} and are never thrown.
 */
@Slf4j
public class IngestionService {
    public static final String MDC_PUBLICATION_ID = "publicationId";

    private final ShabClient client;
    private final PublicationClassifier classifier;
    private final ShabParser parser;
    private final DatabaseManager databaseManager;
    private final boolean skipKnownBeforeFetch;

    public IngestionService(ShabClient client, PublicationClassifier classifier, ShabParser parser,
                            DatabaseManager databaseManager, boolean skipKnownBeforeFetch) {
        this.client = client;
        this.classifier = classifier;
        this.parser = parser;
        this.databaseManager = databaseManager;
        this.skipKnownBeforeFetch = skipKnownBeforeFetch;
    }

    /**
     * Trims the identifier and strips the leading '@' found in exported id lists.
     *
     * @return the cleaned identifier, or null when nothing is left
     */
    public static String cleanId(String raw) {
        if (raw == null) {
            return null;
        }
        String id = raw.trim();
        if (id.startsWith("@")) {
            id = id.substring(1).trim();
        }
        return id.isEmpty() ? null : id;
    }

    public IngestionResult ingest(String rawId) {
        String id = cleanId(rawId);
        if (id == null) {
            return IngestionResult.error(rawId, IngestionResult.ErrorKind.UNEXPECTED, "Blank publication identifier");
        }
        MDC.put(MDC_PUBLICATION_ID, id);
        try {
            return process(id);
        } catch (IngestionException e) {
            log.error("Ingestion of {} failed ({}): {}", id, e.getKind(), e.getMessage());
            return IngestionResult.error(id, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error ingesting {}: {}", id, e.getMessage(), e);
            return IngestionResult.error(id, IngestionResult.ErrorKind.UNEXPECTED, e.toString());
        } finally {
            MDC.remove(MDC_PUBLICATION_ID);
        }
    }

    private IngestionResult process(String id) throws IngestionException {
        if (skipKnownBeforeFetch && databaseManager.exists(id)) {
            log.info("Publication {} already stored, not fetching", id);
            return IngestionResult.skippedDuplicate(id, "Already stored");
        }
        String xml = fetch(id);
        PublicationType type = classifier.classify(xml, id);
        if (type != PublicationType.AUCTION) {
            log.info("Publication {} is {}, skipping", id, type);
            return IngestionResult.skippedNonAuction(id, type);
        }
        ParsedPublication publication = parser.parse(xml, id);
        UpsertOutcome outcome = databaseManager.upsert(publication);
        if (outcome == UpsertOutcome.INSERTED) {
            return IngestionResult.inserted(id);
        }
        return IngestionResult.skippedDuplicate(id, "Stored by a concurrent or earlier run");
    }

    /**
     * Fetches and parses without storing. Empty when the document is not an auction.
     */
    public Optional<ParsedPublication> preview(String rawId) throws IngestionException {
        String id = cleanId(rawId);
        if (id == null) {
            throw new ParseException(rawId, "Blank publication identifier");
        }
        String xml = fetch(id);
        PublicationType type = classifier.classify(xml, id);
        if (type != PublicationType.AUCTION) {
            log.info("Publication {} is {}", id, type);
            return Optional.empty();
        }
        return Optional.of(parser.parse(xml, id));
    }

    private String fetch(String id) throws IngestionException {
        byte[] raw = client.fetchXml(id);
        try {
            return XmlSupport.decode(raw);
        } catch (IOException e) {
            throw new ParseException(id, "Cannot decode XML: " + e.getMessage(), e);
        }
    }
}
