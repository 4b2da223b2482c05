package com.example.shab;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Builds the pipeline from {@link Config} once per process. Components receive their
 * collaborators through constructors and never read {@link Config} themselves.
 */
public class AppContext {
    private static ObjectMapper objectMapper;
    private static ShabClient shabClient;
    private static DatabaseManager databaseManager;
    private static IngestionService ingestionService;
    private static BootstrapOrchestrator orchestrator;

    /**
     * @throws ConfigurationException when a setting is invalid or the database is unusable
     */
    public static synchronized void init() {
        if (ingestionService != null) {
            return;
        }
        validateBaseUrl(Config.getBaseUrl());
        requirePositive("shab.timeoutMillis", Config.getTimeoutMillis());
        requirePositive("ingest.batchSize", Config.getBatchSize());
        requirePositive("ingest.maxAttempts", Config.getMaxAttempts());

        objectMapper = createObjectMapper();
        shabClient = new JsoupShabClient(Config.getBaseUrl(), Config.getXmlPath(), Config.getOfficePath(),
                Config.getTimeoutMillis(), Config.getUserAgent());
        ContactLookup contactLookup = new JsonContactLookup(shabClient, new OfficeJsonReader(objectMapper));
        databaseManager = new DatabaseManager(Config.getDbUrl(), Config.getDbBusyTimeoutMillis(), objectMapper);
        ingestionService = new IngestionService(shabClient, new PublicationClassifier(),
                new ShabParser(contactLookup), databaseManager, Config.isSkipKnownBeforeFetch());
        orchestrator = new BootstrapOrchestrator(ingestionService, Config.getMaxAttempts(), Config.getRetryBackoff());
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static void validateBaseUrl(String baseUrl) {
        try {
            URI uri = new URI(baseUrl);
            if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                throw new ConfigurationException("shab.baseUrl must be an absolute http(s) URL: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("shab.baseUrl is malformed: " + baseUrl, e);
        }
    }

    static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, was " + value);
        }
    }

    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static DatabaseManager getDatabaseManager() {
        return databaseManager;
    }

    public static IngestionService getIngestionService() {
        return ingestionService;
    }

    public static BootstrapOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
