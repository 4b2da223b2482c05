package com.example.shab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings from {@code application.properties} on the classpath. A system property with the
 * same key overrides the file, e.g. {@code -Dingest.batchSize=10}.
 */
public class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Properties properties = new Properties();
    private static final String CONFIG_FILE = "application.properties";

    static {
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is == null) {
                throw new IOException("Resource not found: " + CONFIG_FILE);
            }
            properties.load(is);
        } catch (IOException e) {
            logger.error("Error loading config, using defaults: {}", e.getMessage());
        }
    }

    static String get(String key, String defaultValue) {
        String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        String value = properties.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not a number: " + value, e);
        }
    }

    public static String getBaseUrl() {
        return get("shab.baseUrl", "https://www.shab.ch/api/v1");
    }

    public static String getXmlPath() {
        return get("shab.xmlPath", "/publications/{id}/xml");
    }

    public static String getOfficePath() {
        return get("shab.officePath", "/registration-offices/{id}");
    }

    public static int getTimeoutMillis() {
        return getInt("shab.timeoutMillis", 15000);
    }

    public static String getUserAgent() {
        return get("shab.userAgent", "Mozilla/5.0 (compatible; shab-auction-ingest)");
    }

    public static String getDbUrl() {
        return get("db.url", "data/auctions.db");
    }

    public static int getDbBusyTimeoutMillis() {
        return getInt("db.busyTimeoutMillis", 10000);
    }

    public static int getBatchSize() {
        return getInt("ingest.batchSize", 5);
    }

    public static Duration getInterBatchDelay() {
        return Duration.ofMillis(getInt("ingest.interBatchDelayMillis", 1000));
    }

    public static int getMaxAttempts() {
        return getInt("ingest.maxAttempts", 2);
    }

    public static Duration getRetryBackoff() {
        return Duration.ofMillis(getInt("ingest.retryBackoffMillis", 2000));
    }

    public static boolean isSkipKnownBeforeFetch() {
        return Boolean.parseBoolean(get("ingest.skipKnownBeforeFetch", "true"));
    }

    public static String getIdsFile() {
        return get("ingest.idsFile", "data/publication-ids.txt");
    }

    public static String getCron() {
        return get("ingest.cron", "0 0 6 * * ?");
    }
}
