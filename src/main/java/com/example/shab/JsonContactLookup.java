package com.example.shab;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves office contacts through the SHAB office JSON document.
 */
@Slf4j
public class JsonContactLookup implements ContactLookup {
    private final ShabClient client;
    private final OfficeJsonReader reader;

    public JsonContactLookup(ShabClient client, OfficeJsonReader reader) {
        this.client = client;
        this.reader = reader;
    }

    @Override
    public Optional<OfficeContact> lookup(String officeId) {
        if (officeId == null || officeId.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<byte[]> json = client.fetchContactJson(officeId);
            if (json.isEmpty()) {
                log.info("No office document for {}, keeping XML contact", officeId);
                return Optional.empty();
            }
            return reader.read(json.get());
        } catch (FetchException e) {
            log.warn("Office lookup failed for {}: {}", officeId, e.getMessage());
        } catch (IOException e) {
            log.warn("Office document for {} is not valid JSON: {}", officeId, e.getMessage());
        }
        return Optional.empty();
    }
}
