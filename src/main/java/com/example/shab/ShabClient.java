package com.example.shab;

import java.util.Optional;

/**
 * HTTP access to the SHAB API. One GET per call, no retries; retry policy lives in
 * {@link BootstrapOrchestrator}.
 */
public interface ShabClient {

    /**
     * @return raw XML body of the publication
     * @throws FetchException on transport failure, timeout or non-2xx status
     */
    byte[] fetchXml(String publicationId) throws FetchException;

    /**
     * @return raw JSON body of the office document, empty when the API has no such office (404)
     * @throws FetchException on transport failure, timeout or any other non-2xx status
     */
    Optional<byte[]> fetchContactJson(String officeId) throws FetchException;
}
