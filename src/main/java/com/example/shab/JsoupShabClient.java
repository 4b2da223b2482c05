package com.example.shab;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Slf4j
public class JsoupShabClient implements ShabClient {
    private final String baseUrl;
    private final String xmlPath;
    private final String officePath;
    private final int timeoutMillis;
    private final String userAgent;

    /**
     * @param xmlPath    path below the base URL with an {@code {id}} placeholder
     * @param officePath same for the office JSON document
     */
    public JsoupShabClient(String baseUrl, String xmlPath, String officePath, int timeoutMillis, String userAgent) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.xmlPath = xmlPath;
        this.officePath = officePath;
        this.timeoutMillis = timeoutMillis;
        this.userAgent = userAgent;
    }

    @Override
    public byte[] fetchXml(String publicationId) throws FetchException {
        Connection.Response response = get(publicationId, url(xmlPath, publicationId), "application/xml");
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchException(publicationId, response.statusCode(),
                    "SHAB returned HTTP " + response.statusCode() + " for publication " + publicationId);
        }
        byte[] body = response.bodyAsBytes();
        log.debug("Fetched {} bytes of XML for {}", body.length, publicationId);
        return body;
    }

    @Override
    public Optional<byte[]> fetchContactJson(String officeId) throws FetchException {
        Connection.Response response = get(officeId, url(officePath, officeId), "application/json");
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchException(officeId, response.statusCode(),
                    "SHAB returned HTTP " + response.statusCode() + " for office " + officeId);
        }
        return Optional.of(response.bodyAsBytes());
    }

    String url(String pathTemplate, String id) {
        return baseUrl + pathTemplate.replace("{id}", URLEncoder.encode(id, StandardCharsets.UTF_8));
    }

    private Connection.Response get(String id, String url, String accept) throws FetchException {
        try {
            return Jsoup.connect(url)
                    .userAgent(userAgent)
                    .header("Accept", accept)
                    .timeout(timeoutMillis)
                    .maxBodySize(0)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .followRedirects(true)
                    .method(Connection.Method.GET)
                    .execute();
        } catch (SocketTimeoutException e) {
            throw new FetchException(id, "Timed out after " + timeoutMillis + " ms fetching " + url, e);
        } catch (IOException e) {
            throw new FetchException(id, "Error fetching " + url + ": " + e.getMessage(), e);
        }
    }
}
