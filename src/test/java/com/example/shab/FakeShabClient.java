package com.example.shab;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory SHAB API serving fixtures. Unknown ids answer 404; ids can be made to fail
 * a number of times before they succeed.
 */
class FakeShabClient implements ShabClient {
    private final Map<String, byte[]> publications = new ConcurrentHashMap<>();
    private final Map<String, byte[]> offices = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> xmlCalls = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> officeCalls = new ConcurrentHashMap<>();

    FakeShabClient withPublication(String id, String fixture) {
        publications.put(id, Fixtures.bytes(fixture));
        return this;
    }

    FakeShabClient withPublication(String id, byte[] body) {
        publications.put(id, body);
        return this;
    }

    FakeShabClient withOffice(String officeId, String fixture) {
        offices.put(officeId, Fixtures.bytes(fixture));
        return this;
    }

    /** The next {@code times} fetches of {@code id}, XML or office, fail with a timeout. */
    FakeShabClient failing(String id, int times) {
        failuresLeft.put(id, new AtomicInteger(times));
        return this;
    }

    int xmlCalls(String id) {
        AtomicInteger calls = xmlCalls.get(id);
        return calls == null ? 0 : calls.get();
    }

    int officeCalls(String officeId) {
        AtomicInteger calls = officeCalls.get(officeId);
        return calls == null ? 0 : calls.get();
    }

    @Override
    public byte[] fetchXml(String publicationId) throws FetchException {
        xmlCalls.computeIfAbsent(publicationId, k -> new AtomicInteger()).incrementAndGet();
        maybeFail(publicationId);
        byte[] body = publications.get(publicationId);
        if (body == null) {
            throw new FetchException(publicationId, 404, "SHAB returned HTTP 404 for publication " + publicationId);
        }
        return body;
    }

    @Override
    public Optional<byte[]> fetchContactJson(String officeId) throws FetchException {
        officeCalls.computeIfAbsent(officeId, k -> new AtomicInteger()).incrementAndGet();
        maybeFail(officeId);
        return Optional.ofNullable(offices.get(officeId));
    }

    private void maybeFail(String id) throws FetchException {
        AtomicInteger left = failuresLeft.get(id);
        if (left != null && left.getAndDecrement() > 0) {
            throw new FetchException(id, "Timed out fetching " + id, new java.net.SocketTimeoutException("Read timed out"));
        }
    }
}
