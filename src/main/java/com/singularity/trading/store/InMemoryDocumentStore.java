package com.singularity.trading.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-local document store with the same compare-and-set contract as the remote stores.
 * Used when no remote backend is configured, and in tests.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, VersionedDocument> documents = new HashMap<>();
    private long revision;

    @Override
    public synchronized VersionedDocument read(String key) {
        return documents.getOrDefault(key, VersionedDocument.absent());
    }

    @Override
    public synchronized WriteResult writeIfVersion(String key, String body, String expectedVersionToken) {
        String currentToken = read(key).getVersionToken();
        if (!Objects.equals(currentToken, expectedVersionToken)) {
            return WriteResult.conflict();
        }
        return put(key, body);
    }

    @Override
    public synchronized WriteResult writeUnconditionally(String key, String body) {
        return put(key, body);
    }

    private WriteResult put(String key, String body) {
        String token = "v" + (++revision);
        documents.put(key, VersionedDocument.of(body, token));
        return WriteResult.committed(token);
    }
}
