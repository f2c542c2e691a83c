package com.williamcallahan.verified_media_engine.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local document store, used in the test profile and as the fallback for tests
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(documents.get(key));
    }

    @Override
    public void set(String key, String json) {
        documents.put(key, json);
    }

    @Override
    public List<String> list() {
        return new ArrayList<>(documents.keySet());
    }

    @Override
    public void delete(String key) {
        documents.remove(key);
    }
}
