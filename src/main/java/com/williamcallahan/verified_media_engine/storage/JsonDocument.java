package com.williamcallahan.verified_media_engine.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One typed JSON document inside a {@link DocumentStore}, guarded by a whole-document lock
 * - Missing, unreadable or unparsable documents read as a fresh empty value
 * - Failed writes are logged and swallowed; the in-memory result is still returned
 *
 * @param <T> document type
 */
public class JsonDocument<T> {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocument.class);

    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final String key;
    private final TypeReference<T> type;
    private final Supplier<T> emptyFactory;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonDocument(DocumentStore store, ObjectMapper objectMapper, String key,
                        TypeReference<T> type, Supplier<T> emptyFactory) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.key = key;
        this.type = type;
        this.emptyFactory = emptyFactory;
    }

    public String key() {
        return key;
    }

    /**
     * Reads the document without writing it back
     */
    public T read() {
        lock.lock();
        try {
            return load();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-modify-write under the lock
     * - The mutation may change the document in place
     * - The document is persisted after the mutation returns, even when it returns null
     *
     * @param mutation changes the document and computes a result
     * @return whatever the mutation returned
     */
    public <R> R update(Function<T, R> mutation) {
        lock.lock();
        try {
            T document = load();
            R result = mutation.apply(document);
            persist(document);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read under the lock, persisting only when the callback reports a change
     */
    public <R> R updateIfChanged(Function<T, Optional<R>> mutation) {
        lock.lock();
        try {
            T document = load();
            Optional<R> result = mutation.apply(document);
            if (result.isPresent()) {
                persist(document);
            }
            return result.orElse(null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the stored document with a fresh empty value
     */
    public void reset() {
        lock.lock();
        try {
            persist(emptyFactory.get());
        } finally {
            lock.unlock();
        }
    }

    private T load() {
        Optional<String> raw;
        try {
            raw = store.get(key);
        } catch (DocumentStoreException e) {
            logger.warn("Document {} could not be read, using empty value: {}", key, e.getMessage());
            return emptyFactory.get();
        }
        if (raw.isEmpty() || raw.get().isBlank()) {
            return emptyFactory.get();
        }
        try {
            T parsed = objectMapper.readValue(raw.get(), type);
            return parsed == null ? emptyFactory.get() : parsed;
        } catch (JsonProcessingException e) {
            logger.warn("Document {} is not valid JSON, using empty value: {}", key, e.getOriginalMessage());
            return emptyFactory.get();
        }
    }

    private void persist(T document) {
        try {
            store.set(key, objectMapper.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            logger.error("Document {} could not be serialized", key, e);
        } catch (DocumentStoreException e) {
            logger.error("Document {} could not be written: {}", key, e.getMessage(), e);
        }
    }
}
