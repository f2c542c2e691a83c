package com.williamcallahan.verified_media_engine.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key-value storage of whole JSON documents
 * - Callers own locking around read-modify-write sequences
 * - Implementations throw {@link DocumentStoreException} on backend failure
 */
public interface DocumentStore {

    /**
     * Raw JSON stored under the key, empty when the key was never written
     */
    Optional<String> get(String key);

    /**
     * Replaces the document stored under the key
     */
    void set(String key, String json);

    /**
     * Keys currently present, in no particular order
     */
    List<String> list();

    /**
     * Removes the document; a missing key is not an error
     */
    void delete(String key);
}
