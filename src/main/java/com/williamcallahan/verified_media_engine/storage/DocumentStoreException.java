package com.williamcallahan.verified_media_engine.storage;

/**
 * Unchecked failure raised by a {@link DocumentStore} backend
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
