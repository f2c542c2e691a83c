package com.williamcallahan.verified_media_engine.service.ai;

/**
 * Raised when the vision oracle cannot be consulted at all
 */
public class OracleUnavailableException extends RuntimeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
