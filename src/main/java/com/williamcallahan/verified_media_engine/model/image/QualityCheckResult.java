package com.williamcallahan.verified_media_engine.model.image;

/**
 * Outcome of the pre-scoring quality filter
 *
 * @param passed whether the image may go on to AI scoring
 * @param reason human readable explanation, always present
 * @param metadata decoded properties, null when the payload could not be decoded
 */
public record QualityCheckResult(boolean passed, String reason, QualityMetadata metadata) {

    public static QualityCheckResult pass(String reason, QualityMetadata metadata) {
        return new QualityCheckResult(true, reason, metadata);
    }

    public static QualityCheckResult reject(String reason, QualityMetadata metadata) {
        return new QualityCheckResult(false, reason, metadata);
    }
}
