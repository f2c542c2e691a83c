package com.williamcallahan.verified_media_engine.model.image;

/**
 * An unverified image fetched from one source for one event
 * - Only candidates that passed the quality filter are constructed
 *
 * @param sourceName registry name of the source that produced the image
 * @param imageBytes raw image payload
 * @param metadata source supplied metadata
 * @param quality decoded technical properties
 */
public record ImageCandidate(String sourceName,
                             byte[] imageBytes,
                             CandidateMetadata metadata,
                             QualityMetadata quality) {
}
