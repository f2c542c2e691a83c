package com.williamcallahan.verified_media_engine.model.image;

/**
 * Raw result of a single source fetch, before any quality checks
 *
 * @param bytes raw image payload as downloaded
 * @param metadata source supplied metadata
 */
public record FetchedImage(byte[] bytes, CandidateMetadata metadata) {

    public int byteSize() {
        return bytes == null ? 0 : bytes.length;
    }
}
