package com.williamcallahan.verified_media_engine.model.image;

/**
 * Descriptive metadata a source returns alongside the raw image payload
 *
 * @param title archive or page title, may be null
 * @param url original image URL, may be null
 * @param date date string as reported by the source, may be null
 * @param searchTerm search term used to query the source
 */
public record CandidateMetadata(String title, String url, String date, String searchTerm) {

    public static CandidateMetadata forSearchTerm(String searchTerm) {
        return new CandidateMetadata(null, null, null, searchTerm);
    }

    /**
     * Returns a copy carrying the given search term when the source left it blank
     */
    public CandidateMetadata withSearchTermFallback(String fallback) {
        if (searchTerm != null && !searchTerm.isBlank()) {
            return this;
        }
        return new CandidateMetadata(title, url, date, fallback);
    }
}
