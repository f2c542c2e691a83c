package com.williamcallahan.verified_media_engine.source;

import com.williamcallahan.verified_media_engine.model.image.FetchedImage;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieval capability for one image source
 * - An empty result means the source had nothing for the term
 * - A failed future means the source could not be reached; callers isolate it
 */
public interface ImageSourceFetcher {

    /**
     * Registry name this fetcher serves, matching {@code app.media.sources[].name}
     */
    String sourceName();

    /**
     * Looks up and downloads an image for the term
     *
     * @param searchTerm words to search for
     * @param year event year, may be null when unknown
     * @return future of the fetched image, empty when none was found
     */
    CompletableFuture<Optional<FetchedImage>> fetch(String searchTerm, Integer year);
}
