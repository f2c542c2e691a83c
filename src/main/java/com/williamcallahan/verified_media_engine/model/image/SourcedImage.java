package com.williamcallahan.verified_media_engine.model.image;

/**
 * A fetched image tagged with the source that produced it
 */
public record SourcedImage(String sourceName, FetchedImage image) {
}
