package com.williamcallahan.verified_media_engine.model.image;

/**
 * Technical properties read from an image payload
 *
 * @param width pixel width
 * @param height pixel height
 * @param byteSize payload size in bytes
 * @param format lower-case format name reported by the decoder ("jpeg", "png"), may be null
 */
public record QualityMetadata(int width, int height, long byteSize, String format) {

    public double aspectRatio() {
        return height == 0 ? 0.0 : (double) width / height;
    }
}
