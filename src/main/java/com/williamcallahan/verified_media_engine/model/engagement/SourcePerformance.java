package com.williamcallahan.verified_media_engine.model.engagement;

/**
 * Aggregate engagement of one source, derived from the engagement log
 *
 * @param sourceName source registry name
 * @param averageEngagement mean weighted engagement of records with metrics
 * @param sampleCount number of records with metrics
 */
public record SourcePerformance(String sourceName, double averageEngagement, int sampleCount) {

    public static final int HIGH_CONFIDENCE_SAMPLES = 5;
    public static final int MEDIUM_CONFIDENCE_SAMPLES = 2;

    public Confidence confidence() {
        if (sampleCount >= HIGH_CONFIDENCE_SAMPLES) {
            return Confidence.HIGH;
        }
        return sampleCount >= MEDIUM_CONFIDENCE_SAMPLES ? Confidence.MEDIUM : Confidence.LOW;
    }

    public enum Confidence {
        HIGH,
        MEDIUM,
        LOW
    }
}
