package com.williamcallahan.verified_media_engine.model.engagement;

/**
 * Engagement counts reported for a posted selection
 * - Missing counts are treated as zero
 */
public record EngagementMetrics(long likes, long retweets, long replies, long impressions) {

    public EngagementMetrics {
        if (likes < 0 || retweets < 0 || replies < 0 || impressions < 0) {
            throw new IllegalArgumentException("Engagement counts must not be negative");
        }
    }
}
