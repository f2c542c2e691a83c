package com.williamcallahan.verified_media_engine.model.engagement;

/**
 * Totals over the engagement log
 *
 * @param totalRecords records currently retained
 * @param recordsWithMetrics records whose metrics have arrived
 * @param averageLikes mean likes over records with metrics
 * @param averageRetweets mean retweets over records with metrics
 * @param averageReplies mean replies over records with metrics
 */
public record EngagementStats(int totalRecords,
                              int recordsWithMetrics,
                              double averageLikes,
                              double averageRetweets,
                              double averageReplies) {

    public static EngagementStats empty() {
        return new EngagementStats(0, 0, 0.0, 0.0, 0.0);
    }

    public double averageEngagement() {
        return averageLikes + averageRetweets + averageReplies;
    }
}
