package com.williamcallahan.verified_media_engine.model.cache;

import java.time.Instant;

/**
 * Snapshot of the result cache for diagnostics
 *
 * @param totalEntries number of cached selections
 * @param totalUses sum of use counts
 * @param averageConfidence mean confidence, 0 when empty
 * @param oldestEntry earliest cachedAt, null when empty
 */
public record CacheStats(int totalEntries, long totalUses, double averageConfidence, Instant oldestEntry) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0.0, null);
    }
}
