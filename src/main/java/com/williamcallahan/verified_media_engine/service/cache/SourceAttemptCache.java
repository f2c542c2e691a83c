package com.williamcallahan.verified_media_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Remembers (source, search term) pairs that recently produced no image
 * - Entries expire after the configured TTL so sources are retried eventually
 * - Transport failures are not recorded; only clean "nothing found" answers are
 */
@Service
public class SourceAttemptCache {

    private final Cache<String, Boolean> knownMisses;

    public SourceAttemptCache(AppConfigurationProperties properties) {
        AppConfigurationProperties.AttemptCache settings = properties.getAttemptCache();
        this.knownMisses = Caffeine.newBuilder()
            .maximumSize(settings.getMaxSize())
            .expireAfterWrite(settings.getTtlMinutes(), TimeUnit.MINUTES)
            .build();
    }

    public boolean isKnownMiss(String sourceName, String searchTerm) {
        return knownMisses.getIfPresent(key(sourceName, searchTerm)) != null;
    }

    public void recordMiss(String sourceName, String searchTerm) {
        knownMisses.put(key(sourceName, searchTerm), Boolean.TRUE);
    }

    public void invalidateAll() {
        knownMisses.invalidateAll();
    }

    private static String key(String sourceName, String searchTerm) {
        return sourceName + "|" + (searchTerm == null ? "" : searchTerm.trim().toLowerCase(Locale.ROOT));
    }
}
