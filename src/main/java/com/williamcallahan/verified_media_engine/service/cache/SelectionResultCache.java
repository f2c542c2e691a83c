package com.williamcallahan.verified_media_engine.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.cache.CacheEntry;
import com.williamcallahan.verified_media_engine.model.cache.CacheStats;
import com.williamcallahan.verified_media_engine.model.cache.CachedSelection;
import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.JsonDocument;
import com.williamcallahan.verified_media_engine.util.CacheKeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed cache of accepted selections
 *
 * Features:
 * - Keys derived from the event year and the significant words of its description
 * - {@link #lookup} has a write side effect (lastUsed, useCount); {@link #peek} does not
 * - Age and capacity eviction, run before a store once the map outgrows its headroom
 * - Read failures behave as an empty cache, write failures are logged and ignored
 */
@Service
public class SelectionResultCache {

    private static final Logger logger = LoggerFactory.getLogger(SelectionResultCache.class);
    public static final String DOCUMENT_KEY = "image-cache";

    private final JsonDocument<LinkedHashMap<String, CacheEntry>> document;
    private final AppConfigurationProperties.Cache settings;
    private final Clock clock;

    public SelectionResultCache(DocumentStore documentStore,
                                ObjectMapper objectMapper,
                                AppConfigurationProperties properties,
                                Clock clock) {
        this.document = new JsonDocument<>(documentStore, objectMapper, DOCUMENT_KEY,
            new TypeReference<LinkedHashMap<String, CacheEntry>>() {}, LinkedHashMap::new);
        this.settings = properties.getCache();
        this.clock = clock;
    }

    /**
     * Finds the cached selection for an event and records the use
     *
     * @param event event to look up
     * @return the entry after its lastUsed/useCount were updated, or empty on a miss
     */
    public Optional<CacheEntry> lookup(HistoricalEvent event) {
        String key = CacheKeyUtils.deriveKey(event);
        CacheEntry hit = document.updateIfChanged(entries -> {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            entry.setLastUsed(clock.instant());
            entry.setUseCount(entry.getUseCount() + 1);
            return Optional.of(entry);
        });
        if (hit == null) {
            logger.debug("Result cache miss for {}", key);
            return Optional.empty();
        }
        logger.info("Result cache hit for {} (used {} times, source {}, confidence {})",
            key, hit.getUseCount(), hit.getSource(), hit.getConfidence());
        return Optional.of(hit);
    }

    /**
     * Finds the cached selection without touching it
     */
    public Optional<CacheEntry> peek(HistoricalEvent event) {
        return Optional.ofNullable(document.read().get(CacheKeyUtils.deriveKey(event)));
    }

    /**
     * Records an accepted selection, replacing any previous entry for the same key
     */
    public void store(HistoricalEvent event, CachedSelection selection) {
        String key = CacheKeyUtils.deriveKey(event);
        document.update(entries -> {
            if (entries.size() > settings.getMaxEntries() * settings.getEvictionHeadroom()) {
                evictInPlace(entries);
            }
            Instant now = clock.instant();
            CacheEntry entry = new CacheEntry();
            entry.setKey(key);
            entry.setSource(selection.source());
            entry.setConfidence(selection.confidence());
            entry.setVerdict(selection.verdict());
            entry.setStyleInfo(selection.styleInfo());
            entry.setSearchTerm(selection.searchTerm());
            entry.setImageUrl(selection.imageUrl());
            entry.setCachedAt(now);
            entry.setLastUsed(now);
            entry.setUseCount(1);
            entry.setEventYear(event.year());
            entry.setEventDescriptionPrefix(CacheKeyUtils.descriptionPrefix(event));
            entries.remove(key);
            entries.put(key, entry);
            return null;
        });
        logger.info("Cached selection for {} (source {}, confidence {})", key, selection.source(), selection.confidence());
    }

    /**
     * Drops stale entries, then the least recently used ones beyond capacity
     *
     * @return number of entries removed
     */
    public int evict() {
        return document.update(this::evictInPlace);
    }

    private int evictInPlace(Map<String, CacheEntry> entries) {
        int before = entries.size();
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.getMaxAgeDays()));
        entries.values().removeIf(entry -> entry.getCachedAt() == null || !entry.getCachedAt().isAfter(cutoff));

        if (entries.size() > settings.getMaxEntries()) {
            List<Map.Entry<String, CacheEntry>> byRecency = new ArrayList<>(entries.entrySet());
            byRecency.sort(Comparator.comparing(
                (Map.Entry<String, CacheEntry> e) -> e.getValue().getLastUsed(),
                Comparator.nullsLast(Comparator.reverseOrder())));
            Map<String, CacheEntry> kept = new LinkedHashMap<>();
            for (Map.Entry<String, CacheEntry> e : byRecency.subList(0, settings.getMaxEntries())) {
                kept.put(e.getKey(), e.getValue());
            }
            entries.clear();
            entries.putAll(kept);
        }
        int removed = before - entries.size();
        if (removed > 0) {
            logger.info("Result cache eviction removed {} entries, {} remain", removed, entries.size());
        }
        return removed;
    }

    /**
     * Empties the cache
     */
    public void clear() {
        document.reset();
        logger.info("Result cache cleared");
    }

    public CacheStats stats() {
        Map<String, CacheEntry> entries = document.read();
        if (entries.isEmpty()) {
            return CacheStats.empty();
        }
        long totalUses = 0;
        long confidenceSum = 0;
        Instant oldest = null;
        for (CacheEntry entry : entries.values()) {
            totalUses += entry.getUseCount();
            confidenceSum += entry.getConfidence();
            if (entry.getCachedAt() != null && (oldest == null || entry.getCachedAt().isBefore(oldest))) {
                oldest = entry.getCachedAt();
            }
        }
        return new CacheStats(entries.size(), totalUses, (double) confidenceSum / entries.size(), oldest);
    }
}
