package com.williamcallahan.verified_media_engine.model.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;

import java.time.Instant;

/**
 * Metadata of a previously accepted selection, keyed by event fingerprint
 * - Holds no image bytes; a hit requires a fresh fetch from {@link #getSource()}
 * - {@code lastUsed} and {@code useCount} change on every hit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheEntry {

    private String key;
    private String source;
    private int confidence;
    private Verdict verdict;
    private StyleProfile styleInfo;
    private Instant cachedAt;
    private Instant lastUsed;
    private int useCount;
    private int eventYear;
    private String eventDescriptionPrefix;
    private String searchTerm;
    private String imageUrl;

    public CacheEntry() {
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public int getConfidence() { return confidence; }
    public void setConfidence(int confidence) { this.confidence = confidence; }

    public Verdict getVerdict() { return verdict; }
    public void setVerdict(Verdict verdict) { this.verdict = verdict; }

    public StyleProfile getStyleInfo() { return styleInfo; }
    public void setStyleInfo(StyleProfile styleInfo) { this.styleInfo = styleInfo; }

    public Instant getCachedAt() { return cachedAt; }
    public void setCachedAt(Instant cachedAt) { this.cachedAt = cachedAt; }

    public Instant getLastUsed() { return lastUsed; }
    public void setLastUsed(Instant lastUsed) { this.lastUsed = lastUsed; }

    public int getUseCount() { return useCount; }
    public void setUseCount(int useCount) { this.useCount = useCount; }

    public int getEventYear() { return eventYear; }
    public void setEventYear(int eventYear) { this.eventYear = eventYear; }

    public String getEventDescriptionPrefix() { return eventDescriptionPrefix; }
    public void setEventDescriptionPrefix(String eventDescriptionPrefix) { this.eventDescriptionPrefix = eventDescriptionPrefix; }

    public String getSearchTerm() { return searchTerm; }
    public void setSearchTerm(String searchTerm) { this.searchTerm = searchTerm; }

    public String getImageUrl() { return imageUrl; }
    public void setImageUrl(String imageUrl) { this.imageUrl = imageUrl; }
}
