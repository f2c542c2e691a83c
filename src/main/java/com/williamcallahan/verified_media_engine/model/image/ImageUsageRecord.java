package com.williamcallahan.verified_media_engine.model.image;

import java.time.Instant;

/**
 * Persisted record of an image that was selected, used to avoid posting the same picture twice
 */
public class ImageUsageRecord {

    private String hash;
    private String url;
    private String source;
    private Instant usedAt;
    private String description;

    public ImageUsageRecord() {
    }

    public ImageUsageRecord(String hash, String url, String source, Instant usedAt, String description) {
        this.hash = hash;
        this.url = url;
        this.source = source;
        this.usedAt = usedAt;
        this.description = description;
    }

    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public Instant getUsedAt() { return usedAt; }
    public void setUsedAt(Instant usedAt) { this.usedAt = usedAt; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
