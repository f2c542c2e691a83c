package com.williamcallahan.verified_media_engine.model.engagement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;

import java.time.Instant;

/**
 * One past selection and, once reported, its downstream engagement
 * - Engagement fields stay null until metrics arrive
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngagementRecord {

    private String selectionId;
    private Instant timestamp;
    private String sourceName;
    private int confidence;
    private Verdict verdict;
    private Long likes;
    private Long retweets;
    private Long replies;
    private Long impressions;
    private Instant updatedAt;

    public EngagementRecord() {
    }

    public EngagementRecord(String selectionId, Instant timestamp, String sourceName, int confidence, Verdict verdict) {
        this.selectionId = selectionId;
        this.timestamp = timestamp;
        this.sourceName = sourceName;
        this.confidence = confidence;
        this.verdict = verdict;
    }

    @JsonIgnore
    public boolean hasMetrics() {
        return likes != null;
    }

    /**
     * Weighted engagement: likes + 2 x retweets + 1.5 x replies
     */
    @JsonIgnore
    public double engagementScore() {
        return nullToZero(likes) + nullToZero(retweets) * 2.0 + nullToZero(replies) * 1.5;
    }

    public void applyMetrics(EngagementMetrics metrics, Instant now) {
        this.likes = metrics.likes();
        this.retweets = metrics.retweets();
        this.replies = metrics.replies();
        this.impressions = metrics.impressions();
        this.updatedAt = now;
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }

    public String getSelectionId() { return selectionId; }
    public void setSelectionId(String selectionId) { this.selectionId = selectionId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }

    public int getConfidence() { return confidence; }
    public void setConfidence(int confidence) { this.confidence = confidence; }

    public Verdict getVerdict() { return verdict; }
    public void setVerdict(Verdict verdict) { this.verdict = verdict; }

    public Long getLikes() { return likes; }
    public void setLikes(Long likes) { this.likes = likes; }

    public Long getRetweets() { return retweets; }
    public void setRetweets(Long retweets) { this.retweets = retweets; }

    public Long getReplies() { return replies; }
    public void setReplies(Long replies) { this.replies = replies; }

    public Long getImpressions() { return impressions; }
    public void setImpressions(Long impressions) { this.impressions = impressions; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
