package com.williamcallahan.verified_media_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared image sources, bound from {@code app.media.sources}
 */
@Component
@ConfigurationProperties(prefix = "app.media")
public class MediaSourceProperties {

    private List<Source> sources = new ArrayList<>();

    public List<Source> getSources() { return sources; }
    public void setSources(List<Source> sources) { this.sources = sources; }

    public static class Source {
        private String name;
        private boolean enabled = true;
        private int priorityRank = Integer.MAX_VALUE;
        private int reliabilityScore = 50;
        private long timeoutMs = 10000;

        public Source() {
        }

        public Source(String name, boolean enabled, int priorityRank, int reliabilityScore, long timeoutMs) {
            this.name = name;
            this.enabled = enabled;
            this.priorityRank = priorityRank;
            this.reliabilityScore = reliabilityScore;
            this.timeoutMs = timeoutMs;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPriorityRank() { return priorityRank; }
        public void setPriorityRank(int priorityRank) { this.priorityRank = priorityRank; }

        public int getReliabilityScore() { return reliabilityScore; }
        public void setReliabilityScore(int reliabilityScore) { this.reliabilityScore = reliabilityScore; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }
}
