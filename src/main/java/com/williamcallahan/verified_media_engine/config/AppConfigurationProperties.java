package com.williamcallahan.verified_media_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for selection, caching, ranking and scoring, bound from {@code app.*}
 * - Defaults here match application.yml so services can be built without Spring in tests
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Engagement engagement = new Engagement();

    @NestedConfigurationProperty
    private Optimizer optimizer = new Optimizer();

    @NestedConfigurationProperty
    private Quality quality = new Quality();

    @NestedConfigurationProperty
    private Selection selection = new Selection();

    @NestedConfigurationProperty
    private Style style = new Style();

    @NestedConfigurationProperty
    private Reuse reuse = new Reuse();

    @NestedConfigurationProperty
    private AttemptCache attemptCache = new AttemptCache();

    @NestedConfigurationProperty
    private Storage storage = new Storage();

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Engagement getEngagement() { return engagement; }
    public void setEngagement(Engagement engagement) { this.engagement = engagement; }

    public Optimizer getOptimizer() { return optimizer; }
    public void setOptimizer(Optimizer optimizer) { this.optimizer = optimizer; }

    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }

    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public Style getStyle() { return style; }
    public void setStyle(Style style) { this.style = style; }

    public Reuse getReuse() { return reuse; }
    public void setReuse(Reuse reuse) { this.reuse = reuse; }

    public AttemptCache getAttemptCache() { return attemptCache; }
    public void setAttemptCache(AttemptCache attemptCache) { this.attemptCache = attemptCache; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public static class Cache {
        private int maxEntries = 500;
        private int maxAgeDays = 90;
        private double evictionHeadroom = 1.1;

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }

        public double getEvictionHeadroom() { return evictionHeadroom; }
        public void setEvictionHeadroom(double evictionHeadroom) { this.evictionHeadroom = evictionHeadroom; }
    }

    public static class Engagement {
        private int maxRecords = 100;
        private int recentWindow = 5;

        public int getMaxRecords() { return maxRecords; }
        public void setMaxRecords(int maxRecords) { this.maxRecords = maxRecords; }

        public int getRecentWindow() { return recentWindow; }
        public void setRecentWindow(int recentWindow) { this.recentWindow = recentWindow; }
    }

    public static class Optimizer {
        private double baseScore = 50.0;
        private double engagementScale = 10.0;
        private double mediumConfidenceDiscount = 0.7;
        private double recencyFactor = 0.8;

        public double getBaseScore() { return baseScore; }
        public void setBaseScore(double baseScore) { this.baseScore = baseScore; }

        public double getEngagementScale() { return engagementScale; }
        public void setEngagementScale(double engagementScale) { this.engagementScale = engagementScale; }

        public double getMediumConfidenceDiscount() { return mediumConfidenceDiscount; }
        public void setMediumConfidenceDiscount(double mediumConfidenceDiscount) { this.mediumConfidenceDiscount = mediumConfidenceDiscount; }

        public double getRecencyFactor() { return recencyFactor; }
        public void setRecencyFactor(double recencyFactor) { this.recencyFactor = recencyFactor; }
    }

    public static class Quality {
        private int minWidth = 600;
        private int minHeight = 600;
        private int floorWidth = 600;
        private int floorHeight = 400;
        private long minBytes = 30 * 1024L;
        private long maxBytes = 5 * 1024 * 1024L;
        private double minAspectRatio = 0.33;
        private double maxAspectRatio = 3.0;
        private List<String> rejectedFormats = new ArrayList<>(List.of("svg"));

        public int getMinWidth() { return minWidth; }
        public void setMinWidth(int minWidth) { this.minWidth = minWidth; }

        public int getMinHeight() { return minHeight; }
        public void setMinHeight(int minHeight) { this.minHeight = minHeight; }

        public int getFloorWidth() { return floorWidth; }
        public void setFloorWidth(int floorWidth) { this.floorWidth = floorWidth; }

        public int getFloorHeight() { return floorHeight; }
        public void setFloorHeight(int floorHeight) { this.floorHeight = floorHeight; }

        public long getMinBytes() { return minBytes; }
        public void setMinBytes(long minBytes) { this.minBytes = minBytes; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public double getMinAspectRatio() { return minAspectRatio; }
        public void setMinAspectRatio(double minAspectRatio) { this.minAspectRatio = minAspectRatio; }

        public double getMaxAspectRatio() { return maxAspectRatio; }
        public void setMaxAspectRatio(double maxAspectRatio) { this.maxAspectRatio = maxAspectRatio; }

        public List<String> getRejectedFormats() { return rejectedFormats; }
        public void setRejectedFormats(List<String> rejectedFormats) { this.rejectedFormats = rejectedFormats; }
    }

    public static class Selection {
        private int topSources = 3;
        private long fanOutDeadlineMs = 20000;
        private long scoringDeadlineMs = 60000;
        private long blockingTimeoutMs = 120000;

        public int getTopSources() { return topSources; }
        public void setTopSources(int topSources) { this.topSources = topSources; }

        public long getFanOutDeadlineMs() { return fanOutDeadlineMs; }
        public void setFanOutDeadlineMs(long fanOutDeadlineMs) { this.fanOutDeadlineMs = fanOutDeadlineMs; }

        public long getScoringDeadlineMs() { return scoringDeadlineMs; }
        public void setScoringDeadlineMs(long scoringDeadlineMs) { this.scoringDeadlineMs = scoringDeadlineMs; }

        public long getBlockingTimeoutMs() { return blockingTimeoutMs; }
        public void setBlockingTimeoutMs(long blockingTimeoutMs) { this.blockingTimeoutMs = blockingTimeoutMs; }
    }

    public static class Style {
        private int maxRecords = 100;
        private int minSamples = 2;
        private double engagementScale = 5.0;
        private int diversityWindow = 5;
        private int repeatWindow = 3;
        private double diversityThreshold = 50.0;
        private double repeatPenalty = 0.7;

        public int getMaxRecords() { return maxRecords; }
        public void setMaxRecords(int maxRecords) { this.maxRecords = maxRecords; }

        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }

        public double getEngagementScale() { return engagementScale; }
        public void setEngagementScale(double engagementScale) { this.engagementScale = engagementScale; }

        public int getDiversityWindow() { return diversityWindow; }
        public void setDiversityWindow(int diversityWindow) { this.diversityWindow = diversityWindow; }

        public int getRepeatWindow() { return repeatWindow; }
        public void setRepeatWindow(int repeatWindow) { this.repeatWindow = repeatWindow; }

        public double getDiversityThreshold() { return diversityThreshold; }
        public void setDiversityThreshold(double diversityThreshold) { this.diversityThreshold = diversityThreshold; }

        public double getRepeatPenalty() { return repeatPenalty; }
        public void setRepeatPenalty(double repeatPenalty) { this.repeatPenalty = repeatPenalty; }
    }

    public static class Reuse {
        private int cooldownDays = 30;
        private int maxRecords = 100;

        public int getCooldownDays() { return cooldownDays; }
        public void setCooldownDays(int cooldownDays) { this.cooldownDays = cooldownDays; }

        public int getMaxRecords() { return maxRecords; }
        public void setMaxRecords(int maxRecords) { this.maxRecords = maxRecords; }
    }

    public static class AttemptCache {
        private long ttlMinutes = 60;
        private long maxSize = 1000;

        public long getTtlMinutes() { return ttlMinutes; }
        public void setTtlMinutes(long ttlMinutes) { this.ttlMinutes = ttlMinutes; }

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }
    }

    public static class Storage {
        private String type = "auto";
        private String dir = "data/media";
        private String redisKeyPrefix = "media:doc:";

        /**
         * "auto" picks Redis when a connection is configured and the filesystem otherwise; "memory" keeps documents in-process
         */
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }

        public String getRedisKeyPrefix() { return redisKeyPrefix; }
        public void setRedisKeyPrefix(String redisKeyPrefix) { this.redisKeyPrefix = redisKeyPrefix; }
    }
}
