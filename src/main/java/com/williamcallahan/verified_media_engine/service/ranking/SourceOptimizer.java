package com.williamcallahan.verified_media_engine.service.ranking;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.engagement.SourcePerformance;
import com.williamcallahan.verified_media_engine.service.engagement.EngagementStore;
import com.williamcallahan.verified_media_engine.source.ImageSource;
import com.williamcallahan.verified_media_engine.source.ImageSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks sources by historical engagement with an exploration penalty
 *
 * Features:
 * - Sources with enough samples are scored by average engagement
 * - Thinly sampled sources are discounted, unsampled ones get the neutral base score
 * - Each recent use of a source multiplies its score by the recency factor
 * - Ordering is stable: ties keep registry order
 */
@Service
public class SourceOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(SourceOptimizer.class);

    private final EngagementStore engagementStore;
    private final ImageSourceRegistry sourceRegistry;
    private final AppConfigurationProperties.Optimizer settings;
    private final int defaultRecentWindow;

    public SourceOptimizer(EngagementStore engagementStore,
                           ImageSourceRegistry sourceRegistry,
                           AppConfigurationProperties properties) {
        this.engagementStore = engagementStore;
        this.sourceRegistry = sourceRegistry;
        this.settings = properties.getOptimizer();
        this.defaultRecentWindow = properties.getEngagement().getRecentWindow();
    }

    /**
     * Priority of one source in [0, 100]
     *
     * @param sourceName source to score
     * @param recentSources names of recently used sources, repeats allowed
     */
    public double priority(String sourceName, Collection<String> recentSources) {
        return priority(sourceName, recentSources, engagementStore.sourcePerformance());
    }

    private double priority(String sourceName, Collection<String> recentSources, Map<String, SourcePerformance> performance) {
        SourcePerformance stats = performance.get(sourceName);
        double score = settings.getBaseScore();
        if (stats != null) {
            switch (stats.confidence()) {
                case HIGH -> score = stats.averageEngagement() * settings.getEngagementScale();
                case MEDIUM -> score = stats.averageEngagement() * settings.getEngagementScale()
                    * settings.getMediumConfidenceDiscount();
                case LOW -> score = settings.getBaseScore();
            }
        }
        if (recentSources != null) {
            long recentUses = recentSources.stream().filter(sourceName::equals).count();
            score *= Math.pow(settings.getRecencyFactor(), recentUses);
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    /**
     * Every configured source, highest priority first, ties in registry order
     */
    public List<String> order(Collection<String> recentSources) {
        Map<String, SourcePerformance> performance = engagementStore.sourcePerformance();
        List<ImageSource> sources = sourceRegistry.sources();
        List<ScoredSource> scored = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            String name = sources.get(i).name();
            scored.add(new ScoredSource(name, priority(name, recentSources, performance), i));
        }
        scored.sort(Comparator.comparingDouble(ScoredSource::score).reversed()
            .thenComparingInt(ScoredSource::registryIndex));
        List<String> ordered = scored.stream().map(ScoredSource::name).toList();
        logger.debug("Source order {} for recent sources {}", ordered, recentSources);
        return ordered;
    }

    /**
     * Order using the default window of most recently used sources
     */
    public List<String> order() {
        return order(recentSources(defaultRecentWindow));
    }

    public List<String> recentSources(int limit) {
        return engagementStore.recentSources(limit);
    }

    public Map<String, SourcePerformance> performance() {
        return engagementStore.sourcePerformance();
    }

    /**
     * Aggregates sorted by average engagement, best first
     */
    public List<SourcePerformance> rankedSources() {
        List<SourcePerformance> ranked = new ArrayList<>(engagementStore.sourcePerformance().values());
        ranked.sort(Comparator.comparingDouble(SourcePerformance::averageEngagement).reversed());
        return ranked;
    }

    private record ScoredSource(String name, double score, int registryIndex) {
    }
}
