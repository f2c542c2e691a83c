package com.williamcallahan.verified_media_engine.service.engagement;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementMetrics;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementRecord;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementStats;
import com.williamcallahan.verified_media_engine.model.engagement.SourcePerformance;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.JsonDocument;
import com.williamcallahan.verified_media_engine.storage.RecordLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded log of past selections and the engagement they earned
 * - Records are appended at selection time with empty engagement fields
 * - Metrics are applied once per selection; later reports for the same id are ignored
 * - Only the newest records are retained
 */
@Service
public class EngagementStore {

    private static final Logger logger = LoggerFactory.getLogger(EngagementStore.class);
    public static final String DOCUMENT_KEY = "image-engagement";

    private final JsonDocument<RecordLog<EngagementRecord>> document;
    private final AppConfigurationProperties.Engagement settings;
    private final Clock clock;

    public EngagementStore(DocumentStore documentStore,
                           ObjectMapper objectMapper,
                           AppConfigurationProperties properties,
                           Clock clock) {
        this.document = new JsonDocument<>(documentStore, objectMapper, DOCUMENT_KEY,
            new TypeReference<RecordLog<EngagementRecord>>() {}, RecordLog::new);
        this.settings = properties.getEngagement();
        this.clock = clock;
    }

    /**
     * Appends a selection with no engagement yet
     */
    public void recordSelection(String selectionId, String sourceName, int confidence, Verdict verdict) {
        EngagementRecord record = new EngagementRecord(selectionId, clock.instant(), sourceName, confidence, verdict);
        document.update(log -> {
            log.append(record, settings.getMaxRecords());
            return null;
        });
        logger.debug("Recorded selection {} from {}", selectionId, sourceName);
    }

    /**
     * Applies engagement metrics to a previously recorded selection
     *
     * @return true when the metrics were applied, false for an unknown id or one that already has metrics
     */
    public boolean updateEngagement(String selectionId, EngagementMetrics metrics) {
        Boolean applied = document.updateIfChanged(log -> {
            for (EngagementRecord record : log.getRecords()) {
                if (!record.getSelectionId().equals(selectionId)) {
                    continue;
                }
                if (record.hasMetrics()) {
                    logger.info("Engagement for selection {} already recorded, ignoring update", selectionId);
                    return Optional.empty();
                }
                record.applyMetrics(metrics, clock.instant());
                return Optional.of(Boolean.TRUE);
            }
            logger.warn("No selection record found for {}, engagement ignored", selectionId);
            return Optional.empty();
        });
        if (applied == null) {
            return false;
        }
        logger.info("Engagement recorded for selection {}: {} likes, {} retweets, {} replies",
            selectionId, metrics.likes(), metrics.retweets(), metrics.replies());
        return true;
    }

    /**
     * All retained records, oldest first
     */
    public List<EngagementRecord> records() {
        return document.read().getRecords();
    }

    /**
     * Source names of the newest records, oldest first
     */
    public List<String> recentSources(int limit) {
        return document.read().tail(limit).stream()
            .map(EngagementRecord::getSourceName)
            .toList();
    }

    /**
     * Per-source aggregate over records that have metrics, in first-seen order
     */
    public Map<String, SourcePerformance> sourcePerformance() {
        Map<String, double[]> totals = new LinkedHashMap<>();
        for (EngagementRecord record : records()) {
            if (!record.hasMetrics() || record.getSourceName() == null) {
                continue;
            }
            double[] sumAndCount = totals.computeIfAbsent(record.getSourceName(), name -> new double[2]);
            sumAndCount[0] += record.engagementScore();
            sumAndCount[1] += 1;
        }
        Map<String, SourcePerformance> performance = new LinkedHashMap<>();
        totals.forEach((name, sumAndCount) -> performance.put(name,
            new SourcePerformance(name, sumAndCount[0] / sumAndCount[1], (int) sumAndCount[1])));
        return performance;
    }

    public EngagementStats stats() {
        List<EngagementRecord> records = records();
        List<EngagementRecord> measured = records.stream().filter(EngagementRecord::hasMetrics).toList();
        if (measured.isEmpty()) {
            return new EngagementStats(records.size(), 0, 0.0, 0.0, 0.0);
        }
        double likes = measured.stream().mapToLong(EngagementRecord::getLikes).average().orElse(0);
        double retweets = measured.stream().mapToLong(r -> r.getRetweets() == null ? 0 : r.getRetweets()).average().orElse(0);
        double replies = measured.stream().mapToLong(r -> r.getReplies() == null ? 0 : r.getReplies()).average().orElse(0);
        return new EngagementStats(records.size(), measured.size(), likes, retweets, replies);
    }
}
