package com.williamcallahan.verified_media_engine.service.style;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementRecord;
import com.williamcallahan.verified_media_engine.model.style.StyleRecord;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.service.engagement.EngagementStore;
import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.JsonDocument;
import com.williamcallahan.verified_media_engine.storage.RecordLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Learns which visual styles earn engagement and discourages repetition
 *
 * Features:
 * - Records the style of every accepted selection
 * - Scores a profile by the average engagement of past selections sharing each of its values
 * - Applies a repetition penalty when recent selections are not diverse
 * - Falls back to the neutral score on any failure
 */
@Service
public class StylePreferenceService {

    private static final Logger logger = LoggerFactory.getLogger(StylePreferenceService.class);
    public static final String DOCUMENT_KEY = "image-styles";
    static final double NEUTRAL_SCORE = 50.0;

    private final JsonDocument<RecordLog<StyleRecord>> document;
    private final EngagementStore engagementStore;
    private final AppConfigurationProperties.Style settings;
    private final Clock clock;

    public StylePreferenceService(DocumentStore documentStore,
                                  ObjectMapper objectMapper,
                                  EngagementStore engagementStore,
                                  AppConfigurationProperties properties,
                                  Clock clock) {
        this.document = new JsonDocument<>(documentStore, objectMapper, DOCUMENT_KEY,
            new TypeReference<RecordLog<StyleRecord>>() {}, RecordLog::new);
        this.engagementStore = engagementStore;
        this.settings = properties.getStyle();
        this.clock = clock;
    }

    /**
     * Records the style of a selection
     */
    public void track(String selectionId, StyleProfile profile) {
        StyleRecord record = new StyleRecord(selectionId, clock.instant(), profile);
        document.update(log -> {
            log.append(record, settings.getMaxRecords());
            return null;
        });
        logger.debug("Tracked style {} for selection {}", profile, selectionId);
    }

    /**
     * Learned preference for a profile in [0, 100]
     */
    public double preferenceScore(StyleProfile profile) {
        try {
            List<StyleRecord> styles = document.read().getRecords();
            Map<String, Double> engagementById = new HashMap<>();
            for (EngagementRecord record : engagementStore.records()) {
                if (record.hasMetrics()) {
                    engagementById.put(record.getSelectionId(), record.engagementScore());
                }
            }

            double total = 0.0;
            int contributing = 0;
            for (Map.Entry<String, String> dimension : profile.dimensions().entrySet()) {
                double sum = 0.0;
                int samples = 0;
                for (StyleRecord style : styles) {
                    Double engagement = engagementById.get(style.getSelectionId());
                    if (engagement != null && dimension.getValue().equals(style.toProfile().dimensions().get(dimension.getKey()))) {
                        sum += engagement;
                        samples++;
                    }
                }
                if (samples >= settings.getMinSamples()) {
                    total += (sum / samples) * settings.getEngagementScale();
                    contributing++;
                }
            }
            double score = contributing > 0 ? total / contributing : NEUTRAL_SCORE;

            if (diversityScore(styles) < settings.getDiversityThreshold()) {
                long repeats = lastN(styles, settings.getRepeatWindow()).stream()
                    .filter(style -> profile.type().equals(style.toProfile().type()))
                    .count();
                if (repeats >= 2) {
                    score *= settings.getRepeatPenalty();
                    logger.debug("Style type '{}' repeated {} times recently, penalizing", profile.type(), repeats);
                }
            }
            return Math.max(0.0, Math.min(100.0, score));
        } catch (RuntimeException e) {
            logger.warn("Style preference scoring failed for {}, using neutral score: {}", profile, e.getMessage());
            return NEUTRAL_SCORE;
        }
    }

    /**
     * Variety of the most recent styles in [0, 100]; 100 when there is too little history
     */
    public double diversityScore() {
        return diversityScore(document.read().getRecords());
    }

    private double diversityScore(List<StyleRecord> styles) {
        List<StyleRecord> recent = lastN(styles, settings.getDiversityWindow());
        if (recent.size() < 2) {
            return 100.0;
        }
        Set<String> types = new HashSet<>();
        Set<String> eras = new HashSet<>();
        Set<String> colorSchemes = new HashSet<>();
        for (StyleRecord style : recent) {
            StyleProfile profile = style.toProfile();
            types.add(profile.type());
            eras.add(profile.era());
            colorSchemes.add(profile.colorScheme());
        }
        double meanDistinct = (types.size() + eras.size() + colorSchemes.size()) / 3.0;
        return meanDistinct / recent.size() * 100.0;
    }

    private static List<StyleRecord> lastN(List<StyleRecord> styles, int n) {
        return styles.subList(Math.max(0, styles.size() - n), styles.size());
    }
}
