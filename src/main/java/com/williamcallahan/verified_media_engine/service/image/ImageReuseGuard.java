package com.williamcallahan.verified_media_engine.service.image;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.image.ImageUsageRecord;
import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.JsonDocument;
import com.williamcallahan.verified_media_engine.storage.RecordLog;
import com.williamcallahan.verified_media_engine.util.ContentHashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps the same picture from being selected twice within the cooldown
 * - Matches on the SHA-256 of the bytes, or on the original URL when one is known
 * - Newest usage first; only the newest records are kept
 */
@Service
public class ImageReuseGuard {

    private static final Logger logger = LoggerFactory.getLogger(ImageReuseGuard.class);
    public static final String DOCUMENT_KEY = "image-usage";
    private static final int DESCRIPTION_LIMIT = 100;

    private final JsonDocument<RecordLog<ImageUsageRecord>> document;
    private final AppConfigurationProperties.Reuse settings;
    private final Clock clock;

    public ImageReuseGuard(DocumentStore documentStore,
                           ObjectMapper objectMapper,
                           AppConfigurationProperties properties,
                           Clock clock) {
        this.document = new JsonDocument<>(documentStore, objectMapper, DOCUMENT_KEY,
            new TypeReference<RecordLog<ImageUsageRecord>>() {}, RecordLog::new);
        this.settings = properties.getReuse();
        this.clock = clock;
    }

    /**
     * Whether the image, or the URL it came from, was selected within the cooldown
     *
     * @param imageBytes image payload
     * @param url original URL, may be null
     */
    public boolean wasRecentlyUsed(byte[] imageBytes, String url) {
        String hash = ContentHashUtils.sha256Hex(imageBytes);
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.getCooldownDays()));
        for (ImageUsageRecord record : document.read().getRecords()) {
            if (record.getUsedAt() == null || record.getUsedAt().isBefore(cutoff)) {
                continue;
            }
            boolean sameHash = hash.equals(record.getHash());
            boolean sameUrl = url != null && !url.isBlank() && url.equals(record.getUrl());
            if (sameHash || sameUrl) {
                logger.info("Image {} was already used on {} (source {})", hash.substring(0, 12), record.getUsedAt(), record.getSource());
                return true;
            }
        }
        return false;
    }

    /**
     * Records a selected image
     */
    public void markUsed(byte[] imageBytes, String url, String sourceName, String description) {
        String trimmed = description == null ? "" : description.substring(0, Math.min(DESCRIPTION_LIMIT, description.length()));
        ImageUsageRecord record = new ImageUsageRecord(ContentHashUtils.sha256Hex(imageBytes), url, sourceName,
            clock.instant(), trimmed);
        document.update(log -> {
            log.prepend(record, settings.getMaxRecords());
            return null;
        });
        logger.debug("Marked image {} from {} as used", record.getHash().substring(0, 12), sourceName);
    }
}
