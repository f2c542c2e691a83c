package com.williamcallahan.verified_media_engine.service.image;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.image.QualityCheckResult;
import com.williamcallahan.verified_media_engine.model.image.QualityMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic rejection of unusable images before any AI call
 *
 * Features:
 * - Reads dimensions from the image header without decoding pixels
 * - Enforces minimum dimensions, byte size bounds and aspect ratio bounds
 * - Rejects formats on the configured deny list (SVG by default)
 * - Never throws: null, empty or undecodable payloads are rejected with a reason
 */
@Service
public class ImageQualityFilter {

    private static final Logger logger = LoggerFactory.getLogger(ImageQualityFilter.class);
    static final String FAILURE_PREFIX = "quality check failed";
    private static final int SNIFF_LENGTH = 512;

    private final AppConfigurationProperties.Quality settings;
    private final int minWidth;
    private final int minHeight;
    private final List<String> rejectedFormats;

    public ImageQualityFilter(AppConfigurationProperties properties) {
        this.settings = properties.getQuality();
        this.minWidth = Math.max(settings.getMinWidth(), settings.getFloorWidth());
        this.minHeight = Math.max(settings.getMinHeight(), settings.getFloorHeight());
        this.rejectedFormats = settings.getRejectedFormats() == null ? List.of()
            : settings.getRejectedFormats().stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
        logger.info("Image quality filter: min {}x{}, {}-{} bytes, aspect {}-{}, rejected formats {}",
            minWidth, minHeight, settings.getMinBytes(), settings.getMaxBytes(),
            settings.getMinAspectRatio(), settings.getMaxAspectRatio(), rejectedFormats);
    }

    /**
     * Checks a raw payload
     *
     * @param imageBytes raw image bytes, may be null
     * @return pass or reject with reason; metadata is null when the payload could not be read
     */
    public QualityCheckResult check(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return QualityCheckResult.reject(FAILURE_PREFIX + ": empty payload", null);
        }
        if (looksLikeSvg(imageBytes)) {
            QualityMetadata metadata = new QualityMetadata(0, 0, imageBytes.length, "svg");
            if (rejectedFormats.contains("svg")) {
                return QualityCheckResult.reject("format svg is not accepted", metadata);
            }
            return QualityCheckResult.reject(FAILURE_PREFIX + ": vector images cannot be measured", metadata);
        }

        QualityMetadata metadata;
        try {
            metadata = readMetadata(imageBytes);
        } catch (IOException | RuntimeException e) {
            logger.debug("Image header could not be read: {}", e.getMessage());
            return QualityCheckResult.reject(FAILURE_PREFIX + ": " + e.getMessage(), null);
        }
        if (metadata == null) {
            return QualityCheckResult.reject(FAILURE_PREFIX + ": unrecognized image format", null);
        }
        return evaluate(metadata);
    }

    private QualityCheckResult evaluate(QualityMetadata metadata) {
        if (metadata.format() != null && rejectedFormats.contains(metadata.format())) {
            return QualityCheckResult.reject("format " + metadata.format() + " is not accepted", metadata);
        }
        if (metadata.width() < minWidth || metadata.height() < minHeight) {
            return QualityCheckResult.reject(String.format("too small: %dx%d (minimum %dx%d)",
                metadata.width(), metadata.height(), minWidth, minHeight), metadata);
        }
        if (metadata.byteSize() < settings.getMinBytes()) {
            return QualityCheckResult.reject(String.format("file too small: %.1fKB (likely low quality)",
                metadata.byteSize() / 1024.0), metadata);
        }
        if (metadata.byteSize() > settings.getMaxBytes()) {
            return QualityCheckResult.reject(String.format("file too large: %.1fMB",
                metadata.byteSize() / (1024.0 * 1024.0)), metadata);
        }
        double aspectRatio = metadata.aspectRatio();
        if (aspectRatio < settings.getMinAspectRatio() || aspectRatio > settings.getMaxAspectRatio()) {
            return QualityCheckResult.reject(String.format("unusual aspect ratio: %.2f", aspectRatio), metadata);
        }
        return QualityCheckResult.pass(String.format("quality ok: %dx%d, %.1fKB, %s",
            metadata.width(), metadata.height(), metadata.byteSize() / 1024.0, metadata.format()), metadata);
    }

    private QualityMetadata readMetadata(byte[] imageBytes) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            if (input == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                String format = reader.getFormatName() == null ? null : reader.getFormatName().toLowerCase(Locale.ROOT);
                if ("jpg".equals(format)) {
                    format = "jpeg";
                }
                return new QualityMetadata(width, height, imageBytes.length, format);
            } finally {
                reader.dispose();
            }
        }
    }

    private static boolean looksLikeSvg(byte[] imageBytes) {
        String head = new String(imageBytes, 0, Math.min(SNIFF_LENGTH, imageBytes.length), StandardCharsets.UTF_8)
            .trim()
            .toLowerCase(Locale.ROOT);
        return head.startsWith("<svg") || (head.startsWith("<?xml") && head.contains("<svg"));
    }
}
