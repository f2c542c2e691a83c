package com.williamcallahan.verified_media_engine.model.verification;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Visual style classification of an image
 *
 * @param type photograph, illustration, painting, engraving, map, document
 * @param era modern, vintage, historical, ancient
 * @param colorScheme color, black-and-white, sepia
 */
public record StyleProfile(String type, String era, String colorScheme) {

    public static final String UNKNOWN = "unknown";

    public StyleProfile {
        type = normalize(type);
        era = normalize(era);
        colorScheme = normalize(colorScheme);
    }

    public static StyleProfile unknown() {
        return new StyleProfile(UNKNOWN, UNKNOWN, UNKNOWN);
    }

    /**
     * Dimension name to value, in a stable order
     */
    public Map<String, String> dimensions() {
        Map<String, String> dimensions = new LinkedHashMap<>();
        dimensions.put("type", type);
        dimensions.put("era", era);
        dimensions.put("colorScheme", colorScheme);
        return dimensions;
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
