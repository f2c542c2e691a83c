package com.williamcallahan.verified_media_engine.model.verification;

import java.util.Locale;

/**
 * Categorical judgment of how well an image matches an event
 * - Only APPROVED can lead to an accepted selection
 * - ERROR is produced locally when the oracle could not be consulted
 */
public enum Verdict {
    /**
     * Image clearly shows the event, person or era
     */
    APPROVED,

    /**
     * Loosely related or generic image
     */
    QUESTIONABLE,

    /**
     * Wrong person, wrong era, modern photo or unrelated
     */
    WRONG,

    /**
     * Verification could not be completed (transport or parse failure)
     */
    ERROR;

    /**
     * Lenient parse of an oracle supplied verdict
     *
     * @param raw verdict text, may be null or in any case
     * @return the matching verdict, QUESTIONABLE when missing or unrecognised
     */
    public static Verdict fromOracle(String raw) {
        if (raw == null || raw.isBlank()) {
            return QUESTIONABLE;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Verdict verdict : values()) {
            if (verdict.name().equals(normalized)) {
                return verdict;
            }
        }
        return QUESTIONABLE;
    }
}
