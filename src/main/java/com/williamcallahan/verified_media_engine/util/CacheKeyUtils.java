package com.williamcallahan.verified_media_engine.util;

import com.williamcallahan.verified_media_engine.model.HistoricalEvent;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pure derivations from an event description
 * - Result cache fingerprint
 * - Source search term
 */
public final class CacheKeyUtils {

    static final int KEY_WORD_LIMIT = 8;
    static final int KEY_MIN_WORD_LENGTH = 4;
    static final int SEARCH_TERM_WORD_LIMIT = 8;
    public static final int DESCRIPTION_PREFIX_LENGTH = 100;

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CacheKeyUtils() {
    }

    /**
     * Builds the content-addressed cache key for an event
     * - Lower-cases the description and drops everything but word characters and whitespace
     * - Keeps the first 8 words of at least 4 characters, in order
     * - Result is {@code <year>_<word>_<word>...}
     *
     * @param event the event to fingerprint
     * @return deterministic cache key
     */
    public static String deriveKey(HistoricalEvent event) {
        String normalized = NON_WORD.matcher(event.description().toLowerCase(Locale.ROOT)).replaceAll("");
        String words = Arrays.stream(WHITESPACE.split(normalized.trim()))
            .filter(word -> word.length() >= KEY_MIN_WORD_LENGTH)
            .limit(KEY_WORD_LIMIT)
            .collect(Collectors.joining("_"));
        return event.year() + "_" + words;
    }

    /**
     * First 8 whitespace-separated words of the description, original casing kept
     */
    public static String searchTerm(HistoricalEvent event) {
        String trimmed = event.description().trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Arrays.stream(WHITESPACE.split(trimmed))
            .limit(SEARCH_TERM_WORD_LIMIT)
            .collect(Collectors.joining(" "));
    }

    public static String descriptionPrefix(HistoricalEvent event) {
        String description = event.description();
        return description.length() > DESCRIPTION_PREFIX_LENGTH
            ? description.substring(0, DESCRIPTION_PREFIX_LENGTH)
            : description;
    }
}
