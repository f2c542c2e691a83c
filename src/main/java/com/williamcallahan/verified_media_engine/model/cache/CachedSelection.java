package com.williamcallahan.verified_media_engine.model.cache;

import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;

/**
 * What the engine hands to the result cache when a selection is accepted
 *
 * @param source winning source name
 * @param confidence verification confidence
 * @param verdict verification verdict
 * @param styleInfo style classification of the winner
 * @param searchTerm term used to fetch the winner, reused on re-fetch
 * @param imageUrl original URL of the winner, may be null
 */
public record CachedSelection(String source,
                              int confidence,
                              Verdict verdict,
                              StyleProfile styleInfo,
                              String searchTerm,
                              String imageUrl) {
}
