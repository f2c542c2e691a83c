package com.williamcallahan.verified_media_engine.model.selection;

/**
 * Stages a single selection moves through
 */
public enum SelectionState {
    CACHE_CHECK,
    FETCHING,
    FILTERING,
    SCORING,
    DECIDING,
    ACCEPTED,
    REJECTED
}
