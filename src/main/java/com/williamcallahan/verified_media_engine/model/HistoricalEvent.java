package com.williamcallahan.verified_media_engine.model;

import java.util.Objects;

/**
 * The historical fact a selection is illustrating
 * - Supplied by the caller and never mutated
 *
 * @param year year the event took place (negative for BCE)
 * @param description free-text description of the event
 */
public record HistoricalEvent(int year, String description) {

    public HistoricalEvent {
        Objects.requireNonNull(description, "description");
    }

    /**
     * Short form used in log lines
     */
    public String logLabel() {
        String trimmed = description.length() > 60 ? description.substring(0, 60) + "..." : description;
        return year + " - " + trimmed;
    }
}
