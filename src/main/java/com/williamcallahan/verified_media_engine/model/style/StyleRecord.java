package com.williamcallahan.verified_media_engine.model.style;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;

import java.time.Instant;

/**
 * Style of a past selection, joined with engagement records by selection id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StyleRecord {

    private String selectionId;
    private Instant timestamp;
    private String type;
    private String era;
    private String colorScheme;

    public StyleRecord() {
    }

    public StyleRecord(String selectionId, Instant timestamp, StyleProfile profile) {
        this.selectionId = selectionId;
        this.timestamp = timestamp;
        this.type = profile.type();
        this.era = profile.era();
        this.colorScheme = profile.colorScheme();
    }

    public StyleProfile toProfile() {
        return new StyleProfile(type, era, colorScheme);
    }

    public String getSelectionId() { return selectionId; }
    public void setSelectionId(String selectionId) { this.selectionId = selectionId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getEra() { return era; }
    public void setEra(String era) { this.era = era; }

    public String getColorScheme() { return colorScheme; }
    public void setColorScheme(String colorScheme) { this.colorScheme = colorScheme; }
}
